package warmpool.orchestrator.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import warmpool.cloud.agent.AgentCommandService;
import warmpool.cloud.agent.HttpHealthProbe;
import warmpool.cloud.auth.CloudSession;
import warmpool.cloud.balancer.YandexLoadBalancer;
import warmpool.cloud.compute.YandexComputeProvider;
import warmpool.cloud.config.CloudConfig;
import warmpool.cloud.secrets.LockboxSecretStore;
import warmpool.cloud.support.OperationWaiter;
import warmpool.orchestrator.model.SubnetPlacement;
import warmpool.orchestrator.provider.CloudProviders;
import warmpool.orchestrator.provider.ComputeProvider;
import warmpool.orchestrator.scheduler.Scheduler;
import warmpool.orchestrator.service.CredentialMerger;
import warmpool.orchestrator.service.CredentialRotator;
import warmpool.orchestrator.service.InstanceAssigner;
import warmpool.orchestrator.service.NetworkRouter;
import warmpool.orchestrator.service.PoolInventory;
import warmpool.orchestrator.service.PoolReconciler;
import warmpool.orchestrator.service.PoolReplenisher;
import warmpool.orchestrator.service.ProvisioningOrchestrator;
import warmpool.orchestrator.service.RemoteCommandExecutor;
import warmpool.orchestrator.service.TenantNaming;
import warmpool.orchestrator.util.BoundedPoller;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Manual dependency injection container.
 * Builds one explicit pool service graph per process.
 *
 * Usage:
 *
 * <pre>
 * Dependencies deps = Dependencies.forYandex(PoolConfig.fromEnv(), cloudConfig);
 * deps.startScheduler();
 * ProvisionedTenant t = deps.orchestrator().createTenantInstance("tenant-a");
 * deps.close();
 * </pre>
 */
public final class Dependencies implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Dependencies.class);

    private static final Duration OPERATION_TIMEOUT = Duration.ofMinutes(5);
    private static final Duration AGENT_REQUEST_TIMEOUT = Duration.ofSeconds(15);

    private final PoolConfig config;
    private final CloudProviders providers;
    private final ExecutorService ownedBackground;

    private final TenantNaming naming;
    private final PoolInventory inventory;
    private final PoolReplenisher replenisher;
    private final InstanceAssigner assigner;
    private final NetworkRouter router;
    private final RemoteCommandExecutor commands;
    private final CredentialRotator credentials;
    private final PoolReconciler reconciler;
    private final ProvisioningOrchestrator orchestrator;

    // Scheduler (lazy-initialized)
    private Scheduler scheduler;

    private Dependencies(PoolConfig config, CloudProviders providers, List<SubnetPlacement> subnets,
                         BoundedPoller poller, Executor background, ExecutorService ownedBackground) {
        this.config = config;
        this.providers = providers;
        this.ownedBackground = ownedBackground;

        log.info("Initializing dependencies with config: {}", config);

        // Services
        this.naming = new TenantNaming(config);
        this.inventory = new PoolInventory(providers.compute(), naming, config);
        this.replenisher = new PoolReplenisher(providers.compute(), inventory, config, subnets);
        this.assigner = new InstanceAssigner(inventory, replenisher, providers.compute(), providers.secrets(),
                poller, background, config);
        this.router = new NetworkRouter(providers.loadBalancer(), naming, config);
        this.commands = new RemoteCommandExecutor(providers.commands(), poller, config);
        this.credentials = new CredentialRotator(providers.secrets(), commands, providers.healthProbe(),
                inventory, poller, new CredentialMerger(config.passthroughEnv()), naming, config);
        this.reconciler = new PoolReconciler(inventory, providers.compute(), config);
        this.orchestrator = new ProvisioningOrchestrator(inventory, replenisher, assigner, router, commands,
                providers.secrets(), naming, config);

        log.info("Dependencies initialized successfully");
    }

    /**
     * Wire the pool against arbitrary providers. Background replenishment
     * runs on {@code background}, which the caller owns.
     */
    public static Dependencies create(PoolConfig config, CloudProviders providers, List<SubnetPlacement> subnets,
                                      BoundedPoller poller, Executor background) {
        return new Dependencies(config, providers, subnets, poller, background, null);
    }

    /**
     * Wire the pool against Yandex Cloud.
     */
    public static Dependencies forYandex(PoolConfig config, CloudConfig cloud) {
        BoundedPoller poller = BoundedPoller.system();
        CloudSession session = new CloudSession(cloud);
        OperationWaiter waiter = new OperationWaiter(session.getOperationService(), OPERATION_TIMEOUT);

        ComputeProvider compute = new YandexComputeProvider(session, waiter, cloud, config.poolName());
        CloudProviders providers = new CloudProviders(
                compute,
                new YandexLoadBalancer(session, waiter, cloud, poller),
                new LockboxSecretStore(session, waiter, cloud.folderId()),
                new AgentCommandService(compute, new ObjectMapper(), cloud.agentPort(), cloud.agentToken(),
                        AGENT_REQUEST_TIMEOUT),
                new HttpHealthProbe(config.workloadPort(), config.healthPath(), Duration.ofSeconds(5)));

        ExecutorService background = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "warmpool-replenish");
            t.setDaemon(true);
            return t;
        });
        return new Dependencies(config, providers, cloud.subnets(), poller, background, background);
    }

    // Getters
    public PoolConfig config() {
        return config;
    }

    public CloudProviders providers() {
        return providers;
    }

    public TenantNaming naming() {
        return naming;
    }

    public PoolInventory inventory() {
        return inventory;
    }

    public PoolReplenisher replenisher() {
        return replenisher;
    }

    public InstanceAssigner assigner() {
        return assigner;
    }

    public NetworkRouter router() {
        return router;
    }

    public RemoteCommandExecutor commands() {
        return commands;
    }

    public CredentialRotator credentials() {
        return credentials;
    }

    public PoolReconciler reconciler() {
        return reconciler;
    }

    public ProvisioningOrchestrator orchestrator() {
        return orchestrator;
    }

    /**
     * Get the scheduler (creates it if not yet created).
     */
    public Scheduler scheduler() {
        if (scheduler == null) {
            scheduler = new Scheduler(replenisher, reconciler, config);
        }
        return scheduler;
    }

    public void startScheduler() {
        scheduler().start();
    }

    public void stopScheduler() {
        if (scheduler != null) {
            scheduler.stop();
        }
    }

    @Override
    public void close() {
        log.info("Closing dependencies...");

        if (scheduler != null) {
            try {
                scheduler.stop();
            } catch (Exception e) {
                log.warn("Error stopping scheduler: {}", e.getMessage());
            }
        }

        if (ownedBackground != null) {
            ownedBackground.shutdown();
            try {
                if (!ownedBackground.awaitTermination(5, TimeUnit.SECONDS)) {
                    ownedBackground.shutdownNow();
                }
            } catch (InterruptedException e) {
                ownedBackground.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }

        log.info("Dependencies closed");
    }
}
