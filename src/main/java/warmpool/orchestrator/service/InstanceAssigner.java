package warmpool.orchestrator.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import warmpool.orchestrator.config.PoolConfig;
import warmpool.orchestrator.error.InstanceAssignmentConflictException;
import warmpool.orchestrator.error.PoolException;
import warmpool.orchestrator.error.PoolExhaustedException;
import warmpool.orchestrator.error.SecretMissingException;
import warmpool.orchestrator.model.Assignment;
import warmpool.orchestrator.model.BootstrapSecret;
import warmpool.orchestrator.model.InstanceStatus;
import warmpool.orchestrator.model.PoolInstance;
import warmpool.orchestrator.model.ReleasePolicy;
import warmpool.orchestrator.provider.ComputeProvider;
import warmpool.orchestrator.provider.ResourceNotFoundException;
import warmpool.orchestrator.provider.SecretStore;
import warmpool.orchestrator.util.Backoff;
import warmpool.orchestrator.util.BoundedPoller;
import warmpool.orchestrator.util.PollOutcome;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Claims pool instances for tenants and hands them back.
 *
 * <p>Claiming is a label write with no compare-and-swap: two requests racing
 * for the same instance can both write, and the later write wins. The single
 * re-read after the write reports a lost race as
 * {@link InstanceAssignmentConflictException}; nothing repairs it.</p>
 */
public class InstanceAssigner {

    private static final Logger log = LoggerFactory.getLogger(InstanceAssigner.class);

    private final PoolInventory inventory;
    private final PoolReplenisher replenisher;
    private final ComputeProvider compute;
    private final SecretStore secrets;
    private final BoundedPoller poller;
    private final Executor background;
    private final PoolConfig config;

    public InstanceAssigner(PoolInventory inventory, PoolReplenisher replenisher, ComputeProvider compute,
                            SecretStore secrets, BoundedPoller poller, Executor background, PoolConfig config) {
        this.inventory = inventory;
        this.replenisher = replenisher;
        this.compute = compute;
        this.secrets = secrets;
        this.poller = poller;
        this.background = background;
        this.config = config;
    }

    public Assignment assign(String tenantId) {
        return assign(tenantId, null);
    }

    /**
     * Claim the first available instance for a tenant, cold-starting one if
     * the pool is empty, then trigger replenishment in the background.
     *
     * @param tenantId  owning tenant
     * @param tenantKey optional key recorded alongside the tenant
     * @throws PoolExhaustedException               pool empty and cold start failed or timed out
     * @throws SecretMissingException               chosen instance has no bootstrap secret
     * @throws InstanceAssignmentConflictException  re-read shows a different owner
     */
    public Assignment assign(String tenantId, String tenantKey) {
        if (tenantId == null || tenantId.isBlank()) {
            throw new IllegalArgumentException("tenantId is required");
        }

        List<PoolInstance> available = inventory.listAvailable();
        if (available.isEmpty()) {
            log.info("No available instances for tenant {}, cold-starting one", tenantId);
            available = coldStart();
        }

        PoolInstance instance = available.get(0);
        BootstrapSecret secret = readBootstrapSecret(instance);

        Map<String, String> labels = new HashMap<>();
        labels.put(PoolInventory.STATUS_LABEL, InstanceStatus.ASSIGNED.label());
        labels.put(PoolInventory.TENANT_ID_LABEL, tenantId);
        if (tenantKey != null && !tenantKey.isBlank()) {
            labels.put(PoolInventory.TENANT_KEY_LABEL, tenantKey);
        }
        compute.updateLabels(instance.id(), labels, Set.of());

        verifyOwnership(instance.id(), tenantId);
        log.info("Assigned instance {} to tenant {}", instance.id(), tenantId);

        replenishInBackground();

        return new Assignment(instance.id(), instance.privateIp(), instance.publicIp(),
                instance.subnetId(), secret);
    }

    /**
     * Hand an instance back.
     *
     * @param instanceId instance to release
     * @param policy     return to pool or terminate
     */
    public void release(String instanceId, ReleasePolicy policy) {
        switch (policy) {
            case RETURN_TO_POOL -> {
                compute.updateLabels(instanceId,
                        Map.of(PoolInventory.STATUS_LABEL, InstanceStatus.AVAILABLE.label()),
                        Set.of(PoolInventory.TENANT_ID_LABEL, PoolInventory.TENANT_KEY_LABEL));
                log.info("Returned instance {} to the pool", instanceId);
            }
            case TERMINATE -> {
                try {
                    compute.terminate(instanceId);
                    log.info("Terminated instance {}", instanceId);
                } catch (ResourceNotFoundException e) {
                    log.info("Instance {} already gone", instanceId);
                }
                replenishInBackground();
            }
        }
    }

    /**
     * Fire-and-forget {@code maintainPool}. Failures are logged, never surfaced.
     */
    public void replenishInBackground() {
        int target = config.targetSpare();
        try {
            background.execute(() -> {
                try {
                    replenisher.maintainPool(target);
                } catch (Exception e) {
                    log.error("Background pool replenishment failed", e);
                }
            });
        } catch (RejectedExecutionException e) {
            log.warn("Background replenishment not scheduled: {}", e.getMessage());
        }
    }

    private List<PoolInstance> coldStart() {
        String launchedId;
        try {
            launchedId = replenisher.launchOne();
        } catch (PoolException e) {
            throw new PoolExhaustedException("Pool is empty and cold-start launch failed", e);
        }

        PollOutcome<PoolInstance> ready = poller.poll(
                "instance " + launchedId + " to become available",
                config.coldStartTimeout(),
                Backoff.fixed(config.coldStartPollInterval()),
                () -> inventory.findById(launchedId).filter(PoolInstance::isAvailable));

        if (ready.isTimedOut()) {
            throw new PoolExhaustedException("Instance " + launchedId + " did not become available within "
                    + config.coldStartTimeout().toSeconds() + "s", ready.lastError().orElse(null));
        }

        List<PoolInstance> available = inventory.listAvailable();
        if (available.isEmpty()) {
            throw new PoolExhaustedException("Cold-started instance " + launchedId + " was claimed before use");
        }
        return available;
    }

    private BootstrapSecret readBootstrapSecret(PoolInstance instance) {
        String name = instance.secretName();
        Optional<Map<String, String>> entries;
        try {
            entries = secrets.read(name);
        } catch (RuntimeException e) {
            throw new SecretMissingException(instance.id(), name, e);
        }
        String value = entries.map(e -> e.get(config.bootstrapSecretEntry())).orElse(null);
        if (value == null || value.isBlank()) {
            throw new SecretMissingException(instance.id(), name);
        }
        return new BootstrapSecret(name, value);
    }

    private void verifyOwnership(String instanceId, String tenantId) {
        PoolInstance reread = inventory.findById(instanceId).orElse(null);
        if (reread == null) {
            throw new InstanceAssignmentConflictException(instanceId, tenantId, "<terminated>");
        }
        if (!reread.isAssignedTo(tenantId)) {
            String observed = reread.tenantId() != null ? reread.tenantId() : "<" + reread.status().label() + ">";
            throw new InstanceAssignmentConflictException(instanceId, tenantId, observed);
        }
    }
}
