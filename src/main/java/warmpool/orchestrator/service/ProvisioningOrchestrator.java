package warmpool.orchestrator.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import warmpool.orchestrator.config.PoolConfig;
import warmpool.orchestrator.error.PartialProvisioningFailureException;
import warmpool.orchestrator.model.Assignment;
import warmpool.orchestrator.model.BackendTarget;
import warmpool.orchestrator.model.CleanupReport;
import warmpool.orchestrator.model.PoolInstance;
import warmpool.orchestrator.model.PoolStats;
import warmpool.orchestrator.model.ProvisionedTenant;
import warmpool.orchestrator.model.ReleasePolicy;
import warmpool.orchestrator.model.ReplenishResult;
import warmpool.orchestrator.model.TeardownRequest;
import warmpool.orchestrator.model.TenantInstanceStatus;
import warmpool.orchestrator.model.TenantRoute;
import warmpool.orchestrator.provider.ResourceNotFoundException;
import warmpool.orchestrator.provider.SecretStore;

import java.util.Optional;
import java.util.function.Supplier;

/**
 * Creates and removes complete tenant environments: an assigned instance
 * reachable through its own route on the shared load balancer.
 *
 * <p>Creation rolls back in reverse order on failure. Teardown runs every
 * step independently and reports what happened; it never throws for a
 * single failed step.</p>
 */
public class ProvisioningOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(ProvisioningOrchestrator.class);

    public static final String STEP_DEREGISTER_TARGET = "deregister-target";
    public static final String STEP_DELETE_RULE = "delete-rule";
    public static final String STEP_DELETE_TARGET_GROUP = "delete-target-group";
    public static final String STEP_DELETE_ROUTE = "delete-route";
    public static final String STEP_RELEASE_INSTANCE = "release-instance";
    public static final String STEP_TERMINATE_INSTANCE = "terminate-instance";
    public static final String STEP_DELETE_BOOTSTRAP_SECRET = "delete-bootstrap-secret";
    public static final String STEP_DELETE_TENANT_KEYS = "delete-tenant-keys";

    private final PoolInventory inventory;
    private final PoolReplenisher replenisher;
    private final InstanceAssigner assigner;
    private final NetworkRouter router;
    private final RemoteCommandExecutor executor;
    private final SecretStore secrets;
    private final TenantNaming naming;
    private final PoolConfig config;

    public ProvisioningOrchestrator(PoolInventory inventory, PoolReplenisher replenisher, InstanceAssigner assigner,
                                    NetworkRouter router, RemoteCommandExecutor executor, SecretStore secrets,
                                    TenantNaming naming, PoolConfig config) {
        this.inventory = inventory;
        this.replenisher = replenisher;
        this.assigner = assigner;
        this.router = router;
        this.executor = executor;
        this.secrets = secrets;
        this.naming = naming;
        this.config = config;
    }

    public ProvisionedTenant createTenantInstance(String tenantId) {
        return createTenantInstance(tenantId, tenantId);
    }

    /**
     * Assign an instance, create the tenant's route and register the instance
     * behind it.
     *
     * @throws PartialProvisioningFailureException any step failed; completed
     *                                             steps have been undone as far as possible
     */
    public ProvisionedTenant createTenantInstance(String tenantId, String tenantKey) {
        String key = tenantKey == null || tenantKey.isBlank() ? tenantId : tenantKey;
        Assignment assignment = null;
        TenantRoute route = null;

        try {
            assignment = assigner.assign(tenantId, key);
            route = router.createRoute(key);
            BackendTarget target = router.targetFor(assignment.privateIp(), assignment.subnetId());
            router.registerTarget(route, target);

            ProvisionedTenant tenant = new ProvisionedTenant(tenantId, key, assignment.instanceId(),
                    assignment.privateIp(), assignment.publicIp(), route, naming.url(key), assignment.secret());
            log.info("Provisioned tenant {} on {} at {}", tenantId, assignment.instanceId(), tenant.url());
            return tenant;
        } catch (RuntimeException e) {
            log.error("Provisioning for tenant {} failed, rolling back", tenantId, e);
            CleanupReport report = rollback(assignment, route);
            throw new PartialProvisioningFailureException(tenantId, e, report);
        }
    }

    private CleanupReport rollback(Assignment assignment, TenantRoute route) {
        CleanupReport report = new CleanupReport();

        if (route == null) {
            report.skipped(STEP_DELETE_ROUTE);
        } else {
            try {
                router.deleteRoute(route);
                report.done(STEP_DELETE_ROUTE);
            } catch (RuntimeException e) {
                log.warn("Rollback: deleting route {} failed: {}", route.serviceName(), e.getMessage());
                report.failed(STEP_DELETE_ROUTE, e);
            }
        }

        if (assignment == null) {
            report.skipped(STEP_RELEASE_INSTANCE);
        } else {
            try {
                assigner.release(assignment.instanceId(), config.rollbackPolicy());
                report.done(STEP_RELEASE_INSTANCE);
            } catch (RuntimeException e) {
                log.warn("Rollback: releasing {} failed: {}", assignment.instanceId(), e.getMessage());
                report.failed(STEP_RELEASE_INSTANCE, e);
            }
        }

        log.info("Rollback finished: {}", report);
        return report;
    }

    /**
     * Remove everything belonging to a tenant environment. Missing ids are
     * looked up by deterministic name; unresolved steps are skipped.
     */
    public CleanupReport deleteTenantInstance(TeardownRequest request) {
        CleanupReport report = new CleanupReport();
        String tenantKey = request.tenantKey();

        Optional<PoolInstance> instance = Optional.ofNullable(request.instanceId())
                .flatMap(inventory::findById);
        Optional<String> targetGroupId = Optional.ofNullable(request.targetGroupId())
                .or(() -> lookup("target group", () -> router.lookupTargetGroup(tenantKey)));
        Optional<String> ruleId = Optional.ofNullable(request.ruleId())
                .or(() -> lookup("rule", () -> router.lookupRule(tenantKey)));

        if (targetGroupId.isPresent() && instance.isPresent() && instance.get().privateIp() != null) {
            PoolInstance i = instance.get();
            runStep(report, STEP_DEREGISTER_TARGET,
                    () -> router.deregisterTarget(targetGroupId.get(), router.targetFor(i.privateIp(), i.subnetId())));
        } else {
            skip(report, STEP_DEREGISTER_TARGET, tenantKey);
        }

        // rule before target group
        if (ruleId.isPresent()) {
            runStep(report, STEP_DELETE_RULE, () -> router.deleteRule(ruleId.get()));
        } else {
            skip(report, STEP_DELETE_RULE, tenantKey);
        }

        if (targetGroupId.isPresent()) {
            runStep(report, STEP_DELETE_TARGET_GROUP, () -> router.deleteTargetGroup(targetGroupId.get()));
        } else {
            skip(report, STEP_DELETE_TARGET_GROUP, tenantKey);
        }

        String instanceId = request.instanceId();
        if (instanceId == null || instanceId.isBlank()) {
            skip(report, STEP_TERMINATE_INSTANCE, tenantKey);
            skip(report, STEP_DELETE_BOOTSTRAP_SECRET, tenantKey);
            skip(report, STEP_DELETE_TENANT_KEYS, tenantKey);
        } else {
            runStep(report, STEP_TERMINATE_INSTANCE, () -> assigner.release(instanceId, ReleasePolicy.TERMINATE));
            runStep(report, STEP_DELETE_BOOTSTRAP_SECRET, () -> deleteSecret(naming.bootstrapSecretName(instanceId)));
            runStep(report, STEP_DELETE_TENANT_KEYS, () -> deleteSecret(naming.tenantKeysSecretName(instanceId)));
        }

        if (report.isClean()) {
            log.info("Teardown for {} finished: {}", tenantKey, report);
        } else {
            log.warn("Teardown for {} finished with failures: {}", tenantKey, report);
        }
        return report;
    }

    public TenantInstanceStatus describeTenantInstance(String instanceId) {
        return TenantInstanceStatus.of(inventory.findById(instanceId).orElse(null));
    }

    public PoolStats poolStats() {
        return inventory.stats();
    }

    public void release(String instanceId, ReleasePolicy policy) {
        assigner.release(instanceId, policy);
    }

    public ReplenishResult maintainPool(int targetSpare) {
        return replenisher.maintainPool(targetSpare);
    }

    public RemoteCommandExecutor commands() {
        return executor;
    }

    private void deleteSecret(String name) {
        try {
            secrets.delete(name);
            log.info("Deleted secret {}", name);
        } catch (ResourceNotFoundException e) {
            log.info("Secret {} already absent", name);
        }
    }

    private Optional<String> lookup(String what, Supplier<Optional<String>> finder) {
        try {
            return finder.get();
        } catch (RuntimeException e) {
            log.warn("Looking up {} failed: {}", what, e.getMessage());
            return Optional.empty();
        }
    }

    private void runStep(CleanupReport report, String step, Runnable action) {
        try {
            action.run();
            report.done(step);
        } catch (RuntimeException e) {
            log.warn("Teardown step {} failed: {}", step, e.getMessage());
            report.failed(step, e);
        }
    }

    private static void skip(CleanupReport report, String step, String tenantKey) {
        log.info("Teardown step {} skipped for {}: nothing to act on", step, tenantKey);
        report.skipped(step);
    }
}
