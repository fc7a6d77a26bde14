package warmpool.orchestrator.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import warmpool.orchestrator.config.PoolConfig;
import warmpool.orchestrator.error.RouteCreateFailedException;
import warmpool.orchestrator.model.BackendTarget;
import warmpool.orchestrator.model.RouteMatch;
import warmpool.orchestrator.model.TenantRoute;
import warmpool.orchestrator.provider.LoadBalancerControl;
import warmpool.orchestrator.provider.ResourceNotFoundException;

import java.util.Optional;

/**
 * Per-tenant routing on the shared load balancer: a health-checked target
 * group plus one rule matching the tenant's path or host.
 *
 * <p>Deletes are idempotent. "Already absent" is logged and swallowed; any
 * other provider failure propagates.</p>
 */
public class NetworkRouter {

    private static final Logger log = LoggerFactory.getLogger(NetworkRouter.class);

    private final LoadBalancerControl loadBalancer;
    private final TenantNaming naming;
    private final PoolConfig config;

    public NetworkRouter(LoadBalancerControl loadBalancer, TenantNaming naming, PoolConfig config) {
        this.loadBalancer = loadBalancer;
        this.naming = naming;
        this.config = config;
    }

    /**
     * Create the target group, then the rule. Both are reused when a previous
     * attempt left them behind, so a retry after a failed cleanup succeeds.
     * If the rule fails the target group is removed again before the error is
     * raised.
     *
     * @throws RouteCreateFailedException on any provider failure
     */
    public TenantRoute createRoute(String tenantKey) {
        String serviceName = naming.serviceName(tenantKey);
        RouteMatch match = naming.match(tenantKey);
        int priority = naming.priority(serviceName);

        String targetGroupId;
        try {
            targetGroupId = loadBalancer.createTargetGroup(serviceName, config.healthCheck());
        } catch (RuntimeException e) {
            throw new RouteCreateFailedException(tenantKey, "target group " + serviceName + ": " + e.getMessage(), e);
        }
        log.info("Target group {} ready ({})", targetGroupId, serviceName);

        TenantRoute route = new TenantRoute(tenantKey, serviceName, targetGroupId, null, match, priority);
        try {
            String ruleId = loadBalancer.createRule(serviceName, match, priority, targetGroupId);
            log.info("Rule {} ready for {} (priority {})", ruleId, match.values(), priority);
            return route.withRuleId(ruleId);
        } catch (RuntimeException e) {
            RouteCreateFailedException failure =
                    new RouteCreateFailedException(tenantKey, "rule " + serviceName + ": " + e.getMessage(), e);
            try {
                deleteTargetGroup(targetGroupId);
            } catch (RuntimeException cleanup) {
                failure.addSuppressed(cleanup);
            }
            throw failure;
        }
    }

    public void registerTarget(TenantRoute route, BackendTarget target) {
        loadBalancer.registerTarget(route.targetGroupId(), target);
        log.info("Registered {}:{} in {}", target.ipAddress(), target.port(), route.serviceName());
    }

    public void deregisterTarget(String targetGroupId, BackendTarget target) {
        try {
            loadBalancer.deregisterTarget(targetGroupId, target);
            log.info("Deregistered {} from {}", target.ipAddress(), targetGroupId);
        } catch (ResourceNotFoundException e) {
            log.info("Target {} not registered in {} (already absent)", target.ipAddress(), targetGroupId);
        }
    }

    /**
     * Delete the rule first so no new traffic arrives, then the target group.
     */
    public void deleteRoute(TenantRoute route) {
        if (route.hasRule()) {
            deleteRule(route.ruleId());
        } else {
            lookupRule(route.tenantKey()).ifPresent(this::deleteRule);
        }
        deleteTargetGroup(route.targetGroupId());
    }

    /**
     * Delete a tenant's route without stored ids: the rule is found by its
     * match pattern and the target group by name. Lookup misses are skipped.
     */
    public void deleteRoute(String tenantKey) {
        Optional<String> ruleId = lookupRule(tenantKey);
        if (ruleId.isPresent()) {
            deleteRule(ruleId.get());
        } else {
            log.info("No rule found for {}, skipping rule deletion", tenantKey);
        }

        Optional<String> targetGroupId = lookupTargetGroup(tenantKey);
        if (targetGroupId.isPresent()) {
            deleteTargetGroup(targetGroupId.get());
        } else {
            log.info("No target group found for {}, skipping target group deletion", tenantKey);
        }
    }

    public void deleteRule(String ruleId) {
        try {
            loadBalancer.deleteRule(ruleId);
            log.info("Deleted rule {}", ruleId);
        } catch (ResourceNotFoundException e) {
            log.info("Rule {} already absent", ruleId);
        }
    }

    public void deleteTargetGroup(String targetGroupId) {
        try {
            loadBalancer.deleteTargetGroup(targetGroupId);
            log.info("Deleted target group {}", targetGroupId);
        } catch (ResourceNotFoundException e) {
            log.info("Target group {} already absent", targetGroupId);
        }
    }

    public Optional<String> lookupRule(String tenantKey) {
        return loadBalancer.findRule(naming.match(tenantKey));
    }

    public Optional<String> lookupTargetGroup(String tenantKey) {
        return loadBalancer.findTargetGroup(naming.serviceName(tenantKey));
    }

    /** Target for an instance address on the workload port */
    public BackendTarget targetFor(String ipAddress, String subnetId) {
        return new BackendTarget(ipAddress, subnetId, config.workloadPort());
    }
}
