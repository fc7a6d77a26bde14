package warmpool.orchestrator.model;

/**
 * Per-tenant routing on the shared load balancer.
 *
 * @param tenantKey     key the route was derived from
 * @param serviceName   deterministic name of the target group and rule
 * @param targetGroupId provider id of the health-checked target group
 * @param ruleId        provider id of the routing rule, null until created
 * @param match         match pattern
 * @param priority      stable rule priority
 */
public record TenantRoute(
        String tenantKey,
        String serviceName,
        String targetGroupId,
        String ruleId,
        RouteMatch match,
        int priority) {

    public TenantRoute withRuleId(String id) {
        return new TenantRoute(tenantKey, serviceName, targetGroupId, id, match, priority);
    }

    public boolean hasRule() {
        return ruleId != null && !ruleId.isBlank();
    }
}
