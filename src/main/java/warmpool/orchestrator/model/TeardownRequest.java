package warmpool.orchestrator.model;

/**
 * What the caller knows about a tenant environment it wants removed.
 * Route ids may be null when the caller never persisted them.
 */
public record TeardownRequest(
        String tenantKey,
        String instanceId,
        String targetGroupId,
        String ruleId) {

    public TeardownRequest {
        if (tenantKey == null || tenantKey.isBlank()) {
            throw new IllegalArgumentException("tenantKey is required");
        }
    }

    public static TeardownRequest of(ProvisionedTenant tenant) {
        return new TeardownRequest(tenant.tenantKey(), tenant.instanceId(),
                tenant.route().targetGroupId(), tenant.route().ruleId());
    }
}
