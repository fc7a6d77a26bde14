package warmpool.orchestrator.model;

/**
 * A fully provisioned tenant environment: instance, route and public URL.
 */
public record ProvisionedTenant(
        String tenantId,
        String tenantKey,
        String instanceId,
        String privateIp,
        String publicIp,
        TenantRoute route,
        String url,
        BootstrapSecret secret) {
}
