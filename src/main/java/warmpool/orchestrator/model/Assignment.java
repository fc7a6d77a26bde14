package warmpool.orchestrator.model;

/**
 * Result of claiming an instance for a tenant.
 */
public record Assignment(
        String instanceId,
        String privateIp,
        String publicIp,
        String subnetId,
        BootstrapSecret secret) {
}
