package warmpool.orchestrator.model;

/**
 * An instance address registered in a target group.
 */
public record BackendTarget(String ipAddress, String subnetId, int port) {

    public BackendTarget {
        if (ipAddress == null || ipAddress.isBlank()) {
            throw new IllegalArgumentException("target ipAddress is required");
        }
    }
}
