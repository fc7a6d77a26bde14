package warmpool.orchestrator.model;

/**
 * Coarse status of a tenant's instance as shown to callers.
 */
public enum TenantInstanceStatus {
    PENDING,
    PROVISIONING,
    RUNNING,
    STOPPED;

    public static TenantInstanceStatus of(PoolInstance instance) {
        if (instance == null) {
            return STOPPED;
        }
        return switch (instance.status()) {
            case INITIALIZING -> PROVISIONING;
            case ASSIGNED -> RUNNING;
            case AVAILABLE -> PENDING;
        };
    }
}
