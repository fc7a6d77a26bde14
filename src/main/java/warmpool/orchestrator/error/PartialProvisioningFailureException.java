package warmpool.orchestrator.error;

import warmpool.orchestrator.model.CleanupReport;

/**
 * Tenant provisioning failed part way. Carries the root cause and the outcome
 * of the reverse-order cleanup that followed it.
 */
public class PartialProvisioningFailureException extends PoolException {

    private final String tenantId;
    private final CleanupReport cleanup;

    public PartialProvisioningFailureException(String tenantId, Throwable rootCause, CleanupReport cleanup) {
        super("Failed to provision instance for tenant " + tenantId + ": " + rootCause.getMessage(), rootCause);
        this.tenantId = tenantId;
        this.cleanup = cleanup;
        cleanup.failures().values().forEach(this::addSuppressed);
    }

    public String tenantId() {
        return tenantId;
    }

    public CleanupReport cleanup() {
        return cleanup;
    }
}
