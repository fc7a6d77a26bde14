package warmpool.orchestrator.model;

/**
 * What happens to an instance when a tenant lets go of it.
 */
public enum ReleasePolicy {
    /** Relabel available and drop tenant labels */
    RETURN_TO_POOL,
    /** Terminate and let replenishment launch a fresh spare */
    TERMINATE
}
