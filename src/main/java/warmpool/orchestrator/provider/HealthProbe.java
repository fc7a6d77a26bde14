package warmpool.orchestrator.provider;

/**
 * Checks the workload health endpoint on an instance.
 */
@FunctionalInterface
public interface HealthProbe {

    /**
     * @param address instance private address
     * @return true if the workload reports healthy
     */
    boolean isHealthy(String address);
}
