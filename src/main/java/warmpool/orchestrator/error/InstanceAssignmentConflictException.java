package warmpool.orchestrator.error;

/**
 * The post-write re-read of an assigned instance shows a different owner,
 * i.e. a concurrent assignment won the last-writer-wins label race.
 * The conflict is reported, never repaired.
 */
public class InstanceAssignmentConflictException extends PoolException {

    private final String instanceId;
    private final String expectedTenant;
    private final String observedTenant;

    public InstanceAssignmentConflictException(String instanceId, String expectedTenant, String observedTenant) {
        super("Instance " + instanceId + " was claimed concurrently: expected tenant "
                + expectedTenant + " but found " + observedTenant);
        this.instanceId = instanceId;
        this.expectedTenant = expectedTenant;
        this.observedTenant = observedTenant;
    }

    public String instanceId() {
        return instanceId;
    }

    public String expectedTenant() {
        return expectedTenant;
    }

    public String observedTenant() {
        return observedTenant;
    }
}
