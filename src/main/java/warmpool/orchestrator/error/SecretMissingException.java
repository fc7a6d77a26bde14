package warmpool.orchestrator.error;

/**
 * An instance is tagged available but its bootstrap secret cannot be read.
 * The instance is considered corrupt for assignment purposes.
 */
public class SecretMissingException extends PoolException {

    private final String instanceId;
    private final String secretName;

    public SecretMissingException(String instanceId, String secretName) {
        super("Instance " + instanceId + " has no bootstrap secret (" + secretName + ")");
        this.instanceId = instanceId;
        this.secretName = secretName;
    }

    public SecretMissingException(String instanceId, String secretName, Throwable cause) {
        super("Instance " + instanceId + " bootstrap secret " + secretName + " could not be read", cause);
        this.instanceId = instanceId;
        this.secretName = secretName;
    }

    public String instanceId() {
        return instanceId;
    }

    public String secretName() {
        return secretName;
    }
}
