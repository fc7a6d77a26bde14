package warmpool.orchestrator.error;

/**
 * No available instance, and the cold-start launch failed or did not become
 * available in time. Not retried internally.
 */
public class PoolExhaustedException extends PoolException {

    public PoolExhaustedException(String message) {
        super(message);
    }

    public PoolExhaustedException(String message, Throwable cause) {
        super(message, cause);
    }
}
