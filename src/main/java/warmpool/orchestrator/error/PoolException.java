package warmpool.orchestrator.error;

/**
 * Base class for failures raised by the pool and provisioning core.
 */
public class PoolException extends RuntimeException {

    public PoolException(String message) {
        super(message);
    }

    public PoolException(String message, Throwable cause) {
        super(message, cause);
    }
}
