package warmpool.orchestrator.error;

import java.time.Duration;

/**
 * A remote command (or the health wait that follows it) did not reach a
 * terminal state within its bound.
 */
public class RemoteCommandTimedOutException extends PoolException {

    private final String instanceId;
    private final String commandId;
    private final Duration timeout;

    public RemoteCommandTimedOutException(String instanceId, String commandId, Duration timeout, Throwable lastError) {
        super("Remote command " + commandId + " on " + instanceId + " did not finish within "
                + timeout.toSeconds() + "s", lastError);
        this.instanceId = instanceId;
        this.commandId = commandId;
        this.timeout = timeout;
    }

    public RemoteCommandTimedOutException(String instanceId, String commandId, Duration timeout, String message,
                                          Throwable lastError) {
        super(message, lastError);
        this.instanceId = instanceId;
        this.commandId = commandId;
        this.timeout = timeout;
    }

    public String instanceId() {
        return instanceId;
    }

    public String commandId() {
        return commandId;
    }

    public Duration timeout() {
        return timeout;
    }
}
