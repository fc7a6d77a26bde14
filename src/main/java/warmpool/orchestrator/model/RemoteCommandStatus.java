package warmpool.orchestrator.model;

/**
 * Remote command invocation state.
 */
public enum RemoteCommandStatus {
    PENDING,
    IN_PROGRESS,
    SUCCESS,
    FAILED,
    TIMEOUT;

    public boolean isTerminal() {
        return this == SUCCESS || this == FAILED || this == TIMEOUT;
    }
}
