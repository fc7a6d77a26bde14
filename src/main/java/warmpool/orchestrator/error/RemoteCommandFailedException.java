package warmpool.orchestrator.error;

/**
 * A remote command reached a terminal failure state. Captured output is kept
 * for the caller.
 */
public class RemoteCommandFailedException extends PoolException {

    private final String instanceId;
    private final String commandId;
    private final String stdout;
    private final String stderr;

    public RemoteCommandFailedException(String instanceId, String commandId, String message,
                                        String stdout, String stderr) {
        super(message + " (instance=" + instanceId + ", command=" + commandId + ")"
                + (stderr == null || stderr.isBlank() ? "" : ": " + lastLine(stderr)));
        this.instanceId = instanceId;
        this.commandId = commandId;
        this.stdout = stdout == null ? "" : stdout;
        this.stderr = stderr == null ? "" : stderr;
    }

    public RemoteCommandFailedException(String instanceId, String commandId, String message, Throwable cause) {
        super(message + " (instance=" + instanceId + ", command=" + commandId + ")", cause);
        this.instanceId = instanceId;
        this.commandId = commandId;
        this.stdout = "";
        this.stderr = "";
    }

    public String instanceId() {
        return instanceId;
    }

    public String commandId() {
        return commandId;
    }

    public String stdout() {
        return stdout;
    }

    public String stderr() {
        return stderr;
    }

    private static String lastLine(String text) {
        String trimmed = text.strip();
        int nl = trimmed.lastIndexOf('\n');
        return nl < 0 ? trimmed : trimmed.substring(nl + 1);
    }
}
