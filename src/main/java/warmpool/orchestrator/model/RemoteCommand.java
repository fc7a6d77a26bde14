package warmpool.orchestrator.model;

import java.util.List;

/**
 * Snapshot of a remote command invocation.
 */
public record RemoteCommand(
        String id,
        String instanceId,
        List<String> argv,
        RemoteCommandStatus status,
        String stdout,
        String stderr) {

    public RemoteCommand {
        argv = argv == null ? List.of() : List.copyOf(argv);
        stdout = stdout == null ? "" : stdout;
        stderr = stderr == null ? "" : stderr;
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }
}
