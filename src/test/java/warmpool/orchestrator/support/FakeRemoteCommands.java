package warmpool.orchestrator.support;

import warmpool.orchestrator.model.RemoteCommand;
import warmpool.orchestrator.model.RemoteCommandRequest;
import warmpool.orchestrator.model.RemoteCommandStatus;
import warmpool.orchestrator.provider.RemoteCommandService;
import warmpool.orchestrator.provider.ResourceNotFoundException;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Scripted command runner. Each submitted command stays in progress for a
 * number of status polls, then finishes with the scripted outcome.
 */
public class FakeRemoteCommands implements RemoteCommandService {

    public record Submission(String instanceId, RemoteCommandRequest request) {
    }

    private static final class Invocation {
        final String instanceId;
        final RemoteCommandRequest request;
        int polls;

        Invocation(String instanceId, RemoteCommandRequest request) {
            this.instanceId = instanceId;
            this.request = request;
        }
    }

    private final Map<String, Invocation> invocations = new HashMap<>();
    private final List<Submission> submissions = new ArrayList<>();
    private int counter;

    private RemoteCommandStatus finalStatus = RemoteCommandStatus.SUCCESS;
    private String stdout = "";
    private String stderr = "";
    private int pollsBeforeDone = 1;
    private int invisiblePolls;
    private boolean hang;
    private RuntimeException submitFailure;

    public synchronized FakeRemoteCommands finishWith(RemoteCommandStatus status, String out, String err) {
        this.finalStatus = status;
        this.stdout = out;
        this.stderr = err;
        return this;
    }

    public synchronized FakeRemoteCommands pollsBeforeDone(int polls) {
        this.pollsBeforeDone = polls;
        return this;
    }

    /** Status calls answer "not found" this many times before the command is visible. */
    public synchronized FakeRemoteCommands invisibleFor(int polls) {
        this.invisiblePolls = polls;
        return this;
    }

    public synchronized FakeRemoteCommands hang() {
        this.hang = true;
        return this;
    }

    public synchronized FakeRemoteCommands failSubmit(RuntimeException error) {
        this.submitFailure = error;
        return this;
    }

    public synchronized List<Submission> submissions() {
        return List.copyOf(submissions);
    }

    public synchronized Submission lastSubmission() {
        return submissions.get(submissions.size() - 1);
    }

    @Override
    public synchronized String submit(String instanceId, RemoteCommandRequest request) {
        if (submitFailure != null) {
            throw submitFailure;
        }
        String id = "cmd-" + (++counter);
        invocations.put(id, new Invocation(instanceId, request));
        submissions.add(new Submission(instanceId, request));
        return id;
    }

    @Override
    public synchronized RemoteCommand status(String instanceId, String commandId) {
        Invocation inv = invocations.get(commandId);
        if (inv == null || !inv.instanceId.equals(instanceId)) {
            throw new ResourceNotFoundException("command " + commandId);
        }
        inv.polls++;
        if (inv.polls <= invisiblePolls) {
            throw new ResourceNotFoundException("command " + commandId);
        }
        if (hang || inv.polls - invisiblePolls < pollsBeforeDone) {
            return new RemoteCommand(commandId, instanceId, inv.request.argv(), RemoteCommandStatus.IN_PROGRESS,
                    "", "");
        }
        return new RemoteCommand(commandId, instanceId, inv.request.argv(), finalStatus, stdout, stderr);
    }
}
