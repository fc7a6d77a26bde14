package warmpool.orchestrator.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import warmpool.orchestrator.config.PoolConfig;
import warmpool.orchestrator.error.RemoteCommandFailedException;
import warmpool.orchestrator.error.RemoteCommandTimedOutException;
import warmpool.orchestrator.model.RemoteCommand;
import warmpool.orchestrator.model.RemoteCommandRequest;
import warmpool.orchestrator.model.RemoteCommandStatus;
import warmpool.orchestrator.provider.RemoteCommandService;
import warmpool.orchestrator.provider.ResourceNotFoundException;
import warmpool.orchestrator.util.Backoff;
import warmpool.orchestrator.util.BoundedPoller;
import warmpool.orchestrator.util.PollOutcome;

import java.time.Duration;
import java.util.Optional;

/**
 * Runs commands on pool instances and waits for them to finish.
 *
 * <p>Polling interval is fixed; the overall wait is bounded by the timeout
 * passed in. No retries here: a failed or timed-out command is reported to
 * the caller, who owns the retry policy.</p>
 */
public class RemoteCommandExecutor {

    private static final Logger log = LoggerFactory.getLogger(RemoteCommandExecutor.class);

    static final int MIN_LOG_TAIL = 10;
    static final int MAX_LOG_TAIL = 500;
    static final Duration LOGS_TIMEOUT = Duration.ofSeconds(30);

    private final RemoteCommandService commands;
    private final BoundedPoller poller;
    private final PoolConfig config;

    public RemoteCommandExecutor(RemoteCommandService commands, BoundedPoller poller, PoolConfig config) {
        this.commands = commands;
        this.poller = poller;
        this.config = config;
    }

    public RemoteCommand runRemoteScript(String instanceId, RemoteCommandRequest request) {
        return runRemoteScript(instanceId, request, config.scriptTimeout());
    }

    /**
     * Submit a command and poll until it reaches a terminal state.
     *
     * @return the successful command with captured output
     * @throws RemoteCommandFailedException   terminal failure; output attached
     * @throws RemoteCommandTimedOutException not terminal within {@code timeout}
     */
    public RemoteCommand runRemoteScript(String instanceId, RemoteCommandRequest request, Duration timeout) {
        String commandId;
        try {
            commandId = commands.submit(instanceId, request);
        } catch (RuntimeException e) {
            throw new RemoteCommandFailedException(instanceId, "<unsent>", "Command submission failed", e);
        }
        log.info("Submitted command {} to {}: {}", commandId, instanceId, request.argv());

        PollOutcome<RemoteCommand> outcome = poller.poll(
                "command " + commandId,
                timeout,
                Backoff.fixed(config.commandPollInterval()),
                () -> terminalStatus(instanceId, commandId));

        if (outcome.isTimedOut()) {
            log.warn("Command {} on {} timed out after {} polls", commandId, instanceId, outcome.attempts());
            throw new RemoteCommandTimedOutException(instanceId, commandId, timeout, outcome.lastError().orElse(null));
        }

        RemoteCommand command = outcome.value();
        if (command.status() == RemoteCommandStatus.TIMEOUT) {
            throw new RemoteCommandTimedOutException(instanceId, commandId, timeout, null);
        }
        if (command.status() != RemoteCommandStatus.SUCCESS) {
            log.warn("Command {} on {} failed", commandId, instanceId);
            throw new RemoteCommandFailedException(instanceId, commandId, "Remote command failed",
                    command.stdout(), command.stderr());
        }
        log.info("Command {} on {} succeeded", commandId, instanceId);
        return command;
    }

    /**
     * Tail of the workload container log. Falls back to the error output,
     * then a fixed message, when the command fails.
     *
     * @param tail number of lines, clamped to [10, 500]
     */
    public String fetchLogs(String instanceId, int tail) {
        int lines = Math.min(MAX_LOG_TAIL, Math.max(MIN_LOG_TAIL, tail));
        RemoteCommandRequest request = RemoteCommandRequest.of(LOGS_TIMEOUT.toSeconds(),
                "docker", "logs", config.containerName(), "--tail", Integer.toString(lines));
        try {
            return runRemoteScript(instanceId, request, LOGS_TIMEOUT).stdout();
        } catch (RemoteCommandFailedException e) {
            if (!e.stderr().isBlank()) {
                return e.stderr();
            }
            return e.stdout().isBlank() ? "Command failed" : e.stdout();
        }
    }

    private Optional<RemoteCommand> terminalStatus(String instanceId, String commandId) {
        try {
            RemoteCommand command = commands.status(instanceId, commandId);
            return command.isTerminal() ? Optional.of(command) : Optional.empty();
        } catch (ResourceNotFoundException e) {
            // invocation not visible on the instance yet
            return Optional.empty();
        }
    }
}
