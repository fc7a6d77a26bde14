package warmpool.cloud.agent.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import warmpool.orchestrator.model.RemoteCommand;
import warmpool.orchestrator.model.RemoteCommandStatus;

import java.util.List;
import java.util.Locale;

/**
 * Response DTO for command status.
 * GET /v1/commands/{commandId}
 *
 * Status is one of pending, running, success, failed, timeout.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CommandState(
        @JsonProperty("commandId") String commandId,
        @JsonProperty("argv") List<String> argv,
        @JsonProperty("status") String status,
        @JsonProperty("exitCode") Integer exitCode,
        @JsonProperty("stdout") String stdout,
        @JsonProperty("stderr") String stderr) {

    public RemoteCommand toRemoteCommand(String instanceId) {
        return new RemoteCommand(commandId, instanceId, argv, mapStatus(status), stdout, stderr);
    }

    static RemoteCommandStatus mapStatus(String status) {
        if (status == null) {
            return RemoteCommandStatus.PENDING;
        }
        return switch (status.toLowerCase(Locale.ROOT)) {
            case "running", "in_progress" -> RemoteCommandStatus.IN_PROGRESS;
            case "success", "succeeded" -> RemoteCommandStatus.SUCCESS;
            case "failed", "error" -> RemoteCommandStatus.FAILED;
            case "timeout", "timed_out" -> RemoteCommandStatus.TIMEOUT;
            default -> RemoteCommandStatus.PENDING;
        };
    }
}
