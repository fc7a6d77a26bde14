package warmpool.cloud.agent.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import warmpool.orchestrator.model.RemoteCommandRequest;

import java.util.List;
import java.util.Map;

/**
 * Request DTO for command submission.
 * POST /v1/commands
 */
public record CommandRequest(
        @JsonProperty("argv") List<String> argv,
        @JsonProperty("env") Map<String, String> env,
        @JsonProperty("timeoutSeconds") long timeoutSeconds) {

    public static CommandRequest from(RemoteCommandRequest request) {
        return new CommandRequest(request.argv(), request.environment(), request.timeoutSeconds());
    }

    @Override
    public String toString() {
        return "CommandRequest{argv=" + argv + ", env=" + (env == null ? "[]" : env.keySet()) + "}";
    }
}
