package warmpool.cloud.agent.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Response DTO for command submission.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CommandAccepted(
        @JsonProperty("commandId") String commandId) {
    public void validate() {
        if (commandId == null || commandId.isBlank()) {
            throw new IllegalArgumentException("commandId is required");
        }
    }
}
