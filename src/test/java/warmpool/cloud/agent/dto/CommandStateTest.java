package warmpool.cloud.agent.dto;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import warmpool.orchestrator.model.RemoteCommand;
import warmpool.orchestrator.model.RemoteCommandRequest;
import warmpool.orchestrator.model.RemoteCommandStatus;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CommandStateTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void statusMapping() {
        assertEquals(RemoteCommandStatus.IN_PROGRESS, CommandState.mapStatus("Running"));
        assertEquals(RemoteCommandStatus.SUCCESS, CommandState.mapStatus("succeeded"));
        assertEquals(RemoteCommandStatus.FAILED, CommandState.mapStatus("error"));
        assertEquals(RemoteCommandStatus.TIMEOUT, CommandState.mapStatus("timed_out"));
        assertEquals(RemoteCommandStatus.PENDING, CommandState.mapStatus("queued"));
        assertEquals(RemoteCommandStatus.PENDING, CommandState.mapStatus(null));
    }

    @Test
    void parsesAgentResponse() throws Exception {
        String json = "{\"commandId\":\"c-1\",\"argv\":[\"docker\",\"ps\"],\"status\":\"failed\","
                + "\"exitCode\":1,\"stdout\":\"\",\"stderr\":\"denied\",\"startedAt\":\"ignored\"}";

        RemoteCommand command = mapper.readValue(json, CommandState.class).toRemoteCommand("vm-1");

        assertEquals("c-1", command.id());
        assertEquals("vm-1", command.instanceId());
        assertEquals(List.of("docker", "ps"), command.argv());
        assertEquals(RemoteCommandStatus.FAILED, command.status());
        assertEquals("denied", command.stderr());
    }

    @Test
    void requestSerializesEnvironment() throws Exception {
        CommandRequest request = CommandRequest.from(
                new RemoteCommandRequest(List.of("env"), Map.of("OPENAI_API_KEY", "sk-1"), 30));

        String json = mapper.writeValueAsString(request);

        assertTrue(json.contains("\"env\":{\"OPENAI_API_KEY\":\"sk-1\"}"));
        assertTrue(json.contains("\"timeoutSeconds\":30"));
        assertFalse(request.toString().contains("sk-1"));
    }

    @Test
    void acceptedRequiresId() throws Exception {
        CommandAccepted accepted = mapper.readValue("{}", CommandAccepted.class);

        assertThrows(IllegalArgumentException.class, accepted::validate);
    }
}
