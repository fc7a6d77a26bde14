package warmpool.cloud.agent;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import warmpool.cloud.agent.dto.CommandAccepted;
import warmpool.cloud.agent.dto.CommandRequest;
import warmpool.cloud.agent.dto.CommandState;
import warmpool.orchestrator.error.PoolException;
import warmpool.orchestrator.model.ComputeInstance;
import warmpool.orchestrator.model.RemoteCommand;
import warmpool.orchestrator.model.RemoteCommandRequest;
import warmpool.orchestrator.provider.ComputeProvider;
import warmpool.orchestrator.provider.RemoteCommandService;
import warmpool.orchestrator.provider.ResourceNotFoundException;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * Remote execution through the agent that runs on every pool instance.
 * Commands travel as JSON (argument vector plus environment); the agent
 * executes them without a shell.
 */
public class AgentCommandService implements RemoteCommandService {

    private static final Logger log = LoggerFactory.getLogger(AgentCommandService.class);
    private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(5);
    private static final String TOKEN_HEADER = "X-Agent-Token";

    private final ComputeProvider compute;
    private final ObjectMapper json;
    private final HttpClient http;
    private final int port;
    private final String token;
    private final Duration requestTimeout;

    public AgentCommandService(ComputeProvider compute, ObjectMapper json, int port, String token,
                               Duration requestTimeout) {
        this.compute = compute;
        this.json = json;
        this.http = HttpClient.newBuilder()
                .connectTimeout(CONNECT_TIMEOUT)
                .build();
        this.port = port;
        this.token = token;
        this.requestTimeout = requestTimeout;
    }

    @Override
    public String submit(String instanceId, RemoteCommandRequest request) {
        String url = baseUrl(instanceId) + "/v1/commands";
        try {
            String body = json.writeValueAsString(CommandRequest.from(request));
            HttpResponse<String> resp = http.send(requestBuilder(url)
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(body))
                    .build(), HttpResponse.BodyHandlers.ofString());
            if (resp.statusCode() != 200 && resp.statusCode() != 201 && resp.statusCode() != 202) {
                throw new PoolException("Agent on " + instanceId + " rejected command: HTTP " + resp.statusCode());
            }
            CommandAccepted accepted = json.readValue(resp.body(), CommandAccepted.class);
            accepted.validate();
            return accepted.commandId();
        } catch (IOException e) {
            throw new PoolException("Agent on " + instanceId + " unreachable: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PoolException("Interrupted while submitting command to " + instanceId, e);
        }
    }

    @Override
    public RemoteCommand status(String instanceId, String commandId) {
        String url = baseUrl(instanceId) + "/v1/commands/" + commandId;
        try {
            HttpResponse<String> resp = http.send(requestBuilder(url).GET().build(),
                    HttpResponse.BodyHandlers.ofString());
            if (resp.statusCode() == 404) {
                throw new ResourceNotFoundException("command " + commandId + " on " + instanceId);
            }
            if (resp.statusCode() != 200) {
                throw new PoolException("Agent on " + instanceId + " status query failed: HTTP " + resp.statusCode());
            }
            return json.readValue(resp.body(), CommandState.class).toRemoteCommand(instanceId);
        } catch (IOException e) {
            throw new PoolException("Agent on " + instanceId + " unreachable: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PoolException("Interrupted while polling command " + commandId, e);
        }
    }

    private HttpRequest.Builder requestBuilder(String url) {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .header("Accept", "application/json")
                .timeout(requestTimeout);
        if (token != null && !token.isBlank()) {
            builder.header(TOKEN_HEADER, token);
        }
        return builder;
    }

    private String baseUrl(String instanceId) {
        ComputeInstance instance = compute.getInstance(instanceId)
                .orElseThrow(() -> new ResourceNotFoundException("instance " + instanceId));
        String address = instance.privateIp() != null ? instance.privateIp() : instance.publicIp();
        if (address == null) {
            throw new PoolException("Instance " + instanceId + " has no address yet");
        }
        log.debug("Agent for {} at {}:{}", instanceId, address, port);
        return "http://" + address + ":" + port;
    }
}
