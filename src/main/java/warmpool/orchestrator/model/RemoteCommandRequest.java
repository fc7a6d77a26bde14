package warmpool.orchestrator.model;

import java.util.List;
import java.util.Map;

/**
 * Structured remote execution request: an argument vector plus environment
 * handed to the instance agent as data, never spliced into a shell string.
 *
 * @param argv           program and arguments
 * @param environment    variables for the command; values are never logged
 * @param timeoutSeconds limit enforced by the agent itself
 */
public record RemoteCommandRequest(List<String> argv, Map<String, String> environment, long timeoutSeconds) {

    public RemoteCommandRequest {
        argv = List.copyOf(argv);
        environment = environment == null ? Map.of() : Map.copyOf(environment);
        if (argv.isEmpty()) {
            throw new IllegalArgumentException("argv must not be empty");
        }
    }

    public static RemoteCommandRequest of(long timeoutSeconds, String... argv) {
        return new RemoteCommandRequest(List.of(argv), Map.of(), timeoutSeconds);
    }

    @Override
    public String toString() {
        return "RemoteCommandRequest{argv=" + argv + ", env=" + environment.keySet()
                + ", timeout=" + timeoutSeconds + "s}";
    }
}
