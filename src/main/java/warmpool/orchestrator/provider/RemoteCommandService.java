package warmpool.orchestrator.provider;

import warmpool.orchestrator.model.RemoteCommand;
import warmpool.orchestrator.model.RemoteCommandRequest;

/**
 * Remote execution on a pool instance.
 */
public interface RemoteCommandService {

    /**
     * Submit a command. Returns immediately.
     *
     * @return command id
     */
    String submit(String instanceId, RemoteCommandRequest request);

    /**
     * Current state of a submitted command.
     *
     * @throws ResourceNotFoundException while the invocation is not yet visible
     */
    RemoteCommand status(String instanceId, String commandId);
}
