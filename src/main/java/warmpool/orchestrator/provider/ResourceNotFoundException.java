package warmpool.orchestrator.provider;

/**
 * A provider call targeted a resource that does not exist (any more).
 * Delete paths treat this as success.
 */
public class ResourceNotFoundException extends RuntimeException {

    private final String resource;

    public ResourceNotFoundException(String resource) {
        super(resource + " not found");
        this.resource = resource;
    }

    public ResourceNotFoundException(String resource, Throwable cause) {
        super(resource + " not found", cause);
        this.resource = resource;
    }

    public String resource() {
        return resource;
    }
}
