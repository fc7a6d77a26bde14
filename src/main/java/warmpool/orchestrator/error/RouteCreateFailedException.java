package warmpool.orchestrator.error;

/**
 * Target group or routing rule creation failed. Earlier API-call failures of
 * the same attempt are attached as suppressed exceptions.
 */
public class RouteCreateFailedException extends PoolException {

    private final String tenantKey;

    public RouteCreateFailedException(String tenantKey, String message, Throwable cause) {
        super("Route creation failed for " + tenantKey + ": " + message, cause);
        this.tenantKey = tenantKey;
    }

    public String tenantKey() {
        return tenantKey;
    }
}
