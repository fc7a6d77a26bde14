package warmpool.orchestrator.model;

/**
 * Outcome of a tenant key change. The key is saved even when the restart
 * that applies it fails; it then takes effect on the next restart.
 */
public record KeyUpdateResult(
        ApiProvider provider,
        boolean restarted,
        String commandId,
        String message) {

    public static KeyUpdateResult applied(ApiProvider provider, String commandId) {
        return new KeyUpdateResult(provider, true, commandId, "API key applied");
    }

    public static KeyUpdateResult savedWithoutRestart(ApiProvider provider, String reason) {
        return new KeyUpdateResult(provider, false, null,
                "API key saved but container restart failed. The key will apply on next restart. (" + reason + ")");
    }
}
