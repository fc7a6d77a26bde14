package warmpool.orchestrator.model;

/**
 * Credential blob created by instance boot tooling under a deterministic name
 * and handed to the tenant at assignment.
 */
public record BootstrapSecret(String name, String value) {

    public static String nameFor(String pattern, String instanceId) {
        return pattern.replace("{id}", instanceId);
    }

    @Override
    public String toString() {
        return "BootstrapSecret{name='" + name + "', value=***}";
    }
}
