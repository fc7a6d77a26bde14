package warmpool.orchestrator.model;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * Model providers whose API keys a tenant may override.
 */
public enum ApiProvider {
    ANTHROPIC("anthropic", "ANTHROPIC_API_KEY"),
    OPENAI("openai", "OPENAI_API_KEY"),
    GOOGLE("google", "GEMINI_API_KEY");

    private final String id;
    private final String envName;

    ApiProvider(String id, String envName) {
        this.id = id;
        this.envName = envName;
    }

    public String id() {
        return id;
    }

    /** Environment variable (and secret entry key) carrying the provider key */
    public String envName() {
        return envName;
    }

    public static ApiProvider fromId(String id) {
        for (ApiProvider p : values()) {
            if (p.id.equals(id)) {
                return p;
            }
        }
        throw new IllegalArgumentException("Invalid provider. Must be one of: "
                + Arrays.stream(values()).map(ApiProvider::id).collect(Collectors.joining(", ")));
    }
}
