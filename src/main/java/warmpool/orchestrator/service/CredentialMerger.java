package warmpool.orchestrator.service;

import warmpool.orchestrator.model.ApiProvider;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the workload environment from platform and tenant credentials.
 * Tenant entries override platform entries with the same key.
 */
public final class CredentialMerger {

    private final List<String> passthroughEnv;

    public CredentialMerger(List<String> passthroughEnv) {
        this.passthroughEnv = List.copyOf(passthroughEnv);
    }

    public Map<String, String> merge(Map<String, String> platform, Map<String, String> tenant) {
        Map<String, String> merged = new LinkedHashMap<>();
        if (platform != null) {
            merged.putAll(platform);
        }
        if (tenant != null) {
            tenant.forEach((key, value) -> {
                if (value != null && !value.isBlank()) {
                    merged.put(key, value);
                }
            });
        }
        return merged;
    }

    /**
     * Merge, then keep only provider keys and passthrough variables with a
     * non-empty value.
     */
    public Map<String, String> containerEnvironment(Map<String, String> platform, Map<String, String> tenant) {
        Map<String, String> merged = merge(platform, tenant);
        Map<String, String> env = new LinkedHashMap<>();
        for (ApiProvider provider : ApiProvider.values()) {
            copyIfSet(merged, provider.envName(), env);
        }
        for (String name : passthroughEnv) {
            copyIfSet(merged, name, env);
        }
        return env;
    }

    private static void copyIfSet(Map<String, String> from, String key, Map<String, String> to) {
        String value = from.get(key);
        if (value != null && !value.isBlank()) {
            to.put(key, value);
        }
    }
}
