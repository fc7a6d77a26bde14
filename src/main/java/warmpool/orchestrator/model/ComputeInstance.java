package warmpool.orchestrator.model;

import java.time.Instant;
import java.util.Map;

/**
 * Raw instance as reported by the compute provider, before pool status is derived.
 *
 * @param live true while the provider reports the instance as pending or running
 */
public record ComputeInstance(
        String id,
        String name,
        Map<String, String> labels,
        String privateIp,
        String publicIp,
        String subnetId,
        boolean live,
        Instant createdAt) {

    public ComputeInstance {
        labels = labels == null ? Map.of() : Map.copyOf(labels);
    }

    public String label(String key) {
        return labels.get(key);
    }
}
