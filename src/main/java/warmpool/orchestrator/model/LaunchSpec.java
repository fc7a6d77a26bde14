package warmpool.orchestrator.model;

import java.util.Map;

/**
 * Single-instance launch request targeted at one subnet.
 */
public record LaunchSpec(
        String name,
        String zoneId,
        String subnetId,
        Map<String, String> labels) {

    public LaunchSpec {
        labels = labels == null ? Map.of() : Map.copyOf(labels);
    }
}
