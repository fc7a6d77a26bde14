package warmpool.orchestrator.model;

import java.time.Duration;

/**
 * HTTP health check attached to a tenant target group.
 */
public record HealthCheckSpec(
        String path,
        int port,
        Duration interval,
        Duration timeout,
        int healthyThreshold,
        int unhealthyThreshold) {
}
