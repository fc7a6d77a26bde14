package warmpool.orchestrator.util;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Delay between poll attempts: fixed, or exponential with jitter.
 *
 * <pre>
 * delay = min(base * 2^(attempt-1) + jitter, max)
 * jitter = random(0, exponential * jitterFactor)
 * </pre>
 *
 * A fixed backoff is the degenerate case with {@code base == max} and no jitter.
 */
public final class Backoff {

    private final long baseDelayMs;
    private final long maxDelayMs;
    private final double jitterFactor;

    private Backoff(long baseDelayMs, long maxDelayMs, double jitterFactor) {
        if (baseDelayMs <= 0) {
            throw new IllegalArgumentException("baseDelayMs must be positive (current: " + baseDelayMs + ")");
        }
        if (maxDelayMs < baseDelayMs) {
            throw new IllegalArgumentException(
                    "maxDelayMs must be >= baseDelayMs (base: " + baseDelayMs + ", max: " + maxDelayMs + ")");
        }
        if (jitterFactor < 0.0 || jitterFactor > 1.0) {
            throw new IllegalArgumentException("jitterFactor must be between 0.0 and 1.0 (current: " + jitterFactor + ")");
        }
        this.baseDelayMs = baseDelayMs;
        this.maxDelayMs = maxDelayMs;
        this.jitterFactor = jitterFactor;
    }

    public static Backoff fixed(Duration interval) {
        return new Backoff(interval.toMillis(), interval.toMillis(), 0.0);
    }

    public static Backoff exponential(Duration base, Duration max, double jitterFactor) {
        return new Backoff(base.toMillis(), max.toMillis(), jitterFactor);
    }

    /**
     * @param attempt attempt number, starting at 1
     */
    public Duration delay(int attempt) {
        if (attempt <= 0) {
            throw new IllegalArgumentException("attempt must be positive (current: " + attempt + ")");
        }
        // shift capped to avoid overflow
        int shift = Math.min(attempt - 1, 30);
        long exponential = Math.min(baseDelayMs * (1L << shift), maxDelayMs);
        long jitter = jitterFactor == 0.0 ? 0 : (long) (exponential * jitterFactor * ThreadLocalRandom.current().nextDouble());
        return Duration.ofMillis(Math.min(exponential + jitter, maxDelayMs));
    }

    public boolean isFixed() {
        return baseDelayMs == maxDelayMs && jitterFactor == 0.0;
    }

    @Override
    public String toString() {
        return isFixed()
                ? "Backoff{fixed=" + baseDelayMs + "ms}"
                : "Backoff{base=" + baseDelayMs + "ms, max=" + maxDelayMs + "ms, jitter=" + jitterFactor + "}";
    }
}
