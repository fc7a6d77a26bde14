package warmpool.orchestrator.util;

import java.time.Duration;
import java.util.Optional;
import java.util.function.Function;

/**
 * Result of a {@link BoundedPoller} run: either the probed value or a timeout.
 */
public final class PollOutcome<T> {

    private final T value;
    private final int attempts;
    private final Duration elapsed;
    private final Exception lastError;

    private PollOutcome(T value, int attempts, Duration elapsed, Exception lastError) {
        this.value = value;
        this.attempts = attempts;
        this.elapsed = elapsed;
        this.lastError = lastError;
    }

    static <T> PollOutcome<T> completed(T value, int attempts, Duration elapsed) {
        return new PollOutcome<>(value, attempts, elapsed, null);
    }

    static <T> PollOutcome<T> timedOut(int attempts, Duration elapsed, Exception lastError) {
        return new PollOutcome<>(null, attempts, elapsed, lastError);
    }

    public boolean isCompleted() {
        return value != null;
    }

    public boolean isTimedOut() {
        return value == null;
    }

    public T value() {
        if (value == null) {
            throw new IllegalStateException("Poll timed out after " + attempts + " attempts");
        }
        return value;
    }

    public int attempts() {
        return attempts;
    }

    public Duration elapsed() {
        return elapsed;
    }

    /** Last exception thrown by the probe, if any attempt failed. */
    public Optional<Exception> lastError() {
        return Optional.ofNullable(lastError);
    }

    public <X extends RuntimeException> T orElseThrow(Function<PollOutcome<T>, X> onTimeout) {
        if (value == null) {
            throw onTimeout.apply(this);
        }
        return value;
    }

    @Override
    public String toString() {
        return isCompleted()
                ? "PollOutcome{completed, attempts=" + attempts + ", elapsed=" + elapsed.toMillis() + "ms}"
                : "PollOutcome{timedOut, attempts=" + attempts + ", elapsed=" + elapsed.toMillis() + "ms}";
    }
}
