package warmpool.orchestrator.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import warmpool.orchestrator.error.PoolException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * Deadline-bounded polling shared by every wait in the pool: cold-start
 * readiness, shared route writes, remote command status and workload
 * health.
 *
 * <p>The probe returns a non-empty Optional once the awaited condition holds.
 * A probe exception counts as "not yet" and is remembered as the last error;
 * polling never outlives the deadline by more than one probe call.</p>
 */
public final class BoundedPoller {

    private static final Logger log = LoggerFactory.getLogger(BoundedPoller.class);

    private final Clock clock;
    private final Sleeper sleeper;

    public BoundedPoller(Clock clock, Sleeper sleeper) {
        this.clock = clock;
        this.sleeper = sleeper;
    }

    public static BoundedPoller system() {
        return new BoundedPoller(Clock.systemUTC(), Sleeper.SYSTEM);
    }

    public Clock clock() {
        return clock;
    }

    /**
     * Poll until the probe yields a value or the timeout elapses.
     *
     * @param what    short description used in logs
     * @param timeout overall bound
     * @param backoff delay between attempts
     * @param probe   condition check
     * @throws PoolException if the waiting thread is interrupted
     */
    public <T> PollOutcome<T> poll(String what, Duration timeout, Backoff backoff, Callable<Optional<T>> probe) {
        Instant start = clock.instant();
        Instant deadline = start.plus(timeout);
        Exception lastError = null;
        int attempt = 0;

        while (true) {
            attempt++;
            try {
                Optional<T> result = probe.call();
                if (result.isPresent()) {
                    return PollOutcome.completed(result.get(), attempt, Duration.between(start, clock.instant()));
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new PoolException("Interrupted while waiting for " + what, e);
            } catch (Exception e) {
                lastError = e;
                log.debug("{}: attempt {} failed: {}", what, attempt, e.getMessage());
            }

            Instant now = clock.instant();
            Duration remaining = Duration.between(now, deadline);
            if (remaining.isZero() || remaining.isNegative()) {
                log.debug("{}: gave up after {} attempts", what, attempt);
                return PollOutcome.timedOut(attempt, Duration.between(start, now), lastError);
            }

            Duration delay = backoff.delay(attempt);
            try {
                sleeper.sleep(delay.compareTo(remaining) < 0 ? delay : remaining);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new PoolException("Interrupted while waiting for " + what, e);
            }
        }
    }
}
