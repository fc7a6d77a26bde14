package warmpool.orchestrator.util;

import java.time.Duration;

/**
 * Blocking pause between poll attempts. Replaced by a manual clock in tests.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
