package warmpool.orchestrator.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Ordered outcome of best-effort cleanup steps (rollback or teardown).
 */
public final class CleanupReport {

    public enum Outcome {
        DONE,
        SKIPPED,
        FAILED
    }

    private final Map<String, Outcome> steps = new LinkedHashMap<>();
    private final Map<String, Exception> failures = new LinkedHashMap<>();

    public CleanupReport done(String step) {
        steps.put(step, Outcome.DONE);
        return this;
    }

    public CleanupReport skipped(String step) {
        steps.put(step, Outcome.SKIPPED);
        return this;
    }

    public CleanupReport failed(String step, Exception error) {
        steps.put(step, Outcome.FAILED);
        failures.put(step, error);
        return this;
    }

    public Map<String, Outcome> steps() {
        return Collections.unmodifiableMap(steps);
    }

    public Map<String, Exception> failures() {
        return Collections.unmodifiableMap(failures);
    }

    public Outcome outcome(String step) {
        return steps.get(step);
    }

    public boolean isClean() {
        return failures.isEmpty();
    }

    @Override
    public String toString() {
        return "CleanupReport" + steps;
    }
}
