package warmpool.orchestrator.error;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Every configured subnet rejected a single instance launch. Per-subnet causes
 * are kept in order of attempt and attached as suppressed exceptions.
 */
public class LaunchFailedException extends PoolException {

    private final Map<String, Exception> subnetErrors;

    public LaunchFailedException(Map<String, Exception> subnetErrors) {
        super(describe(subnetErrors));
        this.subnetErrors = Collections.unmodifiableMap(new LinkedHashMap<>(subnetErrors));
        subnetErrors.values().forEach(this::addSuppressed);
    }

    public Map<String, Exception> subnetErrors() {
        return subnetErrors;
    }

    private static String describe(Map<String, Exception> errors) {
        StringBuilder sb = new StringBuilder("Instance launch failed in all ")
                .append(errors.size()).append(" subnet(s)");
        errors.forEach((subnet, e) -> sb.append("; ").append(subnet).append(": ").append(e.getMessage()));
        return sb.toString();
    }
}
