package warmpool.orchestrator.model;

import java.util.Locale;

/**
 * Lifecycle status of a pool instance, derived from its {@code status} label.
 */
public enum InstanceStatus {
    /** Launched, workload container not yet reported healthy */
    INITIALIZING("initializing"),
    /** Healthy and unowned, ready for assignment */
    AVAILABLE("available"),
    /** Owned by exactly one tenant */
    ASSIGNED("assigned");

    private final String label;

    InstanceStatus(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /**
     * Parse a label value. Missing or unknown values map to INITIALIZING so an
     * unrecognised instance is never handed out as available.
     */
    public static InstanceStatus fromLabel(String value) {
        if (value == null || value.isBlank()) {
            return INITIALIZING;
        }
        String v = value.trim().toLowerCase(Locale.ROOT);
        for (InstanceStatus s : values()) {
            if (s.label.equals(v)) {
                return s;
            }
        }
        return INITIALIZING;
    }
}
