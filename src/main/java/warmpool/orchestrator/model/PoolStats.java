package warmpool.orchestrator.model;

import java.util.List;

/**
 * Pool counters derived from one inventory snapshot.
 */
public record PoolStats(int total, int available, int assigned, int initializing) {

    public static PoolStats of(List<PoolInstance> instances) {
        int available = 0;
        int assigned = 0;
        int initializing = 0;
        for (PoolInstance i : instances) {
            switch (i.status()) {
                case AVAILABLE -> available++;
                case ASSIGNED -> assigned++;
                case INITIALIZING -> initializing++;
            }
        }
        return new PoolStats(instances.size(), available, assigned, initializing);
    }

    /** available + initializing */
    public int spare() {
        return available + initializing;
    }
}
