package warmpool.orchestrator.model;

import java.util.List;

/**
 * What one replenishment pass observed and launched.
 */
public record ReplenishResult(int target, int spareBefore, List<String> launched) {

    public ReplenishResult {
        launched = List.copyOf(launched);
    }

    public int launchedCount() {
        return launched.size();
    }
}
