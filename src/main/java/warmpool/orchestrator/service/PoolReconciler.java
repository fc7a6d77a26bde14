package warmpool.orchestrator.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import warmpool.orchestrator.config.PoolConfig;
import warmpool.orchestrator.model.PoolInstance;
import warmpool.orchestrator.model.PoolStats;
import warmpool.orchestrator.provider.ComputeProvider;
import warmpool.orchestrator.provider.ResourceNotFoundException;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Terminates spare instances left over by racing replenishment passes.
 *
 * <p>Only {@code available} instances are candidates, newest first, and only
 * the surplus above {@code targetSpare + tolerance}. Each candidate is
 * re-read right before termination; one that was claimed in the meantime is
 * skipped. The window between re-read and terminate still exists, which is
 * why this pass is off unless configured.</p>
 */
public class PoolReconciler {

    private static final Logger log = LoggerFactory.getLogger(PoolReconciler.class);

    private final PoolInventory inventory;
    private final ComputeProvider compute;
    private final PoolConfig config;

    public PoolReconciler(PoolInventory inventory, ComputeProvider compute, PoolConfig config) {
        this.inventory = inventory;
        this.compute = compute;
        this.config = config;
    }

    /**
     * @return ids of the instances terminated by this pass
     */
    public List<String> reclaimExcess(int targetSpare) {
        List<PoolInstance> instances = inventory.listInstances();
        PoolStats stats = PoolStats.of(instances);
        int limit = targetSpare + config.reconcileTolerance();
        int excess = Math.min(stats.spare() - limit, stats.available());

        if (excess <= 0) {
            log.debug("Pool has {} spare (limit {}), nothing to reclaim", stats.spare(), limit);
            return List.of();
        }
        log.info("Pool has {} spare, above limit {}; reclaiming up to {}", stats.spare(), limit, excess);

        List<PoolInstance> candidates = instances.stream()
                .filter(PoolInstance::isAvailable)
                .sorted(Comparator.comparing(PoolInstance::launchedAt,
                        Comparator.nullsLast(Comparator.<Instant>reverseOrder())))
                .toList();

        List<String> terminated = new ArrayList<>();
        for (PoolInstance candidate : candidates) {
            if (terminated.size() >= excess) {
                break;
            }
            Optional<PoolInstance> current = inventory.findById(candidate.id());
            if (current.isEmpty() || !current.get().isAvailable()) {
                log.info("Skipping {}: no longer available", candidate.id());
                continue;
            }
            try {
                compute.terminate(candidate.id());
                terminated.add(candidate.id());
                log.info("Reclaimed excess instance {}", candidate.id());
            } catch (ResourceNotFoundException e) {
                log.info("Instance {} already gone", candidate.id());
            }
        }
        return terminated;
    }
}
