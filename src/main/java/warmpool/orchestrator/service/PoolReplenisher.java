package warmpool.orchestrator.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import warmpool.orchestrator.config.PoolConfig;
import warmpool.orchestrator.error.LaunchFailedException;
import warmpool.orchestrator.model.InstanceStatus;
import warmpool.orchestrator.model.LaunchSpec;
import warmpool.orchestrator.model.PoolStats;
import warmpool.orchestrator.model.ReplenishResult;
import warmpool.orchestrator.model.SubnetPlacement;
import warmpool.orchestrator.provider.ComputeProvider;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Keeps the pool topped up with spare instances.
 *
 * <p>Concurrent calls are not coordinated: two passes that read the same
 * snapshot both launch, so the pool can briefly hold more spares than the
 * target. It never launches fewer than the snapshot says are missing.</p>
 */
public class PoolReplenisher {

    private static final Logger log = LoggerFactory.getLogger(PoolReplenisher.class);

    private final ComputeProvider compute;
    private final PoolInventory inventory;
    private final PoolConfig config;
    private final List<SubnetPlacement> subnets;
    private final AtomicInteger nextOffset = new AtomicInteger();

    public PoolReplenisher(ComputeProvider compute, PoolInventory inventory, PoolConfig config,
                           List<SubnetPlacement> subnets) {
        if (subnets == null || subnets.isEmpty()) {
            throw new IllegalArgumentException("at least one subnet is required");
        }
        this.compute = compute;
        this.inventory = inventory;
        this.config = config;
        this.subnets = List.copyOf(subnets);
    }

    /**
     * Launch {@code targetSpare - spare} instances, one at a time, where
     * {@code spare = available + initializing}.
     *
     * @throws LaunchFailedException if a launch fails in every subnet;
     *                               instances launched before it stay
     */
    public ReplenishResult maintainPool(int targetSpare) {
        if (targetSpare < 0) {
            throw new IllegalArgumentException("targetSpare must be non-negative");
        }
        PoolStats stats = inventory.stats();
        int spare = stats.spare();
        int needed = targetSpare - spare;

        if (needed <= 0) {
            log.debug("Pool has {} spare (target {}), nothing to launch", spare, targetSpare);
            return new ReplenishResult(targetSpare, spare, List.of());
        }

        log.info("Pool has {} spare (available={}, initializing={}), launching {} to reach {}",
                spare, stats.available(), stats.initializing(), needed, targetSpare);

        List<String> launched = new ArrayList<>();
        for (int i = 0; i < needed; i++) {
            launched.add(launchOne());
        }
        return new ReplenishResult(targetSpare, spare, launched);
    }

    /**
     * Launch a single instance labelled {@code initializing}. Subnets are tried
     * round-robin from a rotating offset until one accepts.
     *
     * @return new instance id
     * @throws LaunchFailedException with every subnet's error if all fail
     */
    public String launchOne() {
        int start = Math.floorMod(nextOffset.getAndIncrement(), subnets.size());
        Map<String, Exception> errors = new LinkedHashMap<>();

        for (int i = 0; i < subnets.size(); i++) {
            SubnetPlacement placement = subnets.get((start + i) % subnets.size());
            try {
                String id = compute.launchInstance(launchSpec(placement));
                log.info("Launched pool instance {} in {}", id, placement);
                return id;
            } catch (RuntimeException e) {
                log.warn("Launch in {} failed: {}", placement, e.getMessage());
                errors.put(placement.toString(), e);
            }
        }
        throw new LaunchFailedException(errors);
    }

    private LaunchSpec launchSpec(SubnetPlacement placement) {
        String name = config.poolName() + "-" + UUID.randomUUID().toString().substring(0, 8);
        return new LaunchSpec(name, placement.zoneId(), placement.subnetId(), Map.of(
                PoolInventory.POOL_LABEL, config.poolName(),
                PoolInventory.STATUS_LABEL, InstanceStatus.INITIALIZING.label()));
    }
}
