package warmpool.orchestrator.scheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import warmpool.orchestrator.config.PoolConfig;
import warmpool.orchestrator.service.PoolReconciler;
import warmpool.orchestrator.service.PoolReplenisher;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Runs the pool's periodic jobs:
 * - replenish: maintainPool(targetSpare)
 * - reconcile: reclaim excess spares (only when enabled)
 *
 * Single-threaded, so two scheduled passes never overlap each other.
 */
public class Scheduler implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Scheduler.class);

    private final ScheduledExecutorService executor;
    private final Runnable replenishJob;
    private final Runnable reconcileJob;
    private final PoolConfig config;

    private volatile boolean running = false;

    public Scheduler(PoolReplenisher replenisher, PoolReconciler reconciler, PoolConfig config) {
        this(() -> replenisher.maintainPool(config.targetSpare()),
                () -> reconciler.reclaimExcess(config.targetSpare()),
                config);
    }

    /**
     * @param replenishJob top-up pass
     * @param reconcileJob reclaim pass, scheduled only if enabled in config
     * @param config       intervals and switches
     */
    public Scheduler(Runnable replenishJob, Runnable reconcileJob, PoolConfig config) {
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "warmpool-scheduler");
            t.setDaemon(true);
            return t;
        });
        this.replenishJob = replenishJob;
        this.reconcileJob = reconcileJob;
        this.config = config;
    }

    /**
     * Start the scheduler. The first replenish pass runs immediately.
     */
    public void start() {
        if (running) {
            log.warn("Scheduler already running");
            return;
        }

        running = true;

        long replenishMs = config.replenishInterval().toMillis();
        executor.scheduleAtFixedRate(
                wrapRunnable("replenish", replenishJob),
                0,
                replenishMs,
                TimeUnit.MILLISECONDS);
        log.info("Pool replenishment scheduled every {}ms", replenishMs);

        if (config.reconcileEnabled() && reconcileJob != null) {
            long reconcileMs = config.reconcileInterval().toMillis();
            executor.scheduleAtFixedRate(
                    wrapRunnable("reconcile", reconcileJob),
                    reconcileMs,
                    reconcileMs,
                    TimeUnit.MILLISECONDS);
            log.info("Pool reconciliation scheduled every {}ms", reconcileMs);
        }

        log.info("Scheduler started");
    }

    /**
     * Stop the scheduler gracefully.
     */
    public void stop() {
        if (!running) {
            return;
        }

        running = false;
        executor.shutdown();

        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
                log.warn("Scheduler forcefully stopped");
            } else {
                log.info("Scheduler stopped gracefully");
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public void close() {
        stop();
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * Wrap a job so one failed pass does not cancel the schedule.
     */
    static Runnable wrapRunnable(String name, Runnable task) {
        return () -> {
            try {
                task.run();
            } catch (Exception e) {
                log.error("{} pass failed", name, e);
            }
        };
    }
}
