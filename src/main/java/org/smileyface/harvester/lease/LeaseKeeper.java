package org.smileyface.harvester.lease;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Periodic maintenance for a distributed run: heartbeat, lease renewal, reaping, and any extra reclaim tasks
 * (such as returning dead workers' queue items to pending).
 */
public class LeaseKeeper implements AutoCloseable {

    private static final Logger log = LogManager.getLogger();

    private final LeaseManager leaseManager;
    private final InstanceHeartbeat heartbeat;
    private final Duration interval;
    private final List<Runnable> reclaimTasks;
    private ScheduledExecutorService scheduler;

    public LeaseKeeper(LeaseManager leaseManager, InstanceHeartbeat heartbeat, Duration interval, List<Runnable> reclaimTasks) {
        this.leaseManager = Objects.requireNonNull(leaseManager, "leaseManager");
        this.heartbeat = Objects.requireNonNull(heartbeat, "heartbeat");
        this.interval = Objects.requireNonNull(interval, "interval");
        this.reclaimTasks = reclaimTasks == null ? List.of() : List.copyOf(reclaimTasks);
    }

    public synchronized void start() {
        if (scheduler != null) {
            throw new IllegalStateException("LeaseKeeper already started");
        }
        heartbeat.beat("running");
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "lease-keeper-" + heartbeat.getInstanceId());
            t.setDaemon(true);
            return t;
        });
        long ms = Math.max(1, interval.toMillis());
        scheduler.scheduleWithFixedDelay(this::tick, ms, ms, TimeUnit.MILLISECONDS);
        log.info("LeaseKeeper STARTED for {} (interval={} ms)", heartbeat.getInstanceId(), ms);
    }

    /**
     * One maintenance round. Exceptions are logged so the schedule keeps running.
     */
    void tick() {
        try {
            heartbeat.beat("running");
            int held = leaseManager.renewHeld();
            long reaped = leaseManager.reapExpired();
            for (Runnable task : reclaimTasks) {
                task.run();
            }
            log.debug("LeaseKeeper tick: held={}, reaped={}", held, reaped);
        } catch (RuntimeException e) {
            log.warn("LeaseKeeper tick failed: {}", e.getMessage(), e);
        }
    }

    @Override
    public synchronized void close() {
        if (scheduler == null) return;
        scheduler.shutdownNow();
        try {
            scheduler.awaitTermination(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        scheduler = null;
        heartbeat.beat("stopped");
        log.info("LeaseKeeper STOPPED for {}", heartbeat.getInstanceId());
    }
}
