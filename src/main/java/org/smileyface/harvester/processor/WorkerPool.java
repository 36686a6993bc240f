package org.smileyface.harvester.processor;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.smileyface.harvester.render.PageRendererFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs a fixed number of {@link Worker}s on platform threads over one shared {@link WorkSource}.
 * Provides APIs to start, stop, await and query statuses of workers, and sums their counters once they finish.
 */
public class WorkerPool<T> {

    private static final Logger log = LogManager.getLogger();

    /**
     * @param pollTimeout how long one poll of the source may block
     * @param idleGrace   how long a worker re-checks idleness before completing
     * @param politeDelay pause after each item
     */
    public record Settings(Duration pollTimeout, Duration idleGrace, Duration politeDelay) {

        public static Settings defaults() {
            return new Settings(Duration.ofSeconds(1), Duration.ofMillis(500), Duration.ZERO);
        }
    }

    private final String name;
    private final List<Worker<T>> workers = new CopyOnWriteArrayList<>();
    private final List<Future<?>> futures = new CopyOnWriteArrayList<>();
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicInteger inFlight = new AtomicInteger();
    private ExecutorService executor;

    public WorkerPool(String name) {
        this.name = Objects.requireNonNull(name, "name");
    }

    public synchronized void start(int numWorkers, WorkSource<T> source, ItemHandler<T> handler,
                                   PageRendererFactory rendererFactory, Settings settings) {
        if (running.get()) {
            throw new IllegalStateException("WorkerPool " + name + " already running");
        }
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(handler, "handler");
        Settings s = settings == null ? Settings.defaults() : settings;
        int n = Math.max(1, numWorkers);
        workers.clear();
        futures.clear();
        AtomicInteger seq = new AtomicInteger();
        executor = Executors.newFixedThreadPool(n, r -> new Thread(r, name + "-worker-" + seq.incrementAndGet()));
        for (int i = 0; i < n; i++) {
            Worker<T> w = new Worker<>(name + "-" + (i + 1), source, handler, rendererFactory, s, this);
            workers.add(w);
            futures.add(executor.submit(w));
        }
        running.set(true);
        log.info("WorkerPool {} STARTED with {} workers", name, n);
    }

    /**
     * Asks every worker to stop after its current item; does not wait.
     */
    public void requestStop() {
        for (Worker<T> w : workers) {
            w.stop();
        }
    }

    public synchronized void stopAll() {
        requestStop();
        for (Future<?> f : futures) {
            try {
                f.get();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (ExecutionException e) {
                log.error("WorkerPool {} worker terminated abnormally", name, e.getCause());
            }
        }
        shutdownExecutor();
        running.set(false);
        logAggregate("STOPPED");
    }

    public List<WorkerStatus> getStatuses() {
        List<WorkerStatus> list = new ArrayList<>(workers.size());
        for (Worker<T> w : workers) {
            list.add(w.getStatus());
        }
        return list;
    }

    public boolean isRunning() {
        if (!running.get()) return false;
        for (Future<?> f : futures) {
            if (!f.isDone()) return true;
        }
        return false;
    }

    /**
     * Wait until all workers exit or the timeout elapses.
     * @return true if all workers finished before timeout, false otherwise.
     */
    public boolean awaitAll(Duration timeout) {
        long remainingMs = timeout == null ? Long.MAX_VALUE / 2 : Math.max(0, timeout.toMillis());
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(remainingMs);
        for (Future<?> f : futures) {
            long nanosLeft = deadline - System.nanoTime();
            if (nanosLeft <= 0) return false;
            try {
                f.get(nanosLeft, TimeUnit.NANOSECONDS);
            } catch (TimeoutException e) {
                logAggregate("AWAIT TIMEOUT");
                return false;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                logAggregate("AWAIT INTERRUPTED");
                return false;
            } catch (ExecutionException e) {
                log.error("WorkerPool {} worker terminated abnormally", name, e.getCause());
            }
        }
        shutdownExecutor();
        running.set(false);
        logAggregate("ALL COMPLETED");
        return true;
    }

    /**
     * Sum of every worker's counters. Only meaningful after {@link #awaitAll} or {@link #stopAll} returned.
     */
    public WorkerStats aggregateStats() {
        WorkerStats total = new WorkerStats();
        for (Worker<T> w : workers) {
            total.merge(w.getStats());
        }
        return total;
    }

    public int inFlight() {
        return inFlight.get();
    }

    void beginItem() {
        inFlight.incrementAndGet();
    }

    void endItem() {
        inFlight.decrementAndGet();
    }

    private void shutdownExecutor() {
        if (executor != null) {
            executor.shutdown();
        }
    }

    private void logAggregate(String event) {
        int completed = 0;
        int stopped = 0;
        int error = 0;
        long processed = 0L;
        long failed = 0L;
        List<WorkerStatus> statuses = getStatuses();
        for (WorkerStatus s : statuses) {
            processed += s.getProcessedCount();
            failed += s.getFailedCount();
            WorkerState st = s.getState();
            if (st == WorkerState.COMPLETED) completed++;
            else if (st == WorkerState.STOPPED) stopped++;
            else if (st == WorkerState.ERROR) error++;
        }
        log.info("WorkerPool {} {}: workers -> completed={}, stopped={}, error={}, totalProcessed={}, totalFailed={} (workers={})",
                name, event, completed, stopped, error, processed, failed, statuses.size());
    }
}
