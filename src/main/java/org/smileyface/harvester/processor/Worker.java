package org.smileyface.harvester.processor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.smileyface.harvester.render.PageRenderer;
import org.smileyface.harvester.render.PageRendererFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * One worker of a {@link WorkerPool}: owns a renderer session, polls the shared source, and hands each item to
 * the handler. It completes once the source is drained and no sibling is handling an item, and that still
 * holds after the idle grace window.
 */
public class Worker<T> implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(Worker.class);

    private final String id;
    private final WorkSource<T> source;
    private final ItemHandler<T> handler;
    private final PageRendererFactory rendererFactory;
    private final WorkerPool.Settings settings;
    private final WorkerPool<T> pool;
    private final WorkerStats stats = new WorkerStats();

    private final AtomicBoolean stopRequested = new AtomicBoolean(false);
    private final AtomicLong processedCount = new AtomicLong(0);
    private final AtomicLong failedCount = new AtomicLong(0);

    private volatile WorkerState state = WorkerState.NEW;
    private volatile String lastItem;
    private volatile String lastError;
    private volatile Instant startedAt;
    private volatile Instant finishedAt;

    Worker(String id, WorkSource<T> source, ItemHandler<T> handler, PageRendererFactory rendererFactory,
           WorkerPool.Settings settings, WorkerPool<T> pool) {
        this.id = Objects.requireNonNull(id, "id");
        this.source = Objects.requireNonNull(source, "source");
        this.handler = Objects.requireNonNull(handler, "handler");
        this.rendererFactory = rendererFactory;
        this.settings = Objects.requireNonNull(settings, "settings");
        this.pool = Objects.requireNonNull(pool, "pool");
    }

    public void stop() {
        stopRequested.set(true);
        if (state == WorkerState.NEW) {
            transitionTo(WorkerState.STOPPED, null);
        }
    }

    public WorkerStatus getStatus() {
        return new WorkerStatus(id, state, processedCount.get(), failedCount.get(), lastItem, lastError, startedAt, finishedAt);
    }

    /**
     * Counters of this worker; read them only after the worker finished.
     */
    WorkerStats getStats() {
        return stats;
    }

    @Override
    public void run() {
        if (stopRequested.get()) {
            return;
        }
        transitionTo(WorkerState.RUNNING, null);
        PageRenderer renderer = null;
        try {
            renderer = rendererFactory == null ? null : rendererFactory.create();
            Context context = new Context(renderer);
            for (;;) {
                if (stopRequested.get()) {
                    transitionTo(WorkerState.STOPPED, null);
                    return;
                }
                T item = source.poll(settings.pollTimeout());
                if (item == null) {
                    if (isIdle() && confirmIdle()) {
                        transitionTo(WorkerState.COMPLETED, null);
                        return;
                    }
                    continue;
                }
                process(item, context);
                pause(settings.politeDelay());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            transitionTo(WorkerState.STOPPED, null);
        } catch (Throwable t) {
            lastError = t.getMessage();
            transitionTo(WorkerState.ERROR, t);
        } finally {
            if (renderer != null) {
                try {
                    renderer.close();
                } catch (RuntimeException e) {
                    log.warn("Worker {} failed to close renderer: {}", id, e.getMessage());
                }
            }
        }
    }

    private void process(T item, Context context) throws InterruptedException {
        lastItem = handler.describe(item);
        pool.beginItem();
        try {
            handler.handle(item, context);
            processedCount.incrementAndGet();
        } catch (InterruptedException e) {
            source.requeue(item, "interrupted");
            throw e;
        } catch (Exception e) {
            failedCount.incrementAndGet();
            lastError = e.getMessage();
            log.warn("Worker {} failed on {}: {}", id, lastItem, e.toString());
            try {
                handler.onFailure(item, e, context);
            } catch (RuntimeException nested) {
                log.error("Worker {} could not record failure of {}", id, lastItem, nested);
            }
        } finally {
            pool.endItem();
        }
    }

    private boolean isIdle() {
        return pool.inFlight() == 0 && source.isDrained();
    }

    /**
     * Re-checks idleness after the grace window so that an item a sibling is about to start is not missed.
     */
    private boolean confirmIdle() throws InterruptedException {
        pause(settings.idleGrace());
        return isIdle();
    }

    private static void pause(Duration d) throws InterruptedException {
        if (d != null && !d.isZero() && !d.isNegative()) {
            Thread.sleep(d.toMillis());
        }
    }

    /**
     * Centralized state transition with structured logging. Ensures timestamps are set
     * and duration is included for terminal states (STOPPED/COMPLETED/ERROR).
     */
    private void transitionTo(WorkerState newState, Throwable error) {
        WorkerState old = this.state;
        if (newState == WorkerState.RUNNING) {
            if (this.startedAt == null) {
                this.startedAt = Instant.now();
            }
            this.state = WorkerState.RUNNING;
            log.info("Worker {} state {} -> {} (startedAt={})", id, old, this.state, startedAt);
            return;
        }
        this.finishedAt = Instant.now();
        this.state = newState;
        long dur = startedAt != null ? Math.max(0, finishedAt.toEpochMilli() - startedAt.toEpochMilli()) : 0L;
        long count = processedCount.get();
        switch (newState) {
            case STOPPED -> log.info("Worker {} state {} -> STOPPED after {} ms (processed={}, lastItem={})", id, old, dur, count, lastItem);
            case COMPLETED -> log.info("Worker {} state {} -> COMPLETED after {} ms (processed={}, failed={})", id, old, dur, count, failedCount.get());
            case ERROR -> log.error("Worker {} state {} -> ERROR after {} ms (processed={}, lastItem={}, error={})",
                    id, old, dur, count, lastItem, lastError, error);
            default -> log.info("Worker {} state {} -> {}", id, old, newState);
        }
    }

    private final class Context implements WorkerContext<T> {
        private final PageRenderer renderer;

        Context(PageRenderer renderer) {
            this.renderer = renderer;
        }

        @Override
        public String workerId() {
            return id;
        }

        @Override
        public PageRenderer renderer() {
            return renderer;
        }

        @Override
        public WorkerStats stats() {
            return stats;
        }

        @Override
        public boolean requeue(T item, String reason) {
            return source.requeue(item, reason);
        }

        @Override
        public void stopPool() {
            pool.requestStop();
        }
    }
}
