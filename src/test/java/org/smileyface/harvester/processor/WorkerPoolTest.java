package org.smileyface.harvester.processor;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.smileyface.harvester.render.PageRendererFactory;
import org.smileyface.harvester.testutil.StaticPageRenderer;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WorkerPoolTest {

    private static final WorkerPool.Settings FAST =
            new WorkerPool.Settings(Duration.ofMillis(20), Duration.ofMillis(20), Duration.ZERO);

    private WorkerPool<String> pool;

    @AfterEach
    void tearDown() {
        if (pool != null && pool.isRunning()) {
            pool.stopAll();
        }
    }

    private static QueueWorkSource<String> source(List<String> items, int maxRedeliveries) {
        return new QueueWorkSource<>(items, Function.identity(), maxRedeliveries);
    }

    private static List<String> items(int n) {
        return IntStream.range(0, n).mapToObj(i -> "item-" + i).collect(Collectors.toList());
    }

    @Test
    void workers_processEveryItemOnce_andComplete() {
        Set<String> handled = ConcurrentHashMap.newKeySet();
        AtomicInteger duplicates = new AtomicInteger();
        pool = new WorkerPool<>("test");

        pool.start(4, source(items(40), 0), (item, ctx) -> {
            if (!handled.add(item)) duplicates.incrementAndGet();
            ctx.stats().increment(WorkerStats.CRAWLED);
        }, null, FAST);

        assertThat(pool.awaitAll(Duration.ofSeconds(10))).as("pool should finish within timeout").isTrue();
        assertThat(handled).hasSize(40);
        assertThat(duplicates.get()).isZero();
        assertThat(pool.aggregateStats().get(WorkerStats.CRAWLED)).isEqualTo(40);
        assertThat(pool.getStatuses()).hasSize(4)
                .allMatch(s -> s.getState() == WorkerState.COMPLETED, "all workers report COMPLETED");
        assertThat(pool.isRunning()).isFalse();
    }

    @Test
    void itemsDiscoveredWhileProcessing_areNotMissedByIdleWorkers() {
        QueueWorkSource<String> source = source(List.of("root"), 0);
        Set<String> handled = ConcurrentHashMap.newKeySet();
        pool = new WorkerPool<>("discover");

        pool.start(3, source, (item, ctx) -> {
            handled.add(item);
            if (item.equals("root")) {
                Thread.sleep(100);
                for (int i = 0; i < 5; i++) source.add("child-" + i);
            }
        }, null, FAST);

        assertThat(pool.awaitAll(Duration.ofSeconds(10))).isTrue();
        assertThat(handled).hasSize(6);
    }

    @Test
    void handlerFailures_areCountedAndDoNotStopTheWorker() {
        List<String> failed = Collections.synchronizedList(new ArrayList<>());
        pool = new WorkerPool<>("failing");

        pool.start(1, source(items(5), 0), new ItemHandler<>() {
            @Override
            public void handle(String item, WorkerContext<String> context) {
                if (item.equals("item-2")) throw new IllegalStateException("boom");
                context.stats().increment(WorkerStats.CRAWLED);
            }

            @Override
            public void onFailure(String item, Exception error, WorkerContext<String> context) {
                failed.add(item + ":" + error.getMessage());
                context.stats().increment(WorkerStats.FAILED);
            }
        }, null, FAST);

        assertThat(pool.awaitAll(Duration.ofSeconds(10))).isTrue();
        assertThat(failed).containsExactly("item-2:boom");
        WorkerStatus status = pool.getStatuses().get(0);
        assertThat(status.getProcessedCount()).isEqualTo(4);
        assertThat(status.getFailedCount()).isEqualTo(1);
        assertThat(status.getLastError()).isEqualTo("boom");
        assertThat(pool.aggregateStats().asMap()).containsEntry(WorkerStats.CRAWLED, 4L).containsEntry(WorkerStats.FAILED, 1L);
    }

    @Test
    void requeue_isBoundedByMaxRedeliveries() {
        AtomicInteger attempts = new AtomicInteger();
        AtomicInteger rejected = new AtomicInteger();
        pool = new WorkerPool<>("requeue");

        pool.start(2, source(List.of("busy"), 2), (item, ctx) -> {
            attempts.incrementAndGet();
            if (!ctx.requeue(item, "lease held elsewhere")) rejected.incrementAndGet();
        }, null, FAST);

        assertThat(pool.awaitAll(Duration.ofSeconds(10))).isTrue();
        assertThat(attempts.get()).isEqualTo(3);
        assertThat(rejected.get()).isEqualTo(1);
    }

    @Test
    void stopPool_fromAHandler_leavesRemainingItemsQueued() {
        QueueWorkSource<String> source = source(items(20), 0);
        AtomicInteger handled = new AtomicInteger();
        pool = new WorkerPool<>("budget");

        pool.start(1, source, (item, ctx) -> {
            if (handled.incrementAndGet() == 3) ctx.stopPool();
        }, null, FAST);

        assertThat(pool.awaitAll(Duration.ofSeconds(10))).isTrue();
        assertThat(handled.get()).isEqualTo(3);
        assertThat(source.size()).isEqualTo(17);
        assertThat(pool.getStatuses().get(0).getState()).isEqualTo(WorkerState.STOPPED);
    }

    @Test
    void stopAll_stopsLongRunningWorkers() {
        QueueWorkSource<String> source = source(items(1000), 0);
        pool = new WorkerPool<>("stop");

        pool.start(2, source, (item, ctx) -> Thread.sleep(5), null, FAST);
        pool.stopAll();

        assertThat(pool.isRunning()).isFalse();
        assertThat(source.size()).isGreaterThan(0);
        assertThat(pool.getStatuses()).allMatch(s -> s.getState() == WorkerState.STOPPED);
    }

    @Test
    void eachWorkerOwnsOneRenderer_closedWhenItFinishes() {
        AtomicInteger created = new AtomicInteger();
        AtomicInteger closed = new AtomicInteger();
        Set<Object> seenRenderers = ConcurrentHashMap.newKeySet();
        PageRendererFactory factory = () -> {
            created.incrementAndGet();
            return new StaticPageRenderer(Map.of(), StaticPageRenderer.openedList()) {
                @Override
                public void close() {
                    closed.incrementAndGet();
                    super.close();
                }
            };
        };
        pool = new WorkerPool<>("renderers");

        pool.start(3, source(items(30), 0), (item, ctx) -> seenRenderers.add(ctx.renderer()), factory, FAST);

        assertThat(pool.awaitAll(Duration.ofSeconds(10))).isTrue();
        assertThat(created.get()).isEqualTo(3);
        assertThat(closed.get()).isEqualTo(3);
        assertThat(seenRenderers.size()).isBetween(1, 3);
    }

    @Test
    void start_twiceWhileRunning_isRejected() {
        pool = new WorkerPool<>("twice");
        pool.start(1, source(items(1000), 0), (item, ctx) -> Thread.sleep(5), null, FAST);

        assertThatThrownBy(() -> pool.start(1, source(items(1), 0), (item, ctx) -> { }, null, FAST))
                .isInstanceOf(IllegalStateException.class);
    }
}
