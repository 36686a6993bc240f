package org.smileyface.harvester.pipeline;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.smileyface.harvester.lease.LeaseManager;
import org.smileyface.harvester.processor.ItemHandler;
import org.smileyface.harvester.processor.QueueWorkSource;
import org.smileyface.harvester.processor.WorkerContext;
import org.smileyface.harvester.processor.WorkerPool;
import org.smileyface.harvester.processor.WorkerStats;
import org.smileyface.harvester.render.PageRendererFactory;
import org.smileyface.harvester.store.UpsertResult;

import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Runs one {@link StageDefinition} over the next batch of entities with a {@link WorkerPool}. When a
 * {@link LeaseManager} is given, each entity is leased for the stage so that instances sharing the store do not
 * process it twice.
 */
public class StageRunner {

    private static final Logger log = LogManager.getLogger();

    private final EntityRepository repository;
    private final PageRendererFactory rendererFactory;
    private final WorkerPool.Settings settings;
    private final int maxRetries;
    private final int maxRedeliveries;
    private final Clock clock;

    public StageRunner(EntityRepository repository, PageRendererFactory rendererFactory, WorkerPool.Settings settings,
                       int maxRetries, int maxRedeliveries, Clock clock) {
        this.repository = Objects.requireNonNull(repository, "repository");
        this.rendererFactory = Objects.requireNonNull(rendererFactory, "rendererFactory");
        this.settings = settings == null ? WorkerPool.Settings.defaults() : settings;
        this.maxRetries = maxRetries;
        this.maxRedeliveries = maxRedeliveries;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * @param limit   maximum number of entities to take; {@code <= 0} takes every pending one
     * @param workers pool size
     * @param leases  lease manager for multi-instance runs, or null
     */
    public StageReport run(StageDefinition stage, int limit, int workers, LeaseManager leases) {
        long startedAt = clock.millis();
        List<EntityRecord> batch = repository.selectForStage(stage.type(), stage.exit(), maxRetries, limit);
        log.info("Stage {} ({}) selected {} {} records", stage.index(), stage.name(), batch.size(), stage.type());
        if (batch.isEmpty()) {
            return new StageReport(stage.index(), stage.name(), stage.type(), 0, new WorkerStats().asMap(), 0L);
        }

        QueueWorkSource<EntityRecord> source = new QueueWorkSource<>(batch, EntityRecord::getKey, maxRedeliveries);
        WorkerPool<EntityRecord> pool = new WorkerPool<>(stage.name());
        pool.start(Math.min(Math.max(1, workers), batch.size()), source, new Handler(stage, leases), rendererFactory, settings);
        try {
            pool.awaitAll(null);
        } finally {
            if (pool.isRunning()) pool.stopAll();
        }

        WorkerStats stats = pool.aggregateStats();
        long duration = clock.millis() - startedAt;
        log.info("Stage {} ({}) finished in {} ms: {}", stage.index(), stage.name(), duration, stats);
        return new StageReport(stage.index(), stage.name(), stage.type(), batch.size(), stats.asMap(), duration);
    }

    private final class Handler implements ItemHandler<EntityRecord> {

        private final StageDefinition stage;
        private final LeaseManager leases;

        Handler(StageDefinition stage, LeaseManager leases) {
            this.stage = stage;
            this.leases = leases;
        }

        @Override
        public void handle(EntityRecord record, WorkerContext<EntityRecord> ctx) throws Exception {
            if (leases == null) {
                process(record, ctx);
                return;
            }
            String leaseKey = stage.leaseKey(record.getKey());
            if (!leases.claim(leaseKey)) {
                log.debug("{} is leased elsewhere", leaseKey);
                if (!ctx.requeue(record, "lease held elsewhere")) {
                    ctx.stats().increment(WorkerStats.TOTAL);
                    ctx.stats().increment(WorkerStats.SKIPPED);
                }
                return;
            }
            try {
                process(record, ctx);
            } finally {
                leases.release(leaseKey);
            }
        }

        private void process(EntityRecord selected, WorkerContext<EntityRecord> ctx) throws Exception {
            WorkerStats stats = ctx.stats();
            stats.increment(WorkerStats.TOTAL);
            // another instance may have finished it since the batch was selected
            Optional<EntityRecord> current = repository.find(stage.type(), selected.getKey());
            if (current.isEmpty() || !stage.type().precedes(current.get().getStage(), stage.exit())) {
                stats.increment(WorkerStats.SKIPPED);
                return;
            }
            EntityRecord record = current.get();

            StageOutcome outcome = stage.driver().process(record, ctx.renderer());
            for (StageOutcome.EntityRef ref : outcome.discovered()) {
                boolean created = repository.insertIfAbsent(ref.type(), ref.key(), ref.payload());
                stats.increment(created ? WorkerStats.INSERTED : WorkerStats.SKIPPED);
            }
            for (StageOutcome.EntityRef ref : outcome.related()) {
                if (repository.mergeInto(ref.type(), ref.key(), ref.payload()) == UpsertResult.MODIFIED) {
                    stats.increment(WorkerStats.UPDATED);
                }
            }
            count(stats, repository.advance(stage.type(), record.getKey(), stage.exit(), outcome.fields()));
        }

        @Override
        public void onFailure(EntityRecord record, Exception error, WorkerContext<EntityRecord> ctx) {
            ctx.stats().increment(WorkerStats.ERRORS);
            repository.recordFailure(stage.type(), record.getKey(), error.getMessage(), maxRetries);
        }

        @Override
        public String describe(EntityRecord record) {
            return stage.type() + " " + record.getKey();
        }

        private void count(WorkerStats stats, UpsertResult result) {
            switch (result) {
                case INSERTED -> stats.increment(WorkerStats.INSERTED);
                case MODIFIED -> stats.increment(WorkerStats.UPDATED);
                case UNCHANGED -> stats.increment(WorkerStats.SKIPPED);
            }
        }
    }
}
