package org.smileyface.harvester.crawler;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.smileyface.harvester.model.WorkItem;
import org.smileyface.harvester.model.WorkStatus;
import org.smileyface.harvester.store.DocumentStore;
import org.smileyface.harvester.store.Documents;
import org.smileyface.harvester.store.StoreCollections;
import org.smileyface.harvester.store.StoreException;
import org.smileyface.harvester.store.StoreFilter;
import org.smileyface.harvester.store.StoreSort;
import org.smileyface.harvester.store.StoreUpdate;
import org.smileyface.harvester.util.CrawlerUtils;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Frontier shared by every process through the {@code work_queue} collection. Enqueue relies on the unique
 * {@code key} index; {@link #next()} claims one item with a single atomic find-and-update.
 *
 * <p>There is no global "done" signal: a worker treats the queue as drained after
 * {@code emptyPollThreshold} consecutive polls of its own found nothing. Another instance may still be about
 * to enqueue links at that point; raise the threshold or interval if that matters.</p>
 */
public class DistributedFrontier extends AbstractFrontier {

    private static final Logger log = LogManager.getLogger();

    private static final String KEY = "key";
    private static final String STATUS = "status";
    private static final String OWNER = "owner";
    private static final String CLAIMED_AT = "claimedAt";
    private static final String EXPIRES_AT = "expiresAt";
    private static final String LAST_ERROR = "lastError";
    private static final String REDELIVERIES = "redeliveries";

    private static final StoreSort CLAIM_ORDER = StoreSort.desc("priority").thenAsc("createdAt");

    private final DocumentStore store;
    private final String ownerId;
    private final long leaseMs;
    private final Clock clock;
    private final int emptyPollThreshold;
    private final Duration emptyPollInterval;
    private final int maxRedeliveries;
    private final ThreadLocal<int[]> emptyPolls = ThreadLocal.withInitial(() -> new int[1]);

    public DistributedFrontier(DocumentStore store, UrlPolicy policy, CrawlerProperties properties, String ownerId, Clock clock) {
        super(policy, properties.getMaxDepth());
        this.store = Objects.requireNonNull(store, "store");
        this.ownerId = Objects.requireNonNull(ownerId, "ownerId");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.leaseMs = properties.getLeaseDurationMs();
        this.emptyPollThreshold = Math.max(1, properties.getEmptyPollThreshold());
        this.emptyPollInterval = Duration.ofMillis(Math.max(0, properties.getEmptyPollIntervalMs()));
        this.maxRedeliveries = Math.max(0, properties.getMaxRedeliveries());
    }

    /**
     * Truncates the shared queue. Never called implicitly.
     */
    @Override
    public void init() {
        store.drop(StoreCollections.WORK_QUEUE);
        store.ensureUniqueIndex(StoreCollections.WORK_QUEUE, KEY);
    }

    @Override
    public boolean enqueue(String url, int depth, String parentUrl, int priority) {
        String key = CrawlerUtils.normalizeUrl(url);
        if (key == null) return false;
        WorkItem item = new WorkItem(key, CrawlerUtils.domainOf(key), depth, parentUrl, priority);
        item.setCreatedAt(clock.millis());
        try {
            return store.insertIfAbsent(StoreCollections.WORK_QUEUE, StoreFilter.byField(KEY, key), Documents.toDocument(item));
        } catch (StoreException e) {
            log.warn("Could not enqueue {}: {}", key, e.getMessage());
            return false;
        }
    }

    @Override
    public WorkItem next() {
        long now = clock.millis();
        StoreUpdate claim = StoreUpdate.create()
                .set(STATUS, WorkStatus.CLAIMED.name())
                .set(OWNER, ownerId)
                .set(CLAIMED_AT, now)
                .set(EXPIRES_AT, now + leaseMs);
        Optional<Map<String, Object>> doc = store.findAndUpdate(StoreCollections.WORK_QUEUE,
                StoreFilter.byField(STATUS, WorkStatus.PENDING.name()), claim, CLAIM_ORDER);
        return doc.map(d -> Documents.fromDocument(d, WorkItem.class)).orElse(null);
    }

    @Override
    public WorkItem poll(Duration timeout) throws InterruptedException {
        WorkItem item;
        try {
            item = next();
        } catch (StoreException e) {
            log.warn("Claiming from the shared queue failed: {}", e.getMessage());
            item = null;
        }
        int[] counter = emptyPolls.get();
        if (item != null) {
            counter[0] = 0;
            return item;
        }
        counter[0]++;
        if (!emptyPollInterval.isZero()) {
            Thread.sleep(emptyPollInterval.toMillis());
        }
        return null;
    }

    @Override
    public boolean isDrained() {
        return emptyPolls.get()[0] >= emptyPollThreshold;
    }

    @Override
    public boolean requeue(WorkItem item, String reason) {
        if (item.getRedeliveries() >= maxRedeliveries) {
            markFailed(item, reason);
            return false;
        }
        StoreUpdate back = StoreUpdate.create()
                .set(STATUS, WorkStatus.PENDING.name())
                .set(LAST_ERROR, reason)
                .unset(OWNER).unset(CLAIMED_AT).unset(EXPIRES_AT)
                .inc(REDELIVERIES, 1);
        return update(item, back) > 0;
    }

    @Override
    public void release(WorkItem item) {
        update(item, StoreUpdate.create()
                .set(STATUS, WorkStatus.PENDING.name())
                .unset(OWNER).unset(CLAIMED_AT).unset(EXPIRES_AT));
    }

    @Override
    public void markDone(WorkItem item) {
        if (update(item, StoreUpdate.create().set(STATUS, WorkStatus.DONE.name()).unset(EXPIRES_AT)) == 0) {
            log.warn("Claim on {} was lost before it completed", item.getKey());
        }
    }

    @Override
    public void markFailed(WorkItem item, String error) {
        update(item, StoreUpdate.create().set(STATUS, WorkStatus.FAILED.name()).set(LAST_ERROR, error).unset(EXPIRES_AT));
    }

    /**
     * Returns items whose claim expired (their worker died) to pending.
     *
     * @return number of reclaimed items
     */
    public long reclaimExpired() {
        try {
            long n = store.updateMany(StoreCollections.WORK_QUEUE,
                    StoreFilter.byField(STATUS, WorkStatus.CLAIMED.name()).lt(EXPIRES_AT, clock.millis()),
                    StoreUpdate.create()
                            .set(STATUS, WorkStatus.PENDING.name())
                            .set(LAST_ERROR, "claim expired")
                            .unset(OWNER).unset(CLAIMED_AT).unset(EXPIRES_AT)
                            .inc(REDELIVERIES, 1));
            if (n > 0) {
                log.info("Reclaimed {} queue items with expired claims", n);
            }
            return n;
        } catch (StoreException e) {
            log.warn("Reclaiming expired queue items failed: {}", e.getMessage());
            return 0;
        }
    }

    @Override
    public long pendingCount() {
        return store.count(StoreCollections.WORK_QUEUE, StoreFilter.byField(STATUS, WorkStatus.PENDING.name()));
    }

    private long update(WorkItem item, StoreUpdate update) {
        try {
            return store.updateMany(StoreCollections.WORK_QUEUE,
                    StoreFilter.byField(KEY, item.getKey()).eq(OWNER, ownerId), update);
        } catch (StoreException e) {
            log.warn("Updating queue item {} failed: {}", item.getKey(), e.getMessage());
            return 0;
        }
    }
}
