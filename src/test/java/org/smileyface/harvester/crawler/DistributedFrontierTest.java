package org.smileyface.harvester.crawler;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.smileyface.harvester.model.WorkItem;
import org.smileyface.harvester.store.InMemoryDocumentStore;
import org.smileyface.harvester.store.StoreCollections;
import org.smileyface.harvester.store.StoreFilter;
import org.smileyface.harvester.testutil.MutableClock;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class DistributedFrontierTest {

    private InMemoryDocumentStore store;
    private MutableClock clock;
    private CrawlerProperties props;

    @BeforeEach
    void setUp() {
        store = new InMemoryDocumentStore();
        StoreCollections.ensureIndexes(store);
        clock = new MutableClock();
        props = FrontierParameterizedTest.properties();
        props.setLeaseDurationMs(1_000);
        props.setMaxRedeliveries(3);
    }

    private DistributedFrontier frontier(String owner) {
        return new DistributedFrontier(store, new UrlPolicy(props), props, owner, clock);
    }

    @Test
    void enqueueFromTwoInstancesStoresOneItem() {
        DistributedFrontier a = frontier("a");
        DistributedFrontier b = frontier("b");

        assertThat(a.enqueue("https://example.com/page", 1, null, Frontier.LINK_PRIORITY)).isTrue();
        assertThat(b.enqueue("https://example.com/page/", 1, null, Frontier.LINK_PRIORITY)).isFalse();
        assertThat(store.count(StoreCollections.WORK_QUEUE, StoreFilter.all())).isEqualTo(1);
    }

    @Test
    void claimSetsOwnerAndLease() {
        DistributedFrontier a = frontier("a");
        a.enqueue("https://example.com/", 0, null, Frontier.SEED_PRIORITY);

        WorkItem item = a.next();

        assertThat(item.getOwner()).isEqualTo("a");
        assertThat(item.getClaimedAt()).isEqualTo(clock.millis());
        assertThat(item.getExpiresAt()).isEqualTo(clock.millis() + 1_000);
    }

    @Test
    void onlyTheOwnerCanCompleteAClaim() {
        DistributedFrontier a = frontier("a");
        DistributedFrontier b = frontier("b");
        a.enqueue("https://example.com/", 0, null, Frontier.SEED_PRIORITY);
        WorkItem item = a.next();

        b.markDone(item);
        assertThat(statusOf(item.getKey())).isEqualTo("CLAIMED");

        a.markDone(item);
        assertThat(statusOf(item.getKey())).isEqualTo("DONE");
    }

    @Test
    void expiredClaimsAreReclaimedForAnotherInstance() {
        DistributedFrontier a = frontier("a");
        DistributedFrontier b = frontier("b");
        a.enqueue("https://example.com/", 0, null, Frontier.SEED_PRIORITY);
        WorkItem lost = a.next();

        assertThat(b.reclaimExpired()).isZero();
        assertThat(b.next()).isNull();

        clock.advance(Duration.ofMillis(1_001));
        assertThat(b.reclaimExpired()).isEqualTo(1);

        WorkItem retaken = b.next();
        assertThat(retaken.getKey()).isEqualTo(lost.getKey());
        assertThat(retaken.getOwner()).isEqualTo("b");
        assertThat(retaken.getRedeliveries()).isEqualTo(1);

        a.markDone(lost);
        assertThat(statusOf(lost.getKey())).isEqualTo("CLAIMED");
    }

    @Test
    void initTruncatesTheSharedQueue() {
        DistributedFrontier a = frontier("a");
        a.enqueue("https://example.com/", 0, null, Frontier.SEED_PRIORITY);

        a.init();

        assertThat(a.pendingCount()).isZero();
        assertThat(a.enqueue("https://example.com/", 0, null, Frontier.SEED_PRIORITY)).isTrue();
    }

    @Test
    void concurrentInstancesNeverClaimTheSameItem() throws InterruptedException {
        DistributedFrontier seeder = frontier("seeder");
        for (int i = 0; i < 50; i++) {
            seeder.enqueue("https://example.com/p/" + i, 1, null, Frontier.LINK_PRIORITY);
        }
        List<String> claimed = Collections.synchronizedList(new ArrayList<>());
        ExecutorService pool = Executors.newFixedThreadPool(4);
        CountDownLatch start = new CountDownLatch(1);
        for (int t = 0; t < 4; t++) {
            DistributedFrontier f = frontier("instance-" + t);
            pool.submit(() -> {
                start.await();
                WorkItem item;
                while ((item = f.next()) != null) {
                    claimed.add(item.getKey());
                }
                return null;
            });
        }
        start.countDown();
        pool.shutdown();
        assertThat(pool.awaitTermination(10, TimeUnit.SECONDS)).isTrue();

        Set<String> unique = new HashSet<>(claimed);
        assertThat(claimed).hasSize(50);
        assertThat(unique).hasSize(50);
    }

    private String statusOf(String key) {
        Map<String, Object> doc = store.findOne(StoreCollections.WORK_QUEUE, StoreFilter.byField("key", key)).orElseThrow();
        return (String) doc.get("status");
    }
}
