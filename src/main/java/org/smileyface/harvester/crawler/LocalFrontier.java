package org.smileyface.harvester.crawler;

import org.smileyface.harvester.model.WorkItem;
import org.smileyface.harvester.model.WorkStatus;
import org.smileyface.harvester.util.CrawlerUtils;

import java.time.Duration;
import java.util.Comparator;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.PriorityBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-process frontier: a priority queue plus a visited map, both safe for concurrent workers.
 */
public class LocalFrontier extends AbstractFrontier {

    private record Entry(WorkItem item, long seq) {}

    private static final Comparator<Entry> ORDER = Comparator
            .comparingInt((Entry e) -> e.item().getPriority()).reversed()
            .thenComparingLong(Entry::seq);

    private final PriorityBlockingQueue<Entry> queue = new PriorityBlockingQueue<>(64, ORDER);
    private final Map<String, WorkStatus> seen = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();
    private final int maxRedeliveries;

    public LocalFrontier(UrlPolicy policy, int maxDepth, int maxRedeliveries) {
        super(policy, maxDepth);
        this.maxRedeliveries = Math.max(0, maxRedeliveries);
    }

    @Override
    public void init() {
        queue.clear();
        seen.clear();
    }

    @Override
    public boolean enqueue(String url, int depth, String parentUrl, int priority) {
        String key = CrawlerUtils.normalizeUrl(url);
        if (key == null) return false;
        if (seen.putIfAbsent(key, WorkStatus.PENDING) != null) {
            return false;
        }
        queue.add(new Entry(new WorkItem(key, CrawlerUtils.domainOf(key), depth, parentUrl, priority), sequence.incrementAndGet()));
        return true;
    }

    @Override
    public WorkItem next() {
        return claim(queue.poll());
    }

    @Override
    public WorkItem poll(Duration timeout) throws InterruptedException {
        return claim(queue.poll(timeout.toMillis(), TimeUnit.MILLISECONDS));
    }

    private WorkItem claim(Entry e) {
        if (e == null) return null;
        WorkItem item = e.item();
        item.setStatus(WorkStatus.CLAIMED);
        seen.put(item.getKey(), WorkStatus.CLAIMED);
        return item;
    }

    @Override
    public boolean isDrained() {
        return queue.isEmpty();
    }

    @Override
    public boolean requeue(WorkItem item, String reason) {
        if (item.getRedeliveries() >= maxRedeliveries) {
            markFailed(item, reason);
            return false;
        }
        item.setRedeliveries(item.getRedeliveries() + 1);
        item.setStatus(WorkStatus.PENDING);
        item.setLastError(reason);
        seen.put(item.getKey(), WorkStatus.PENDING);
        queue.add(new Entry(item, sequence.incrementAndGet()));
        return true;
    }

    @Override
    public void release(WorkItem item) {
        item.setStatus(WorkStatus.PENDING);
        seen.put(item.getKey(), WorkStatus.PENDING);
        queue.add(new Entry(item, sequence.incrementAndGet()));
    }

    @Override
    public void markDone(WorkItem item) {
        item.setStatus(WorkStatus.DONE);
        seen.put(item.getKey(), WorkStatus.DONE);
    }

    @Override
    public void markFailed(WorkItem item, String error) {
        item.setStatus(WorkStatus.FAILED);
        item.setLastError(error);
        seen.put(item.getKey(), WorkStatus.FAILED);
    }

    @Override
    public long pendingCount() {
        return queue.size();
    }

    /**
     * Status of a URL in this run, or null if it was never enqueued.
     */
    public WorkStatus statusOf(String url) {
        String key = CrawlerUtils.normalizeUrl(url);
        return key == null ? null : seen.get(key);
    }

    public int seenCount() {
        return seen.size();
    }
}
