package org.smileyface.harvester.crawler;

import org.smileyface.harvester.model.WorkItem;
import org.smileyface.harvester.processor.WorkSource;

import java.util.Collection;

/**
 * The set of URLs still to crawl. Each URL moves unseen, enqueued, in progress, then crawled or failed, and is
 * enqueued at most once per run.
 */
public interface Frontier extends WorkSource<WorkItem> {

    int SEED_PRIORITY = 10;
    int SITEMAP_PRIORITY = 5;
    int LINK_PRIORITY = 0;

    /**
     * Clears all queued state.
     */
    void init();

    /**
     * Adds a URL unless it was seen before.
     *
     * @return true when the URL was new
     */
    boolean enqueue(String url, int depth, String parentUrl, int priority);

    /**
     * Adds the links found on a page at {@code parentDepth}. Children get depth {@code parentDepth + 1} and are
     * dropped when that exceeds the maximum depth or the URL policy rejects them.
     *
     * @return number of newly enqueued links
     */
    int enqueueDiscovered(Collection<String> links, int parentDepth, String parentUrl);

    /**
     * Highest priority, then oldest, pending item, now marked in progress; null when none is available.
     */
    WorkItem next();

    /**
     * Puts a taken item back to pending without counting a redelivery, for items that were never attempted.
     */
    void release(WorkItem item);

    void markDone(WorkItem item);

    void markFailed(WorkItem item, String error);

    long pendingCount();
}
