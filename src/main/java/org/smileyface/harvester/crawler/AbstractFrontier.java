package org.smileyface.harvester.crawler;

import org.smileyface.harvester.util.CrawlerUtils;

import java.util.Collection;
import java.util.Objects;

/**
 * Shared link admission rules of every {@link Frontier}.
 */
public abstract class AbstractFrontier implements Frontier {

    protected final UrlPolicy policy;
    protected final int maxDepth;

    protected AbstractFrontier(UrlPolicy policy, int maxDepth) {
        this.policy = Objects.requireNonNull(policy, "policy");
        this.maxDepth = Math.max(0, maxDepth);
    }

    @Override
    public int enqueueDiscovered(Collection<String> links, int parentDepth, String parentUrl) {
        int childDepth = parentDepth + 1;
        if (childDepth > maxDepth || links == null) {
            return 0;
        }
        int added = 0;
        for (String link : links) {
            String normalized = CrawlerUtils.normalizeUrl(link);
            if (normalized == null || !policy.accepts(normalized)) continue;
            if (enqueue(normalized, childDepth, parentUrl, LINK_PRIORITY)) added++;
        }
        return added;
    }

    public int getMaxDepth() {
        return maxDepth;
    }
}
