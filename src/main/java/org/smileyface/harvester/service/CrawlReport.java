package org.smileyface.harvester.service;

import org.smileyface.harvester.graph.SiteGraph;

import java.util.List;
import java.util.Map;

/**
 * Outcome of one crawl run.
 *
 * @param counters crawled, failed, skipped and links_found, summed over all workers
 */
public record CrawlReport(CrawlMode mode, Map<String, Long> counters, List<SiteGraph> siteGraphs, long durationMs) {

    public long count(String counter) {
        return counters.getOrDefault(counter, 0L);
    }
}
