package org.smileyface.harvester.model;

/**
 * Crawl outcome stored on a {@link PageRecord}.
 */
public enum CrawlStatus {
    /** Known but not fetched yet. */
    PENDING,

    /** Fetched and parsed. */
    CRAWLED,

    /** Fetch or parse failed after the retry budget was spent. */
    FAILED
}
