package org.smileyface.harvester.service;

import java.util.Locale;

/**
 * How a crawl is executed.
 */
public enum CrawlMode {
    /** One loop on the calling thread with a single renderer. */
    SINGLE,

    /** A worker pool over an in-process frontier. */
    THREADED,

    /** A worker pool over the shared store-backed frontier, coordinated by leases. */
    DISTRIBUTED;

    public static CrawlMode parse(String value) {
        if (value == null || value.isBlank()) return SINGLE;
        return CrawlMode.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
