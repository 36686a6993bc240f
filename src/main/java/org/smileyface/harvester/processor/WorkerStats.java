package org.smileyface.harvester.processor;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Named counters owned by a single worker and summed once when the pool joins.
 * Not thread-safe.
 */
public class WorkerStats {

    public static final String CRAWLED = "crawled";
    public static final String FAILED = "failed";
    public static final String SKIPPED = "skipped";
    public static final String LINKS_FOUND = "links_found";
    public static final String ASSETS = "assets";

    public static final String TOTAL = "total";
    public static final String INSERTED = "inserted";
    public static final String UPDATED = "updated";
    public static final String ERRORS = "errors";

    private final Map<String, Long> counters = new LinkedHashMap<>();

    public void increment(String name) {
        add(name, 1);
    }

    public void add(String name, long delta) {
        counters.merge(name, delta, Long::sum);
    }

    public long get(String name) {
        return counters.getOrDefault(name, 0L);
    }

    public WorkerStats merge(WorkerStats other) {
        if (other != null) {
            other.counters.forEach(this::add);
        }
        return this;
    }

    public Map<String, Long> asMap() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(counters));
    }

    @Override
    public String toString() {
        return counters.toString();
    }
}
