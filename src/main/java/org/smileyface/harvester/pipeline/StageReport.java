package org.smileyface.harvester.pipeline;

import java.util.Map;

/**
 * Counters of one stage run: total, inserted, updated, skipped and errors.
 */
public record StageReport(int index, String name, EntityType type, int selected, Map<String, Long> counters,
                          long durationMs) {

    public long count(String counter) {
        return counters.getOrDefault(counter, 0L);
    }
}
