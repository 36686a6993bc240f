package org.smileyface.harvester.extractor;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Result of extracting one page.
 *
 * @param fields      named values; absent values are left out rather than stored empty
 * @param links       normalized outgoing links in document order, without duplicates
 * @param discovered  entity links found on the page
 * @param nextPageUrl pagination target, or null
 */
public record Extraction(Map<String, Object> fields, List<String> links, List<DiscoveredEntity> discovered,
                         String nextPageUrl) {

    public Extraction {
        fields = fields == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(fields));
        links = links == null ? List.of() : List.copyOf(links);
        discovered = discovered == null ? List.of() : List.copyOf(discovered);
    }

    public Object field(String name) {
        return fields.get(name);
    }
}
