package org.smileyface.harvester.extractor;

import java.util.Map;

/**
 * A link to another record found on a page, e.g. an organization card on a listing page.
 *
 * @param type   entity type name as configured in the extraction rules
 * @param url    normalized absolute URL of the entity's own page
 * @param name   display name, may be null
 * @param fields additional values read from the card
 */
public record DiscoveredEntity(String type, String url, String name, Map<String, Object> fields) {

    public DiscoveredEntity {
        fields = fields == null ? Map.of() : Map.copyOf(fields);
    }
}
