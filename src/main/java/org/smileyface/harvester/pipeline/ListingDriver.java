package org.smileyface.harvester.pipeline;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.smileyface.harvester.extractor.DiscoveredEntity;
import org.smileyface.harvester.extractor.Extraction;
import org.smileyface.harvester.extractor.ExtractorRules;
import org.smileyface.harvester.render.PageRenderException;
import org.smileyface.harvester.render.PageRenderer;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Reads a listing page and every following page up to a bound, and reports the entity cards found on them.
 * Used for sources (listing locations) and locations (listing organizations).
 */
public class ListingDriver extends PageDriver {

    private static final Logger log = LogManager.getLogger();

    private final EntityType type;
    private final int maxPages;

    public ListingDriver(EntityType type, ExtractorRules rules, String waitSelector, Duration waitTimeout, int maxPages) {
        super(rules, waitSelector, waitTimeout);
        this.type = type;
        this.maxPages = Math.max(1, maxPages);
    }

    @Override
    public StageOutcome process(EntityRecord record, PageRenderer renderer) throws PageRenderException {
        String url = record.getKey();
        Set<String> visited = new HashSet<>();
        visited.add(url);
        Map<String, StageOutcome.EntityRef> found = new LinkedHashMap<>();
        Map<String, Object> fields = new LinkedHashMap<>();

        String html = load(renderer, url);
        int page = 1;
        for (;;) {
            Extraction extraction = extract(renderer, html, url);
            if (page == 1) fields.putAll(extraction.fields());
            for (DiscoveredEntity entity : extraction.discovered()) {
                found.putIfAbsent(entity.url(), toRef(entity, type, record.getKey()));
            }
            String next = extraction.nextPageUrl();
            if (next == null || page >= maxPages || !visited.add(next)) {
                break;
            }
            html = load(renderer, next);
            page++;
        }
        log.debug("{} {}: {} entities on {} pages", type, url, found.size(), page);
        fields.put("listingPages", page);
        return new StageOutcome(fields, new ArrayList<>(found.values()), null);
    }
}
