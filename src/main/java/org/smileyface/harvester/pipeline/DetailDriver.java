package org.smileyface.harvester.pipeline;

import org.smileyface.harvester.extractor.DiscoveredEntity;
import org.smileyface.harvester.extractor.Extraction;
import org.smileyface.harvester.extractor.ExtractorRules;
import org.smileyface.harvester.render.PageRenderException;
import org.smileyface.harvester.render.PageRenderer;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Enriches an entity from its own detail page.
 */
public class DetailDriver extends PageDriver {

    private final EntityType type;

    public DetailDriver(EntityType type, ExtractorRules rules, String waitSelector, Duration waitTimeout) {
        super(rules, waitSelector, waitTimeout);
        this.type = type;
    }

    @Override
    public StageOutcome process(EntityRecord record, PageRenderer renderer) throws PageRenderException {
        String html = load(renderer, record.getKey());
        Extraction extraction = extract(renderer, html, record.getKey());
        List<StageOutcome.EntityRef> discovered = new ArrayList<>();
        for (DiscoveredEntity entity : extraction.discovered()) {
            discovered.add(toRef(entity, type, record.getKey()));
        }
        return new StageOutcome(extraction.fields(), discovered, null);
    }
}
