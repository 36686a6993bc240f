package org.smileyface.harvester.pipeline;

import org.smileyface.harvester.extractor.DiscoveredEntity;
import org.smileyface.harvester.extractor.Extraction;
import org.smileyface.harvester.extractor.ExtractorRules;
import org.smileyface.harvester.extractor.PageExtractor;
import org.smileyface.harvester.extractor.SelectorPageExtractor;
import org.smileyface.harvester.render.PageRenderException;
import org.smileyface.harvester.render.PageRenderer;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Base of the drivers that load an entity's page and run selector rules over it.
 */
abstract class PageDriver implements StageDriver {

    protected final PageExtractor extractor;
    private final String waitSelector;
    private final Duration waitTimeout;

    protected PageDriver(ExtractorRules rules, String waitSelector, Duration waitTimeout) {
        this.extractor = new SelectorPageExtractor(rules == null ? new ExtractorRules() : rules);
        this.waitSelector = waitSelector == null || waitSelector.isBlank() ? null : waitSelector;
        this.waitTimeout = waitTimeout == null ? Duration.ofSeconds(10) : waitTimeout;
    }

    protected String load(PageRenderer renderer, String url) throws PageRenderException {
        if (renderer == null) {
            throw new IllegalStateException(getClass().getSimpleName() + " needs a page renderer");
        }
        String html = renderer.open(url);
        if (waitSelector != null) {
            renderer.waitFor(waitSelector, waitTimeout);
            html = renderer.currentHtml();
        }
        return html;
    }

    protected Extraction extract(PageRenderer renderer, String html, String fallbackUrl) {
        String url = renderer.currentUrl() != null ? renderer.currentUrl() : fallbackUrl;
        return extractor.extract(html, url);
    }

    /** List of {@code {url, name}} entries naming the organizations a person belongs to. */
    static final String AFFILIATIONS = "affiliations";

    /**
     * Turns an entity link into a reference carrying its name, card fields and the key of the page it was found on.
     */
    protected static StageOutcome.EntityRef toRef(DiscoveredEntity entity, EntityType foundOn, String foundOnKey) {
        Map<String, Object> payload = cardPayload(entity);
        payload.put(parentField(foundOn), foundOnKey);
        return new StageOutcome.EntityRef(EntityType.fromName(entity.type()), entity.url(), payload);
    }

    protected static Map<String, Object> cardPayload(DiscoveredEntity entity) {
        Map<String, Object> payload = new LinkedHashMap<>(entity.fields());
        payload.put("url", entity.url());
        if (entity.name() != null) payload.put("name", entity.name());
        return payload;
    }

    protected static Map<String, Object> affiliation(String organizationKey, Object name) {
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("url", organizationKey);
        if (name instanceof String s && !s.isBlank()) entry.put("name", s);
        return entry;
    }

    static String parentField(EntityType type) {
        return type.name().toLowerCase(Locale.ROOT);
    }
}
