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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Collects the member cards of an organization page, clicking "load more" until no new card appears or the click
 * bound is reached. Members become entities of their own and are listed on the organization; members already
 * known keep their record and only gain this organization among their affiliations.
 */
public class MemberCollectionDriver extends PageDriver {

    private static final Logger log = LogManager.getLogger();

    private final String loadMoreSelector;
    private final int maxClicks;

    public MemberCollectionDriver(ExtractorRules rules, String waitSelector, Duration waitTimeout,
                                  String loadMoreSelector, int maxClicks) {
        super(rules, waitSelector, waitTimeout);
        this.loadMoreSelector = loadMoreSelector == null || loadMoreSelector.isBlank() ? null : loadMoreSelector;
        this.maxClicks = Math.max(0, maxClicks);
    }

    @Override
    public StageOutcome process(EntityRecord record, PageRenderer renderer) throws PageRenderException {
        String key = record.getKey();
        Map<String, StageOutcome.EntityRef> members = new LinkedHashMap<>();
        Extraction first = extract(renderer, load(renderer, key), key);
        collect(first, key, members);

        int clicks = 0;
        while (loadMoreSelector != null && clicks < maxClicks) {
            if (!renderer.click(loadMoreSelector)) break;
            clicks++;
            int before = members.size();
            collect(extract(renderer, renderer.currentHtml(), key), key, members);
            if (members.size() == before) break;
        }
        log.debug("Organization {}: {} members after {} load-more clicks", key, members.size(), clicks);

        Map<String, Object> affiliation = affiliation(key, record.getPayload().get("name"));
        List<Map<String, Object>> list = new ArrayList<>();
        List<StageOutcome.EntityRef> discovered = new ArrayList<>();
        List<StageOutcome.EntityRef> related = new ArrayList<>();
        for (StageOutcome.EntityRef ref : members.values()) {
            Map<String, Object> member = new LinkedHashMap<>();
            member.put("url", ref.key());
            Object name = ref.payload().get("name");
            if (name != null) member.put("name", name);
            list.add(member);

            Map<String, Object> payload = new LinkedHashMap<>(ref.payload());
            payload.put(AFFILIATIONS, List.of(affiliation));
            discovered.add(new StageOutcome.EntityRef(ref.type(), ref.key(), payload));
            related.add(new StageOutcome.EntityRef(ref.type(), ref.key(), Map.of(AFFILIATIONS, List.of(affiliation))));
        }
        Map<String, Object> fields = new LinkedHashMap<>(first.fields());
        fields.put("members", list);
        fields.put("memberCount", list.size());
        return new StageOutcome(fields, discovered, related);
    }

    private static void collect(Extraction extraction, String orgKey, Map<String, StageOutcome.EntityRef> into) {
        for (DiscoveredEntity entity : extraction.discovered()) {
            into.putIfAbsent(entity.url(), toRef(entity, EntityType.ORGANIZATION, orgKey));
        }
    }
}
