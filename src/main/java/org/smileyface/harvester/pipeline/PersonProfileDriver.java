package org.smileyface.harvester.pipeline;

import org.smileyface.harvester.extractor.DiscoveredEntity;
import org.smileyface.harvester.extractor.Extraction;
import org.smileyface.harvester.extractor.ExtractorRules;
import org.smileyface.harvester.render.PageRenderException;
import org.smileyface.harvester.render.PageRenderer;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Enriches a person from their profile page and copies selected profile fields onto the member entry of every
 * organization the person belongs to, matched by the person's URL. Organizations linked from the profile are
 * created when unknown and recorded among the person's affiliations.
 */
public class PersonProfileDriver extends PageDriver {

    private final List<String> backReferenceFields;

    public PersonProfileDriver(ExtractorRules rules, String waitSelector, Duration waitTimeout,
                               List<String> backReferenceFields) {
        super(rules, waitSelector, waitTimeout);
        this.backReferenceFields = backReferenceFields == null ? List.of() : List.copyOf(backReferenceFields);
    }

    @Override
    public StageOutcome process(EntityRecord record, PageRenderer renderer) throws PageRenderException {
        String key = record.getKey();
        Extraction extraction = extract(renderer, load(renderer, key), key);
        Map<String, Object> fields = new LinkedHashMap<>(extraction.fields());
        Set<String> organizations = knownOrganizations(record.getPayload());

        List<StageOutcome.EntityRef> discovered = new ArrayList<>();
        List<Map<String, Object>> listed = new ArrayList<>();
        for (DiscoveredEntity entity : extraction.discovered()) {
            if (EntityType.fromName(entity.type()) != EntityType.ORGANIZATION) continue;
            discovered.add(new StageOutcome.EntityRef(EntityType.ORGANIZATION, entity.url(), cardPayload(entity)));
            listed.add(affiliation(entity.url(), entity.name()));
            organizations.add(entity.url());
        }
        if (!listed.isEmpty()) {
            fields.put(AFFILIATIONS, listed);
        }

        Map<String, Object> member = new LinkedHashMap<>();
        member.put("url", key);
        for (String field : backReferenceFields) {
            Object value = extraction.field(field);
            if (value == null) value = record.getPayload().get(field);
            if (value != null) member.put(field, value);
        }
        List<StageOutcome.EntityRef> related = new ArrayList<>();
        for (String organization : organizations) {
            related.add(new StageOutcome.EntityRef(EntityType.ORGANIZATION, organization, Map.of("members", List.of(member))));
        }
        return new StageOutcome(fields, discovered, related);
    }

    private static Set<String> knownOrganizations(Map<String, Object> payload) {
        Set<String> out = new LinkedHashSet<>();
        if (payload.get(parentField(EntityType.ORGANIZATION)) instanceof String parent) {
            out.add(parent);
        }
        if (payload.get(AFFILIATIONS) instanceof Collection<?> entries) {
            for (Object entry : entries) {
                if (entry instanceof Map<?, ?> m && m.get("url") instanceof String url) out.add(url);
            }
        }
        return out;
    }
}
