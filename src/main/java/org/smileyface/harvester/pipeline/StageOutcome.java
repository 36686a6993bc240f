package org.smileyface.harvester.pipeline;

import java.util.List;
import java.util.Map;

/**
 * What a driver learned about one entity.
 *
 * @param fields     values to merge into the entity itself
 * @param discovered entities found on its page; inserted at their initial stage only if absent, an existing record
 *                   is left as it is
 * @param related    values to merge into other existing entities, such as a back-reference on an organization
 */
public record StageOutcome(Map<String, Object> fields, List<EntityRef> discovered, List<EntityRef> related) {

    public record EntityRef(EntityType type, String key, Map<String, Object> payload) {}

    public StageOutcome {
        fields = fields == null ? Map.of() : fields;
        discovered = discovered == null ? List.of() : List.copyOf(discovered);
        related = related == null ? List.of() : List.copyOf(related);
    }

    public static StageOutcome of(Map<String, Object> fields) {
        return new StageOutcome(fields, List.of(), List.of());
    }
}
