package org.smileyface.harvester.merge;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Correlation keys used to match elements of list-of-object fields. For each element the first key with a
 * non-empty value identifies it; elements without any key are matched by full equality.
 */
public final class MergePolicy {

    public static final List<String> DEFAULT_KEYS = List.of("url", "name");

    private static final MergePolicy DEFAULT = new MergePolicy(DEFAULT_KEYS, Map.of());

    private final List<String> defaultKeys;
    private final Map<String, List<String>> fieldKeys;

    private MergePolicy(List<String> defaultKeys, Map<String, List<String>> fieldKeys) {
        this.defaultKeys = List.copyOf(defaultKeys);
        this.fieldKeys = Map.copyOf(fieldKeys);
    }

    public static MergePolicy defaults() {
        return DEFAULT;
    }

    /**
     * Returns a policy that correlates elements of {@code field} by {@code keys} (in order of preference).
     */
    public MergePolicy withKeys(String field, String... keys) {
        Map<String, List<String>> next = new HashMap<>(fieldKeys);
        next.put(field, List.of(keys));
        return new MergePolicy(defaultKeys, next);
    }

    public List<String> keysFor(String field) {
        return fieldKeys.getOrDefault(field, defaultKeys);
    }
}
