package org.smileyface.harvester.store;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Immutable set / unset / increment modification applied by {@link DocumentStore#findAndUpdate}
 * and {@link DocumentStore#updateMany}.
 */
public final class StoreUpdate {

    private final Map<String, Object> sets;
    private final Set<String> unsets;
    private final Map<String, Long> increments;

    private StoreUpdate(Map<String, Object> sets, Set<String> unsets, Map<String, Long> increments) {
        this.sets = Collections.unmodifiableMap(sets);
        this.unsets = Collections.unmodifiableSet(unsets);
        this.increments = Collections.unmodifiableMap(increments);
    }

    public static StoreUpdate create() {
        return new StoreUpdate(new LinkedHashMap<>(), new LinkedHashSet<>(), new LinkedHashMap<>());
    }

    public StoreUpdate set(String field, Object value) {
        if (value == null) {
            return unset(field);
        }
        Map<String, Object> next = new LinkedHashMap<>(sets);
        next.put(field, value);
        return new StoreUpdate(next, unsets, increments);
    }

    public StoreUpdate setAll(Map<String, ?> values) {
        StoreUpdate out = this;
        for (Map.Entry<String, ?> e : values.entrySet()) {
            out = out.set(e.getKey(), e.getValue());
        }
        return out;
    }

    public StoreUpdate unset(String field) {
        Set<String> next = new LinkedHashSet<>(unsets);
        next.add(field);
        return new StoreUpdate(sets, next, increments);
    }

    public StoreUpdate inc(String field, long by) {
        Map<String, Long> next = new LinkedHashMap<>(increments);
        next.merge(field, by, Long::sum);
        return new StoreUpdate(sets, unsets, next);
    }

    public Map<String, Object> getSets() {
        return sets;
    }

    public Set<String> getUnsets() {
        return unsets;
    }

    public Map<String, Long> getIncrements() {
        return increments;
    }

    /**
     * Applies this update in place.
     */
    void applyTo(Map<String, Object> document) {
        sets.forEach((k, v) -> document.put(k, Documents.deepCopy(v)));
        unsets.forEach(document::remove);
        increments.forEach((k, by) -> {
            Object current = document.get(k);
            long base = current instanceof Number n ? n.longValue() : 0L;
            document.put(k, base + by);
        });
    }

    @Override
    public String toString() {
        return "StoreUpdate{set=" + sets + ", unset=" + unsets + ", inc=" + increments + '}';
    }
}
