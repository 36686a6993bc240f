package org.smileyface.harvester.store;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Sort order for store queries. Ties are broken by insertion order in every implementation.
 */
public final class StoreSort {

    public record Key(String field, boolean ascending) {}

    private static final StoreSort NONE = new StoreSort(List.of());

    private final List<Key> keys;

    private StoreSort(List<Key> keys) {
        this.keys = List.copyOf(keys);
    }

    public static StoreSort none() {
        return NONE;
    }

    public static StoreSort asc(String field) {
        return NONE.thenAsc(field);
    }

    public static StoreSort desc(String field) {
        return NONE.thenDesc(field);
    }

    public StoreSort thenAsc(String field) {
        return then(new Key(field, true));
    }

    public StoreSort thenDesc(String field) {
        return then(new Key(field, false));
    }

    public List<Key> getKeys() {
        return keys;
    }

    public boolean isEmpty() {
        return keys.isEmpty();
    }

    /**
     * Comparator over documents; missing and null values sort lowest.
     */
    Comparator<Map<String, Object>> comparator() {
        Comparator<Map<String, Object>> cmp = (a, b) -> 0;
        for (Key key : keys) {
            Comparator<Map<String, Object>> single = (a, b) -> compareValues(a.get(key.field()), b.get(key.field()));
            cmp = cmp.thenComparing(key.ascending() ? single : single.reversed());
        }
        return cmp;
    }

    private static int compareValues(Object a, Object b) {
        if (a == null || b == null) {
            return a == null ? (b == null ? 0 : -1) : 1;
        }
        if (a instanceof Number na && b instanceof Number nb) {
            return StoreFilter.compareNumbers(na, nb);
        }
        if (a instanceof Enum<?> ea) a = ea.name();
        if (b instanceof Enum<?> eb) b = eb.name();
        if (a instanceof String sa && b instanceof String sb) {
            return sa.compareTo(sb);
        }
        if (a instanceof Boolean ba && b instanceof Boolean bb) {
            return Boolean.compare(ba, bb);
        }
        return a.getClass().getName().compareTo(b.getClass().getName());
    }

    private StoreSort then(Key key) {
        List<Key> next = new ArrayList<>(keys);
        next.add(key);
        return new StoreSort(next);
    }

    @Override
    public String toString() {
        return "StoreSort" + keys;
    }
}
