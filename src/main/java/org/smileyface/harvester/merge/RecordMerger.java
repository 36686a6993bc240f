package org.smileyface.harvester.merge;

import org.smileyface.harvester.store.Documents;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Reconciles a freshly scraped payload with the stored one without ever regressing data.
 *
 * <ul>
 *   <li>An empty incoming value (null, blank string, empty list or map) never replaces anything.</li>
 *   <li>Scalars, strings and lists of scalars: a non-empty incoming value wins.</li>
 *   <li>Lists of objects: elements are matched by correlation key and merged field by field; unmatched
 *       incoming elements are appended; nothing is removed.</li>
 *   <li>Nested objects are merged field by field with the same rules.</li>
 * </ul>
 *
 * Merging the same incoming payload twice yields no further updates.
 */
public class RecordMerger {

    /**
     * @return the fields whose stored value must change, or empty when the stored record already covers
     *         everything the incoming payload carries
     */
    public Optional<Map<String, Object>> merge(Map<String, Object> existing, Map<String, Object> incoming,
                                               MergePolicy policy) {
        Map<String, Object> current = existing == null ? Map.of() : existing;
        MergePolicy p = policy == null ? MergePolicy.defaults() : policy;
        Map<String, Object> updates = new LinkedHashMap<>();
        if (incoming == null) {
            return Optional.empty();
        }
        incoming.forEach((field, value) -> {
            if (isEmpty(value)) return;
            Object old = current.get(field);
            Object merged = mergeValue(field, old, value, p);
            if (!equivalent(old, merged)) {
                updates.put(field, merged);
            }
        });
        return updates.isEmpty() ? Optional.empty() : Optional.of(updates);
    }

    public Optional<Map<String, Object>> merge(Map<String, Object> existing, Map<String, Object> incoming) {
        return merge(existing, incoming, MergePolicy.defaults());
    }

    /**
     * Copy of {@code existing} with {@code updates} applied.
     */
    public static Map<String, Object> apply(Map<String, Object> existing, Map<String, Object> updates) {
        Map<String, Object> out = existing == null ? new LinkedHashMap<>() : Documents.deepCopy(existing);
        out.putAll(Documents.deepCopy(updates));
        return out;
    }

    private Object mergeValue(String field, Object old, Object value, MergePolicy policy) {
        if (value instanceof Map<?, ?> incomingMap && old instanceof Map<?, ?> oldMap) {
            return mergeObjects(asMap(oldMap), asMap(incomingMap), policy);
        }
        if (value instanceof Collection<?> incomingList && containsObjects(incomingList)) {
            List<Object> base = old instanceof Collection<?> oldList ? new ArrayList<>(oldList) : new ArrayList<>();
            return mergeObjectList(field, base, incomingList, policy);
        }
        return Documents.deepCopy(value);
    }

    private Map<String, Object> mergeObjects(Map<String, Object> old, Map<String, Object> incoming, MergePolicy policy) {
        Map<String, Object> out = Documents.deepCopy(old);
        incoming.forEach((k, v) -> {
            if (isEmpty(v)) return;
            out.put(k, mergeValue(k, old.get(k), v, policy));
        });
        return out;
    }

    private List<Object> mergeObjectList(String field, List<Object> base, Collection<?> incoming, MergePolicy policy) {
        List<Object> out = Documents.deepCopy(base);
        List<String> keys = policy.keysFor(field);
        for (Object element : incoming) {
            if (isEmpty(element)) continue;
            if (!(element instanceof Map<?, ?> rawMap)) {
                if (out.stream().noneMatch(e -> equivalent(e, element))) out.add(Documents.deepCopy(element));
                continue;
            }
            Map<String, Object> map = asMap(rawMap);
            int match = indexOfMatch(out, map, keys);
            if (match >= 0) {
                out.set(match, mergeObjects(asMap((Map<?, ?>) out.get(match)), map, policy));
            } else {
                out.add(Documents.deepCopy(map));
            }
        }
        return out;
    }

    private static int indexOfMatch(List<Object> elements, Map<String, Object> candidate, List<String> keys) {
        String keyField = keyFieldOf(candidate, keys);
        for (int i = 0; i < elements.size(); i++) {
            if (!(elements.get(i) instanceof Map<?, ?> other)) continue;
            if (keyField != null) {
                if (equivalent(normalizeKey(other.get(keyField)), normalizeKey(candidate.get(keyField)))) return i;
            } else if (keyFieldOf(asMap(other), keys) == null && equivalent(other, candidate)) {
                return i;
            }
        }
        return -1;
    }

    private static String keyFieldOf(Map<String, Object> element, List<String> keys) {
        for (String k : keys) {
            if (!isEmpty(element.get(k))) return k;
        }
        return null;
    }

    private static Object normalizeKey(Object v) {
        return v instanceof String s ? s.trim().toLowerCase() : v;
    }

    static boolean isEmpty(Object value) {
        if (value == null) return true;
        if (value instanceof String s) return s.isBlank();
        if (value instanceof Collection<?> c) return c.isEmpty();
        if (value instanceof Map<?, ?> m) return m.isEmpty();
        return false;
    }

    private static boolean containsObjects(Collection<?> list) {
        for (Object o : list) {
            if (o instanceof Map) return true;
        }
        return false;
    }

    /**
     * Structural equality with numbers compared by value, so a stored {@code 3L} equals an incoming {@code 3}.
     */
    static boolean equivalent(Object a, Object b) {
        if (a instanceof Number na && b instanceof Number nb) {
            return na.doubleValue() == nb.doubleValue();
        }
        if (a instanceof Map<?, ?> ma && b instanceof Map<?, ?> mb) {
            if (!ma.keySet().equals(mb.keySet())) return false;
            for (Map.Entry<?, ?> e : ma.entrySet()) {
                if (!equivalent(e.getValue(), mb.get(e.getKey()))) return false;
            }
            return true;
        }
        if (a instanceof Collection<?> ca && b instanceof Collection<?> cb) {
            if (ca.size() != cb.size()) return false;
            Iterator<?> ia = ca.iterator();
            Iterator<?> ib = cb.iterator();
            while (ia.hasNext()) {
                if (!equivalent(ia.next(), ib.next())) return false;
            }
            return true;
        }
        return Objects.equals(a, b);
    }

    private static Map<String, Object> asMap(Map<?, ?> map) {
        Map<String, Object> out = new LinkedHashMap<>();
        map.forEach((k, v) -> out.put(String.valueOf(k), v));
        return out;
    }
}
