package org.smileyface.harvester.store;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable conjunction of conditions on top-level document fields.
 *
 * <p>Matching follows document-database conventions: {@code eq(field, null)} matches a missing field,
 * {@code ne} and {@code nin} match documents where the field is absent, range operators never match
 * an absent field and only compare values of the same kind (numbers with numbers, strings with strings).</p>
 *
 * <pre>
 *   StoreFilter.all().eq("resourceKey", key).lt("expiresAt", now)
 * </pre>
 */
public final class StoreFilter {

    public enum Op { EQ, NE, IN, NIN, LT, LTE, GT, GTE, EXISTS }

    public record Condition(String field, Op op, Object value) {
        public Condition {
            Objects.requireNonNull(field, "field");
            Objects.requireNonNull(op, "op");
        }
    }

    private static final StoreFilter ALL = new StoreFilter(List.of());

    private final List<Condition> conditions;

    private StoreFilter(List<Condition> conditions) {
        this.conditions = Collections.unmodifiableList(conditions);
    }

    public static StoreFilter all() {
        return ALL;
    }

    public static StoreFilter byField(String field, Object value) {
        return ALL.eq(field, value);
    }

    public StoreFilter eq(String field, Object value) {
        return with(new Condition(field, Op.EQ, value));
    }

    public StoreFilter ne(String field, Object value) {
        return with(new Condition(field, Op.NE, value));
    }

    public StoreFilter in(String field, Collection<?> values) {
        return with(new Condition(field, Op.IN, List.copyOf(values)));
    }

    public StoreFilter nin(String field, Collection<?> values) {
        return with(new Condition(field, Op.NIN, List.copyOf(values)));
    }

    public StoreFilter lt(String field, Object value) {
        return with(new Condition(field, Op.LT, Objects.requireNonNull(value)));
    }

    public StoreFilter lte(String field, Object value) {
        return with(new Condition(field, Op.LTE, Objects.requireNonNull(value)));
    }

    public StoreFilter gt(String field, Object value) {
        return with(new Condition(field, Op.GT, Objects.requireNonNull(value)));
    }

    public StoreFilter gte(String field, Object value) {
        return with(new Condition(field, Op.GTE, Objects.requireNonNull(value)));
    }

    public StoreFilter exists(String field, boolean exists) {
        return with(new Condition(field, Op.EXISTS, exists));
    }

    public List<Condition> getConditions() {
        return conditions;
    }

    /**
     * Equality conditions with non-null values; these seed a document created by an upsert.
     */
    public Map<String, Object> equalityValues() {
        Map<String, Object> out = new LinkedHashMap<>();
        for (Condition c : conditions) {
            if (c.op() == Op.EQ && c.value() != null) {
                out.put(c.field(), c.value());
            }
        }
        return out;
    }

    public boolean matches(Map<String, Object> document) {
        for (Condition c : conditions) {
            if (!matches(c, document)) return false;
        }
        return true;
    }

    private static boolean matches(Condition c, Map<String, Object> doc) {
        boolean present = doc.containsKey(c.field());
        Object actual = doc.get(c.field());
        return switch (c.op()) {
            case EQ -> valueEquals(actual, c.value());
            case NE -> !valueEquals(actual, c.value());
            case IN -> containsValue((List<?>) c.value(), actual);
            case NIN -> !containsValue((List<?>) c.value(), actual);
            case EXISTS -> present == (Boolean) c.value();
            case LT -> compare(actual, c.value()) < 0;
            case LTE -> compare(actual, c.value()) <= 0 && comparable(actual, c.value());
            case GT -> compare(actual, c.value()) > 0 && comparable(actual, c.value());
            case GTE -> compare(actual, c.value()) >= 0 && comparable(actual, c.value());
        };
    }

    private static boolean containsValue(List<?> values, Object actual) {
        for (Object v : values) {
            if (valueEquals(actual, v)) return true;
        }
        return false;
    }

    static boolean valueEquals(Object a, Object b) {
        if (a == null || b == null) return a == null && b == null;
        if (a instanceof Number na && b instanceof Number nb) {
            return compareNumbers(na, nb) == 0;
        }
        if (a instanceof Enum<?> ea) a = ea.name();
        if (b instanceof Enum<?> eb) b = eb.name();
        return a.equals(b);
    }

    private static boolean comparable(Object a, Object b) {
        return (a instanceof Number && b instanceof Number) || (a instanceof String && b instanceof String);
    }

    /**
     * Orders two values; values of different kinds (or a missing value) compare as "greater" so that
     * range conditions do not match them.
     */
    private static int compare(Object a, Object b) {
        if (a instanceof Number na && b instanceof Number nb) return compareNumbers(na, nb);
        if (a instanceof String sa && b instanceof String sb) return sa.compareTo(sb);
        return Integer.MAX_VALUE;
    }

    static int compareNumbers(Number a, Number b) {
        if (isIntegral(a) && isIntegral(b)) {
            return Long.compare(a.longValue(), b.longValue());
        }
        return Double.compare(a.doubleValue(), b.doubleValue());
    }

    private static boolean isIntegral(Number n) {
        return n instanceof Long || n instanceof Integer || n instanceof Short || n instanceof Byte;
    }

    private StoreFilter with(Condition c) {
        List<Condition> next = new ArrayList<>(conditions.size() + 1);
        next.addAll(conditions);
        next.add(c);
        return new StoreFilter(next);
    }

    @Override
    public String toString() {
        return "StoreFilter" + conditions;
    }
}
