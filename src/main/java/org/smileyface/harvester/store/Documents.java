package org.smileyface.harvester.store;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Conversions between model objects and store documents.
 */
public final class Documents {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .setSerializationInclusion(JsonInclude.Include.NON_NULL)
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private Documents() {
        // No instantiation
    }

    public static Map<String, Object> toDocument(Object value) {
        return MAPPER.convertValue(value, MAP_TYPE);
    }

    public static <T> T fromDocument(Map<String, Object> document, Class<T> type) {
        return MAPPER.convertValue(document, type);
    }

    /**
     * Copies nested maps and collections so callers never share mutable state with a store.
     */
    public static Map<String, Object> deepCopy(Map<?, ?> map) {
        if (map == null) return null;
        Map<String, Object> copy = new LinkedHashMap<>();
        map.forEach((k, v) -> copy.put(String.valueOf(k), deepCopy(v)));
        return copy;
    }

    public static List<Object> deepCopy(Collection<?> col) {
        if (col == null) return null;
        List<Object> copy = new ArrayList<>(col.size());
        for (Object o : col) copy.add(deepCopy(o));
        return copy;
    }

    /**
     * Copy of a document value; enums are stored by name.
     */
    public static Object deepCopy(Object value) {
        if (value instanceof Map<?, ?> map) return deepCopy(map);
        if (value instanceof Collection<?> col) return deepCopy(col);
        if (value instanceof Enum<?> e) return e.name();
        return value;
    }
}
