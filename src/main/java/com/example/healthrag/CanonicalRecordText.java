package com.example.healthrag;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.util.Collection;
import java.util.Map;
import java.util.TreeMap;

/**
 * Serializes a record's field map into one canonical line of text:
 * {@code "<category>: source: <source> <key>: <value> ..."} with keys in natural order and
 * nested maps/lists encoded as key-sorted JSON. Two maps with the same entries always produce
 * the same text, whatever their iteration order.
 */
public final class CanonicalRecordText {

    private static final ObjectMapper mapper = new ObjectMapper()
            .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);

    private CanonicalRecordText() {}

    public static String render(String category, Map<String, ?> fields, String source) {
        StringBuilder sb = new StringBuilder();
        sb.append(category == null ? "unknown" : category).append(':');
        if (source != null && !source.isBlank()) {
            sb.append(" source: ").append(source);
        }
        if (fields != null) {
            for (Map.Entry<String, ?> e : new TreeMap<String, Object>(fields).entrySet()) {
                sb.append(' ').append(e.getKey()).append(": ").append(valueText(e.getValue()));
            }
        }
        return sb.toString();
    }

    static String valueText(Object value) {
        if (value == null) return "null";
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            // 8000.0 and 8000 must render alike
            if (d == Math.rint(d) && !Double.isInfinite(d) && Math.abs(d) < 1e15) return Long.toString((long) d);
            return String.valueOf(d);
        }
        if (value instanceof Map || value instanceof Collection || value.getClass().isArray()) {
            try {
                return mapper.writeValueAsString(value);
            } catch (JsonProcessingException e) {
                throw new IllegalArgumentException("field value is not serializable: " + value.getClass().getName(), e);
            }
        }
        return String.valueOf(value);
    }
}
