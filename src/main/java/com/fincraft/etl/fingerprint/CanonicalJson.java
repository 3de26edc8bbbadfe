package com.fincraft.etl.fingerprint;

import org.json.JSONArray;
import org.json.JSONObject;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Deterministic JSON rendering: sorted keys, normalized numbers, excluded keys dropped at any depth.
 */
final class CanonicalJson {
    private CanonicalJson() {
    }

    static String render(Object value, Set<String> excludedKeys) {
        StringBuilder sb = new StringBuilder();
        write(sb, value, excludedKeys == null ? Set.of() : excludedKeys);
        return sb.toString();
    }

    private static void write(StringBuilder sb, Object value, Set<String> excluded) {
        if (value == null || value == JSONObject.NULL) {
            sb.append("null");
            return;
        }
        if (value instanceof JSONObject) {
            writeMap(sb, ((JSONObject) value).toMap(), excluded);
            return;
        }
        if (value instanceof Map<?, ?> map) {
            writeMap(sb, map, excluded);
            return;
        }
        if (value instanceof JSONArray) {
            writeList(sb, ((JSONArray) value).toList(), excluded);
            return;
        }
        if (value instanceof Collection<?> items) {
            writeList(sb, new ArrayList<>(items), excluded);
            return;
        }
        if (value instanceof Boolean) {
            sb.append(value);
            return;
        }
        if (value instanceof Number) {
            sb.append(normalizeNumber((Number) value));
            return;
        }
        sb.append(JSONObject.quote(String.valueOf(value)));
    }

    private static void writeMap(StringBuilder sb, Map<?, ?> map, Set<String> excluded) {
        TreeMap<String, Object> sorted = new TreeMap<>();
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            String key = String.valueOf(entry.getKey());
            if (!excluded.contains(key)) {
                sorted.put(key, entry.getValue());
            }
        }
        sb.append('{');
        boolean first = true;
        for (Map.Entry<String, Object> entry : sorted.entrySet()) {
            if (!first) {
                sb.append(',');
            }
            first = false;
            sb.append(JSONObject.quote(entry.getKey())).append(':');
            write(sb, entry.getValue(), excluded);
        }
        sb.append('}');
    }

    private static void writeList(StringBuilder sb, List<?> items, Set<String> excluded) {
        sb.append('[');
        for (int i = 0; i < items.size(); i++) {
            if (i > 0) {
                sb.append(',');
            }
            write(sb, items.get(i), excluded);
        }
        sb.append(']');
    }

    private static String normalizeNumber(Number number) {
        if (number instanceof Double || number instanceof Float) {
            double d = number.doubleValue();
            if (!Double.isFinite(d)) {
                return JSONObject.quote(Double.toString(d));
            }
        }
        BigDecimal decimal = number instanceof BigDecimal
                ? (BigDecimal) number
                : new BigDecimal(number.toString());
        if (decimal.signum() == 0) {
            return "0";
        }
        return decimal.stripTrailingZeros().toPlainString();
    }
}
