package com.pgbroker.core;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Typed accessors over rows returned by {@link QueryExecutor#query}.
 */
public final class Rows {
    private Rows() {}

    public static String string(Map<String, Object> row, String column) {
        Object value = row.get(column);
        return value == null ? null : value.toString();
    }

    public static long longValue(Map<String, Object> row, String column) {
        Object value = row.get(column);
        if (value instanceof Number) {
            return ((Number) value).longValue();
        }
        return value == null ? 0L : Long.parseLong(value.toString());
    }

    public static boolean bool(Map<String, Object> row, String column) {
        Object value = row.get(column);
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        return value != null && Boolean.parseBoolean(value.toString());
    }

    public static Instant instant(Map<String, Object> row, String column) {
        Object value = row.get(column);
        if (value instanceof Instant) {
            return (Instant) value;
        }
        return value == null ? null : Instant.parse(value.toString());
    }

    @SuppressWarnings("unchecked")
    public static Map<String, Object> json(Map<String, Object> row, String column) {
        Object value = row.get(column);
        return value instanceof Map ? (Map<String, Object>) value : Map.of();
    }

    public static List<String> strings(Map<String, Object> row, String column) {
        Object value = row.get(column);
        if (value instanceof List) {
            return ((List<?>) value).stream().map(String::valueOf).toList();
        }
        return List.of();
    }

    public static long count(List<Map<String, Object>> rows) {
        return rows.isEmpty() ? 0L : longValue(rows.get(0), "count");
    }
}
