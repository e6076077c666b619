package com.pgbroker.api.tools;

import com.pgbroker.core.BrokerException;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Typed reads over the flat parameter map a tool receives. Wrong types are
 * reported as validation errors naming the parameter.
 */
public class Params {
    private final Map<String, Object> values;

    public Params(Map<String, Object> values) {
        this.values = values == null ? Map.of() : values;
    }

    public boolean has(String key) {
        return values.get(key) != null;
    }

    public String string(String key) {
        Object value = values.get(key);
        return value == null ? null : value.toString();
    }

    public String string(String key, String defaultValue) {
        String value = string(key);
        return value == null ? defaultValue : value;
    }

    public String required(String key) {
        String value = string(key);
        if (value == null || value.isBlank()) {
            throw BrokerException.validation(key + " is required");
        }
        return value;
    }

    public int integer(String key, int defaultValue) {
        Object value = values.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        try {
            return Integer.parseInt(value.toString().trim());
        } catch (NumberFormatException e) {
            throw BrokerException.validation(key + " must be an integer");
        }
    }

    public boolean bool(String key, boolean defaultValue) {
        Boolean value = optionalBool(key);
        return value == null ? defaultValue : value;
    }

    public Boolean optionalBool(String key) {
        Object value = values.get(key);
        if (value == null) {
            return null;
        }
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        String text = value.toString().trim();
        if ("true".equalsIgnoreCase(text) || "false".equalsIgnoreCase(text)) {
            return Boolean.parseBoolean(text);
        }
        throw BrokerException.validation(key + " must be a boolean");
    }

    public Instant instant(String key) {
        String value = string(key);
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Instant.parse(value.trim());
        } catch (DateTimeParseException e) {
            throw BrokerException.validation(key + " must be an ISO-8601 instant, e.g. 2024-01-31T12:00:00Z");
        }
    }

    @SuppressWarnings("unchecked")
    public Map<String, Object> map(String key) {
        Object value = values.get(key);
        if (value == null) {
            return null;
        }
        if (value instanceof Map) {
            return (Map<String, Object>) value;
        }
        throw BrokerException.validation(key + " must be a JSON object");
    }

    /**
     * Accepts a JSON array or a comma separated string.
     */
    public List<String> strings(String key) {
        Object value = values.get(key);
        if (value == null) {
            return null;
        }
        if (value instanceof List) {
            return ((List<?>) value).stream().map(String::valueOf).map(String::trim).toList();
        }
        return Arrays.stream(value.toString().split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
    }
}
