package com.pgbroker.api.tools;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.pgbroker.core.ErrorKind;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * What a tool hands back to the transport: a success flag and a JSON object body.
 * Failures carry {@code error} and {@code kind}.
 */
public record ToolResult(boolean success, Map<String, Object> body) {
    private static final ObjectMapper objectMapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    public static ToolResult ok(Map<String, Object> body) {
        return new ToolResult(true, body);
    }

    public static ToolResult error(ErrorKind kind, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", message);
        body.put("kind", kind.label());
        return new ToolResult(false, body);
    }

    public String toJson() {
        try {
            return objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Tool result is not serialisable", e);
        }
    }
}
