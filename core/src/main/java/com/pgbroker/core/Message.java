package com.pgbroker.core;

import java.time.Instant;
import java.util.Map;

/**
 * A persisted message. {@code payload} is the decoded JSON body and may carry an
 * {@code event} tag under {@link #EVENT_KEY}.
 */
public record Message(
        String id,
        String channel,
        Map<String, Object> payload,
        Instant createdAt
) {
    public static final String EVENT_KEY = "event";
    public static final String CHANNEL_KEY = "channel";

    public String event() {
        Object event = payload != null ? payload.get(EVENT_KEY) : null;
        return event != null ? event.toString() : null;
    }
}
