package com.pgbroker.core;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * An in-process subscription to row changes on one channel. Lives only as long as
 * the process that registered it.
 *
 * @param table the table carrying the trigger
 */
public record Subscription(
        String id,
        String channel,
        SubscriptionEvent event,
        Map<String, Object> filter,
        String table,
        String triggerName,
        String functionName,
        Instant createdAt,
        RealtimeListener listener
) {
    public Subscription {
        filter = filter == null ? Map.of() : Map.copyOf(filter);
    }

    public boolean hasFilter() {
        return !filter.isEmpty();
    }

    /** The externally visible fields, without the listener. */
    public Map<String, Object> describe() {
        Map<String, Object> info = new LinkedHashMap<>();
        info.put("id", id);
        info.put("channel", channel);
        info.put("event", event.name());
        info.put("filter", filter);
        info.put("table", table);
        info.put("createdAt", createdAt.toString());
        return info;
    }
}
