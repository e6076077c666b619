package com.pgbroker.core;

import java.time.Instant;
import java.util.Map;

/**
 * A row change delivered to a subscriber.
 *
 * @param data      the changed row ({@code OLD} for deletes)
 * @param truncated the row was too large for one notification; {@code data} then
 *                  holds the row without its JSON payload column, or only its id
 */
public record RealtimeEvent(
        String channel,
        SubscriptionEvent event,
        String schema,
        String table,
        Map<String, Object> data,
        boolean truncated,
        Instant receivedAt
) {
}
