package com.pgbroker.core;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Routes decoded notifications to the subscriptions of their channel.
 * <p>
 * The payload is decoded once per notification. A subscription receives it when its
 * event equals the payload's {@code event} and every filter entry matches. A filter
 * key is looked up on the row first and then inside the row's JSON payload column.
 */
public class NotificationDispatcher {
    private static final Logger logger = LoggerFactory.getLogger(NotificationDispatcher.class);
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final SubscriptionRegistry registry;
    private final ObjectMapper mapper;
    private final List<String> payloadColumns;
    private final Clock clock;

    public NotificationDispatcher(SubscriptionRegistry registry, ObjectMapper mapper) {
        this(registry, mapper, List.of(SchemaShape.MESSAGE_COLUMN, SchemaShape.PAYLOAD_COLUMN), Clock.systemUTC());
    }

    public NotificationDispatcher(SubscriptionRegistry registry, ObjectMapper mapper, List<String> payloadColumns, Clock clock) {
        this.registry = registry;
        this.mapper = mapper;
        this.payloadColumns = payloadColumns;
        this.clock = clock;
    }

    /**
     * @return how many listeners the notification was delivered to
     */
    public int dispatch(Notification notification) {
        List<Subscription> subscriptions = registry.forChannel(notification.channel());
        if (subscriptions.isEmpty()) {
            logger.debug("No subscriptions for channel {}, dropping notification", notification.channel());
            return 0;
        }

        Map<String, Object> decoded;
        try {
            decoded = mapper.readValue(notification.payload(), MAP_TYPE);
        } catch (JsonProcessingException e) {
            logger.warn("Dropping malformed notification on channel {}: {}", notification.channel(), e.getOriginalMessage());
            return 0;
        }

        String event = Objects.toString(decoded.get("event"), null);
        Map<String, Object> row = asMap(decoded.get("data"));
        boolean truncated = Boolean.TRUE.equals(decoded.get("truncated"));
        RealtimeEvent realtimeEvent = null;
        int delivered = 0;

        for (Subscription subscription : subscriptions) {
            if (!subscription.event().name().equals(event) || !matches(subscription.filter(), row, truncated)) {
                continue;
            }
            if (realtimeEvent == null) {
                realtimeEvent = new RealtimeEvent(
                        notification.channel(),
                        subscription.event(),
                        Objects.toString(decoded.get("schema"), null),
                        Objects.toString(decoded.get("table"), null),
                        row,
                        truncated,
                        clock.instant());
            }
            try {
                subscription.listener().onEvent(realtimeEvent);
                delivered++;
            } catch (RuntimeException e) {
                logger.error("Listener for subscription {} failed", subscription.id(), e);
            }
        }
        return delivered;
    }

    /**
     * A truncated row lost its payload column, so filter keys it no longer carries
     * are not held against it.
     */
    boolean matches(Map<String, Object> filter, Map<String, Object> row, boolean truncated) {
        for (Map.Entry<String, Object> entry : filter.entrySet()) {
            if (truncated && !resolvable(row, entry.getKey())) {
                continue;
            }
            if (!valuesEqual(entry.getValue(), resolve(row, entry.getKey()))) {
                return false;
            }
        }
        return true;
    }

    private Object resolve(Map<String, Object> row, String key) {
        if (row.containsKey(key)) {
            return row.get(key);
        }
        for (String column : payloadColumns) {
            Map<String, Object> nested = asMap(row.get(column));
            if (nested.containsKey(key)) {
                return nested.get(key);
            }
        }
        return null;
    }

    private boolean resolvable(Map<String, Object> row, String key) {
        if (row.containsKey(key)) {
            return true;
        }
        for (String column : payloadColumns) {
            if (asMap(row.get(column)).containsKey(key)) {
                return true;
            }
        }
        return false;
    }

    private static boolean valuesEqual(Object expected, Object actual) {
        if (expected instanceof Number && actual instanceof Number) {
            return new BigDecimal(expected.toString()).compareTo(new BigDecimal(actual.toString())) == 0;
        }
        return Objects.equals(expected, actual);
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asMap(Object value) {
        return value instanceof Map ? (Map<String, Object>) value : Map.of();
    }
}
