package com.pgbroker.core;

import java.util.Collection;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * The resolved layout of the message log: where the channel key lives, which
 * column holds the JSON payload and whether a timestamp column exists.
 * <p>
 * Resolution order is fixed: {@code channel_id}, then {@code channel}, then
 * {@code <payload>->>'channel'}, then the constant {@code 'default'}.
 */
public record SchemaShape(
        ChannelKey channelKey,
        String payloadColumn,
        boolean hasTimestamp
) {
    public static final String PRIMARY_KEY_COLUMN = "channel_id";
    public static final String ALTERNATE_KEY_COLUMN = "channel";
    public static final String TIMESTAMP_COLUMN = "created_at";
    public static final String ID_COLUMN = "id";
    public static final String MESSAGE_COLUMN = "message";
    public static final String PAYLOAD_COLUMN = "payload";

    private static final String[] KEY_COLUMNS = {PRIMARY_KEY_COLUMN, ALTERNATE_KEY_COLUMN};
    private static final String[] PAYLOAD_COLUMNS = {MESSAGE_COLUMN, PAYLOAD_COLUMN};

    public static SchemaShape fromColumns(Collection<String> columns) {
        Set<String> names = columns.stream()
                .map(c -> c.toLowerCase(Locale.ROOT))
                .collect(Collectors.toSet());

        String payload = null;
        for (String candidate : PAYLOAD_COLUMNS) {
            if (names.contains(candidate)) {
                payload = candidate;
                break;
            }
        }
        boolean timestamp = names.contains(TIMESTAMP_COLUMN);

        for (String candidate : KEY_COLUMNS) {
            if (names.contains(candidate)) {
                return new SchemaShape(new ChannelKey.DedicatedColumn(candidate), payload, timestamp);
            }
        }
        if (payload != null) {
            return new SchemaShape(new ChannelKey.JsonPath(payload, Message.CHANNEL_KEY), payload, timestamp);
        }
        return new SchemaShape(new ChannelKey.Constant(ChannelKey.DEFAULT_CHANNEL), null, timestamp);
    }

    public boolean hasPayload() {
        return payloadColumn != null;
    }

    /** True when every message falls into the single implicit channel. */
    public boolean degraded() {
        return channelKey instanceof ChannelKey.Constant;
    }

    public String payloadExpression() {
        return hasPayload() ? Identifiers.quote(payloadColumn) : "NULL::jsonb";
    }

    public String timestampExpression() {
        return hasTimestamp ? Identifiers.quote(TIMESTAMP_COLUMN) : "now()";
    }

    public String describe() {
        StringBuilder sb = new StringBuilder("channel key: ").append(channelKey.describe());
        sb.append("; payload: ").append(hasPayload() ? payloadColumn : "none");
        sb.append("; timestamp: ").append(hasTimestamp ? TIMESTAMP_COLUMN : "query time");
        return sb.toString();
    }
}
