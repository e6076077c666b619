package com.pgbroker.core;

/**
 * How a channel is identified inside the message log: a dedicated column, a key
 * inside the JSON payload, or a single constant channel when neither exists.
 */
public interface ChannelKey {
    String DEFAULT_CHANNEL = "default";

    /**
     * SQL expression yielding the channel key of a row.
     *
     * @param qualifier row alias such as {@code NEW} or {@code OLD}, or {@code null}
     */
    String expression(String qualifier);

    default String expression() {
        return expression(null);
    }

    /** Column the key is written to on insert, or {@code null}. */
    String keyColumn();

    /** Whether publishers must embed the key in the payload. */
    boolean embedded();

    String describe();

    private static String column(String qualifier, String column) {
        return qualifier == null ? Identifiers.quote(column) : qualifier + "." + Identifiers.quote(column);
    }

    record DedicatedColumn(String column) implements ChannelKey {
        @Override
        public String expression(String qualifier) {
            return ChannelKey.column(qualifier, column);
        }

        @Override
        public String keyColumn() {
            return column;
        }

        @Override
        public boolean embedded() {
            return false;
        }

        @Override
        public String describe() {
            return "column " + column;
        }
    }

    record JsonPath(String column, String key) implements ChannelKey {
        @Override
        public String expression(String qualifier) {
            return "COALESCE(" + ChannelKey.column(qualifier, column) + "->>" + Identifiers.literal(key)
                    + ", " + Identifiers.literal(DEFAULT_CHANNEL) + ")";
        }

        @Override
        public String keyColumn() {
            return null;
        }

        @Override
        public boolean embedded() {
            return true;
        }

        @Override
        public String describe() {
            return "json path " + column + "->>'" + key + "'";
        }
    }

    record Constant(String value) implements ChannelKey {
        @Override
        public String expression(String qualifier) {
            return Identifiers.literal(value) + "::text";
        }

        @Override
        public String keyColumn() {
            return null;
        }

        @Override
        public boolean embedded() {
            return false;
        }

        @Override
        public String describe() {
            return "constant '" + value + "' (no channel column or payload column found; all messages share one channel)";
        }
    }
}
