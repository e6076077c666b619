package com.pgbroker.core;

/**
 * Snapshot of the broker's provisioned objects, recomputed on every request.
 * {@code features} is only present right after an enable.
 */
public record BrokerStatus(
        boolean schemaExists,
        boolean messagesTableExists,
        boolean rlsEnabled,
        boolean extensionExists,
        BrokerOptions features,
        String channelKey,
        boolean degraded
) {
    public boolean enabled() {
        return schemaExists && messagesTableExists;
    }

    public static BrokerStatus disabled() {
        return new BrokerStatus(false, false, false, false, null, null, false);
    }

    public BrokerStatus withFeatures(BrokerOptions options) {
        return new BrokerStatus(schemaExists, messagesTableExists, rlsEnabled, extensionExists, options, channelKey, degraded);
    }
}
