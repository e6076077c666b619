package com.pgbroker.core;

/**
 * Feature toggles for enabling the broker. {@code broadcast} and {@code presence}
 * are recorded for reporting; {@code rowLevelSecurity} also decides whether row
 * level security and the default policies are applied.
 */
public record BrokerOptions(boolean broadcast, boolean presence, boolean rowLevelSecurity) {

    public static BrokerOptions defaults() {
        return new BrokerOptions(true, true, true);
    }
}
