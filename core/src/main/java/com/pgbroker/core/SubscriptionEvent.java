package com.pgbroker.core;

import java.util.Locale;

public enum SubscriptionEvent {
    INSERT,
    UPDATE,
    DELETE;

    public static SubscriptionEvent parse(String value) {
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException | NullPointerException e) {
            throw BrokerException.validation("event must be one of INSERT, UPDATE, DELETE; got '" + value + "'");
        }
    }

    public String slug() {
        return name().toLowerCase(Locale.ROOT);
    }
}
