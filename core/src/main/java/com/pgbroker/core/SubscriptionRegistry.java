package com.pgbroker.core;

import java.util.List;
import java.util.Set;

/**
 * Process-local store of active subscriptions, grouped by channel.
 */
public interface SubscriptionRegistry {

    void add(Subscription subscription);

    List<Subscription> forChannel(String channel);

    /** Removes and returns every subscription on {@code channel}. */
    List<Subscription> removeChannel(String channel);

    List<Subscription> all();

    Set<String> channels();

    default boolean hasChannel(String channel) {
        return !forChannel(channel).isEmpty();
    }
}
