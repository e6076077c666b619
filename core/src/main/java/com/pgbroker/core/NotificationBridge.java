package com.pgbroker.core;

import java.util.List;
import java.util.Map;

/**
 * Turns row changes into in-process callbacks using triggers and
 * {@code LISTEN/NOTIFY}.
 */
public interface NotificationBridge extends AutoCloseable {

    /**
     * @param table the table to watch; {@code null} watches the message log for rows
     *              on {@code channel}
     */
    Subscription subscribe(String channel, SubscriptionEvent event, Map<String, Object> filter,
                           RealtimeListener listener, String table);

    /**
     * Drops every subscription on {@code channel} together with its triggers.
     *
     * @return how many subscriptions were removed
     * @throws BrokerException NOT_FOUND when the channel has no subscription
     */
    int unsubscribe(String channel);

    List<Subscription> list();

    @Override
    void close();
}
