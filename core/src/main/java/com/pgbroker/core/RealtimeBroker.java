package com.pgbroker.core;

/**
 * The wired set of broker services. Closing it tears down live subscriptions.
 */
public record RealtimeBroker(
        BrokerLifecycle lifecycle,
        MessageStore messages,
        ChannelRegistry channels,
        ChannelOperations channelOperations,
        NotificationBridge notifications,
        PolicyEngine policies
) implements AutoCloseable {

    @Override
    public void close() {
        notifications.close();
    }
}
