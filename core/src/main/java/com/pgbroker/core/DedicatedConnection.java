package com.pgbroker.core;

import java.util.function.Consumer;

/**
 * A long-lived connection held outside the pool for {@code LISTEN}. Notifications
 * are pushed to the registered handler from a single consumer thread.
 */
public interface DedicatedConnection {

    void listen(String channel);

    void unlisten(String channel);

    void onNotification(Consumer<Notification> handler);

    boolean isOpen();

    void release();
}
