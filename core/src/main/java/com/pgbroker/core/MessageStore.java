package com.pgbroker.core;

import java.util.Map;

/**
 * Append-only message log. Channel existence policy belongs to callers; the
 * store never reports a missing channel as an error.
 */
public interface MessageStore {
    Message publish(String channel, Map<String, Object> payload, String event);
    MessagePage list(String channel, MessageQuery query);
    long purge(String channel);
    boolean exists(String channel);
}
