package com.pgbroker.core;

@FunctionalInterface
public interface RealtimeListener {
    void onEvent(RealtimeEvent event);
}
