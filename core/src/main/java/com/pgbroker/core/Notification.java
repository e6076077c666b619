package com.pgbroker.core;

/**
 * An asynchronous notification delivered on a listened channel.
 */
public record Notification(String channel, String payload, int pid) {
}
