package com.pgbroker.core;

import java.time.Instant;

/**
 * A row of the channel registry view. Channels are never stored; this is the
 * aggregate of all messages sharing one channel key.
 */
public record Channel(
        String id,
        String name,
        String type,
        Instant createdAt,
        Instant updatedAt,
        long broadcastCount
) {
    public static final String STANDARD = "standard";
}
