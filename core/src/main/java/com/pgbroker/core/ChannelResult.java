package com.pgbroker.core;

import java.util.Map;

/**
 * Result of a channel create or delete. {@code channel} is {@code null} when a
 * delete found nothing to remove.
 */
public record ChannelResult(Channel channel, Map<String, Object> metadata, long deletedCount) {

    public ChannelResult {
        metadata = metadata == null ? Map.of() : metadata;
    }

    public boolean found() {
        return channel != null;
    }
}
