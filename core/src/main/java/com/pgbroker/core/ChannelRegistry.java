package com.pgbroker.core;

import java.util.List;
import java.util.Optional;

/**
 * The channel view derived from the message log.
 */
public interface ChannelRegistry {
    int DEFAULT_LIMIT = 50;

    /** Regenerates the view from the message log's current layout. */
    void createOrUpdateView();

    /** Replaces the view with a caller supplied {@code SELECT}. */
    void createOrUpdateView(String definition);

    boolean viewExists();

    /** @return whether a view was dropped */
    boolean dropView();

    Optional<Channel> find(String channelId);

    List<Channel> list(String nameFilter, int limit, int offset);
}
