package com.pgbroker.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Channel level commands composed from the registry view and the message log.
 */
public class ChannelOperations {
    private static final Logger logger = LoggerFactory.getLogger(ChannelOperations.class);
    public static final String CHANNEL_CREATED = "channel_created";

    private final ChannelRegistry registry;
    private final MessageStore store;

    public ChannelOperations(ChannelRegistry registry, MessageStore store) {
        this.registry = registry;
        this.store = store;
    }

    /**
     * Creates a channel by publishing a system message to it.
     *
     * @throws BrokerException PRECONDITION when the channel view is missing
     */
    public ChannelResult create(String channelId, String type, Map<String, Object> metadata) {
        requireId(channelId);
        if (!registry.viewExists()) {
            throw BrokerException.precondition("Realtime is not enabled: the channels view does not exist");
        }
        String channelType = type == null || type.isBlank() ? Channel.STANDARD : type;
        Map<String, Object> meta = metadata == null ? Map.of() : metadata;

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("type", channelType);
        payload.put("metadata", meta);
        payload.put("system", true);
        Message message = store.publish(channelId, payload, CHANNEL_CREATED);

        Channel channel = registry.find(message.channel())
                .orElse(new Channel(message.channel(), message.channel(), Channel.STANDARD,
                        message.createdAt(), message.createdAt(), 1));
        logger.info("Created channel {}", channel.id());
        return new ChannelResult(channel, meta, 0);
    }

    /**
     * Purges every message of a channel. Existence is decided by the message log,
     * not the view; the view only contributes the reported details when present.
     * Deleting a channel with no messages succeeds with a zero count.
     */
    public ChannelResult delete(String channelId) {
        requireId(channelId);
        if (!store.exists(channelId)) {
            return new ChannelResult(null, Map.of(), 0);
        }
        Optional<Channel> details = registry.viewExists() ? registry.find(channelId) : Optional.empty();
        long deleted = store.purge(channelId);
        logger.info("Deleted channel {} ({} messages)", channelId, deleted);
        Channel channel = details.orElse(
                new Channel(channelId, channelId, Channel.STANDARD, null, null, deleted));
        return new ChannelResult(channel, Map.of(), deleted);
    }

    public Channel details(String channelId) {
        requireId(channelId);
        return registry.find(channelId)
                .orElseThrow(() -> BrokerException.notFound("Channel '" + channelId + "' not found"));
    }

    private static void requireId(String channelId) {
        if (channelId == null || channelId.isBlank()) {
            throw BrokerException.validation("channel is required");
        }
    }
}
