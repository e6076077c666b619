package com.pgbroker.api.tools;

import com.pgbroker.core.Channel;
import com.pgbroker.core.ChannelRegistry;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class ListChannelsTool extends BrokerTool {
    private final ChannelRegistry channels;

    public ListChannelsTool(ChannelRegistry channels) {
        super("list-realtime-channels", "List realtime channels, optionally filtered by name");
        this.channels = channels;
    }

    @Override
    protected ToolResult handle(Params params) {
        int limit = params.integer("limit", ChannelRegistry.DEFAULT_LIMIT);
        int offset = params.integer("offset", 0);
        boolean includeDetails = params.bool("includeDetails", true);
        List<Channel> found = channels.list(params.string("channelName"), limit, offset);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("channels", found.stream()
                .map(c -> includeDetails ? Views.channel(c) : Map.<String, Object>of("id", c.id(), "name", c.name()))
                .toList());
        body.put("count", found.size());
        body.put("limit", limit);
        body.put("offset", offset);
        return ToolResult.ok(body);
    }
}
