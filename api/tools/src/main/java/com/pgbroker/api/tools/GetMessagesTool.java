package com.pgbroker.api.tools;

import com.pgbroker.core.BrokerException;
import com.pgbroker.core.ChannelRegistry;
import com.pgbroker.core.MessagePage;
import com.pgbroker.core.MessageQuery;
import com.pgbroker.core.MessageStore;

import java.util.LinkedHashMap;
import java.util.Map;

public class GetMessagesTool extends BrokerTool {
    private final MessageStore messages;
    private final ChannelRegistry channels;

    public GetMessagesTool(MessageStore messages, ChannelRegistry channels) {
        super("get-realtime-messages", "Page through the messages of a realtime channel");
        this.messages = messages;
        this.channels = channels;
    }

    @Override
    protected ToolResult handle(Params params) {
        String channelId = params.required("channelId");
        MessageQuery query = MessageQuery.builder()
                .limit(params.integer("limit", MessageQuery.DEFAULT_LIMIT))
                .offset(params.integer("offset", 0))
                .orderBy(MessageQuery.OrderBy.fromColumn(params.string("orderBy", "created_at")))
                .direction(MessageQuery.Direction.parse(params.string("orderDirection", "desc")))
                .eventFilter(params.string("eventFilter"))
                .startDate(params.instant("startDate"))
                .endDate(params.instant("endDate"))
                .build();

        if (!messages.exists(channelId)) {
            throw BrokerException.notFound("Channel '" + channelId + "' does not exist");
        }
        MessagePage page = messages.list(channelId, query);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("channelId", channelId);
        body.put("messages", page.messages().stream().map(Views::message).toList());
        body.put("pagination", Views.pagination(page.totalCount(), page.limit(), page.offset(), page.hasMore()));
        if (channels.viewExists()) {
            channels.find(channelId).ifPresent(c -> body.put("channel", Views.channel(c)));
        }
        return ToolResult.ok(body);
    }
}
