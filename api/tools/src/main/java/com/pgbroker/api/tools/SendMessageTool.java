package com.pgbroker.api.tools;

import com.pgbroker.core.BrokerException;
import com.pgbroker.core.Message;
import com.pgbroker.core.MessageStore;

import java.util.LinkedHashMap;
import java.util.Map;

public class SendMessageTool extends BrokerTool {
    private final MessageStore messages;

    public SendMessageTool(MessageStore messages) {
        super("send-realtime-message", "Publish a message to a realtime channel");
        this.messages = messages;
    }

    @Override
    protected ToolResult handle(Params params) {
        String channelId = params.required("channelId");
        Map<String, Object> payload = params.map("message");
        if (payload == null) {
            throw BrokerException.validation("message is required");
        }
        boolean createIfMissing = params.bool("createChannelIfNotExists", true);

        boolean existed = messages.exists(channelId);
        if (!existed && !createIfMissing) {
            throw BrokerException.notFound("Channel '" + channelId + "' does not exist and createChannelIfNotExists is false");
        }
        Message message = messages.publish(channelId, payload, params.string("event"));

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("message", Views.message(message));
        body.put("channelCreated", !existed);
        return ToolResult.ok(body);
    }
}
