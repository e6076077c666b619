package com.pgbroker.api.tools;

import com.pgbroker.core.NotificationBridge;

import java.util.LinkedHashMap;
import java.util.Map;

public class UnsubscribeTool extends BrokerTool {
    private final NotificationBridge bridge;

    public UnsubscribeTool(NotificationBridge bridge) {
        super("realtime-unsubscribe", "Remove every subscription on a channel");
        this.bridge = bridge;
    }

    @Override
    protected ToolResult handle(Params params) {
        String channel = params.required("channel");
        int removed = bridge.unsubscribe(channel);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("message", "Successfully unsubscribed from " + channel);
        body.put("channel", channel);
        body.put("removedSubscriptions", removed);
        return ToolResult.ok(body);
    }
}
