package com.pgbroker.api.tools;

import com.pgbroker.core.NotificationBridge;
import com.pgbroker.core.Subscription;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class ListSubscriptionsTool extends BrokerTool {
    private final NotificationBridge bridge;

    public ListSubscriptionsTool(NotificationBridge bridge) {
        super("realtime-list-subscriptions", "List the subscriptions held by this process");
        this.bridge = bridge;
    }

    @Override
    protected ToolResult handle(Params params) {
        List<Subscription> subscriptions = bridge.list();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("subscriptions", subscriptions.stream().map(Subscription::describe).toList());
        body.put("count", subscriptions.size());
        return ToolResult.ok(body);
    }
}
