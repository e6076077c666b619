package com.pgbroker.api.tools;

import com.pgbroker.core.NotificationBridge;
import com.pgbroker.core.RealtimeListener;
import com.pgbroker.core.Subscription;
import com.pgbroker.core.SubscriptionEvent;

import java.util.LinkedHashMap;
import java.util.Map;

public class SubscribeTool extends BrokerTool {
    private final NotificationBridge bridge;
    private final RealtimeListener listener;

    public SubscribeTool(NotificationBridge bridge, RealtimeListener listener) {
        super("realtime-subscribe", "Subscribe to row changes on a channel");
        this.bridge = bridge;
        this.listener = listener;
    }

    @Override
    protected ToolResult handle(Params params) {
        String channel = params.required("channel");
        SubscriptionEvent event = SubscriptionEvent.parse(params.required("event"));
        Subscription subscription = bridge.subscribe(channel, event, params.map("filter"), listener, params.string("table"));

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("subscriptionId", subscription.id());
        body.put("message", "Successfully subscribed to " + event + " events on " + channel);
        body.put("details", subscription.describe());
        return ToolResult.ok(body);
    }
}
