package com.pgbroker.api.tools;

import com.pgbroker.core.BrokerException;
import com.pgbroker.core.BrokerLifecycle;
import com.pgbroker.core.BrokerOptions;
import com.pgbroker.core.LifecycleResult;

import java.util.Map;

public class RealtimeStatusTool extends BrokerTool {
    private final BrokerLifecycle lifecycle;

    public RealtimeStatusTool(BrokerLifecycle lifecycle) {
        super("manage-realtime-status", "Enable, disable or inspect the realtime broker");
        this.lifecycle = lifecycle;
    }

    @Override
    protected ToolResult handle(Params params) {
        String action = params.string("action", "status");
        switch (action) {
            case "status":
                return ToolResult.ok(Views.status(lifecycle.status()));
            case "enable": {
                BrokerOptions options = new BrokerOptions(
                        params.bool("enableBroadcast", true),
                        params.bool("enablePresence", true),
                        params.bool("enableRLS", true));
                return withMessage(lifecycle.enable(options));
            }
            case "disable":
                return withMessage(lifecycle.disable());
            default:
                throw BrokerException.validation("Invalid action: " + action + ". Must be one of: enable, disable, status.");
        }
    }

    private static ToolResult withMessage(LifecycleResult result) {
        Map<String, Object> body = Views.status(result.status());
        body.put("message", result.message());
        return ToolResult.ok(body);
    }
}
