package com.pgbroker.api.tools;

import com.pgbroker.core.BrokerException;
import com.pgbroker.core.ChannelOperations;
import com.pgbroker.core.ChannelResult;

import java.util.LinkedHashMap;
import java.util.Map;

public class ManageChannelsTool extends BrokerTool {
    private final ChannelOperations operations;

    public ManageChannelsTool(ChannelOperations operations) {
        super("manage-realtime-channels", "Create, delete or describe a realtime channel");
        this.operations = operations;
    }

    @Override
    protected ToolResult handle(Params params) {
        String action = params.required("action");
        String channelId = params.required("channelId");
        Map<String, Object> body = new LinkedHashMap<>();
        switch (action) {
            case "details":
                body.put("channel", Views.channel(operations.details(channelId)));
                return ToolResult.ok(body);
            case "delete": {
                ChannelResult result = operations.delete(channelId);
                if (!result.found()) {
                    body.put("message", "Channel '" + channelId + "' does not exist, nothing to delete.");
                } else {
                    body.put("message", "Channel '" + channelId + "' deleted.");
                    body.put("channel", Views.channel(result.channel()));
                }
                body.put("deletedCount", result.deletedCount());
                return ToolResult.ok(body);
            }
            case "create": {
                ChannelResult result = operations.create(
                        channelId, params.string("channelType", "standard"), params.map("metadata"));
                Map<String, Object> channel = Views.channel(result.channel());
                channel.put("metadata", result.metadata());
                body.put("message", "Channel '" + channelId + "' created.");
                body.put("channel", channel);
                return ToolResult.ok(body);
            }
            default:
                throw BrokerException.validation("Invalid action: " + action + ". Must be one of: create, delete, details.");
        }
    }
}
