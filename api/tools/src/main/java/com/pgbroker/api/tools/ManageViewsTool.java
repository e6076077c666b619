package com.pgbroker.api.tools;

import com.pgbroker.core.BrokerException;
import com.pgbroker.core.ChannelRegistry;

import java.util.LinkedHashMap;
import java.util.Map;

public class ManageViewsTool extends BrokerTool {
    private static final String CHANNELS_VIEW = "channels";

    private final ChannelRegistry channels;

    public ManageViewsTool(ChannelRegistry channels) {
        super("manage-realtime-views", "Create, update, drop or inspect the realtime channels view");
        this.channels = channels;
    }

    @Override
    protected ToolResult handle(Params params) {
        String action = params.required("action");
        String viewName = params.string("viewName", CHANNELS_VIEW);
        if (!CHANNELS_VIEW.equals(viewName)) {
            throw BrokerException.validation("viewName must be 'channels'");
        }
        String definition = params.string("customDefinition");
        boolean exists = channels.viewExists();

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("viewName", viewName);
        switch (action) {
            case "status":
                body.put("exists", exists);
                return ToolResult.ok(body);
            case "drop":
                body.put("dropped", channels.dropView());
                return ToolResult.ok(body);
            case "create":
                if (exists) {
                    throw BrokerException.precondition("View '" + viewName + "' already exists. Use action 'update' to modify it.");
                }
                return ToolResult.ok(write(body, definition, "created"));
            case "update":
                if (!exists) {
                    throw BrokerException.notFound("View '" + viewName + "' does not exist. Use action 'create' to create it.");
                }
                return ToolResult.ok(write(body, definition, "updated"));
            default:
                throw BrokerException.validation("Invalid action: " + action + ". Must be one of: create, update, drop, status.");
        }
    }

    private Map<String, Object> write(Map<String, Object> body, String definition, String verb) {
        if (definition == null || definition.isBlank()) {
            channels.createOrUpdateView();
        } else {
            channels.createOrUpdateView(definition);
        }
        body.put("message", "Successfully " + verb + " view '" + body.get("viewName") + "'.");
        body.put("custom", definition != null && !definition.isBlank());
        return body;
    }
}
