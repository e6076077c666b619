package com.pgbroker.api.tools;

import com.pgbroker.core.ErrorKind;
import com.pgbroker.core.RealtimeBroker;
import com.pgbroker.core.RealtimeListener;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Every realtime tool keyed by name, in registration order.
 */
public class ToolRegistry {
    private final Map<String, Tool> tools = new LinkedHashMap<>();

    public ToolRegistry(RealtimeBroker broker) {
        this(broker, new LoggingListener());
    }

    public ToolRegistry(RealtimeBroker broker, RealtimeListener listener) {
        this(List.of(
                new RealtimeStatusTool(broker.lifecycle()),
                new SendMessageTool(broker.messages()),
                new GetMessagesTool(broker.messages(), broker.channels()),
                new ManageChannelsTool(broker.channelOperations()),
                new ListChannelsTool(broker.channels()),
                new ManageViewsTool(broker.channels()),
                new SubscribeTool(broker.notifications(), listener),
                new UnsubscribeTool(broker.notifications()),
                new ListSubscriptionsTool(broker.notifications()),
                new ListPoliciesTool(broker.policies()),
                new CreatePolicyTool(broker.policies()),
                new UpdatePolicyTool(broker.policies()),
                new DeletePolicyTool(broker.policies())));
    }

    public ToolRegistry(List<Tool> tools) {
        for (Tool tool : tools) {
            if (this.tools.putIfAbsent(tool.name(), tool) != null) {
                throw new IllegalArgumentException("Duplicate tool name: " + tool.name());
            }
        }
    }

    public Set<String> names() {
        return tools.keySet();
    }

    public Optional<Tool> find(String name) {
        return Optional.ofNullable(tools.get(name));
    }

    public ToolResult call(String name, Map<String, Object> params) {
        return find(name)
                .map(tool -> tool.call(params))
                .orElseGet(() -> ToolResult.error(ErrorKind.VALIDATION, "Unknown tool: " + name));
    }
}
