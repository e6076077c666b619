package com.pgbroker.api.tools;

import com.pgbroker.core.BrokerStatus;
import com.pgbroker.core.Channel;
import com.pgbroker.core.Message;
import com.pgbroker.core.Policy;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Renders broker records as the JSON objects tools return.
 */
final class Views {
    private Views() {}

    static Map<String, Object> status(BrokerStatus status) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("enabled", status.enabled());
        view.put("schemaExists", status.schemaExists());
        view.put("messagesTableExists", status.messagesTableExists());
        view.put("rlsEnabled", status.rlsEnabled());
        view.put("extensionExists", status.extensionExists());
        if (status.channelKey() != null) {
            view.put("channelKey", status.channelKey());
            view.put("degraded", status.degraded());
        }
        if (status.features() != null) {
            Map<String, Object> features = new LinkedHashMap<>();
            features.put("broadcast", status.features().broadcast());
            features.put("presence", status.features().presence());
            features.put("rls", status.features().rowLevelSecurity());
            view.put("features", features);
        }
        return view;
    }

    static Map<String, Object> message(Message message) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("id", message.id());
        view.put("channel", message.channel());
        view.put("payload", message.payload());
        view.put("event", message.event());
        view.put("createdAt", message.createdAt());
        return view;
    }

    static Map<String, Object> channel(Channel channel) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("id", channel.id());
        view.put("name", channel.name());
        view.put("type", channel.type());
        view.put("createdAt", channel.createdAt());
        view.put("updatedAt", channel.updatedAt());
        view.put("broadcastCount", channel.broadcastCount());
        return view;
    }

    static Map<String, Object> policy(Policy policy, boolean includeDefinition) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("name", policy.name());
        view.put("schema", policy.schema());
        view.put("table", policy.table());
        view.put("command", policy.command().name());
        view.put("roles", policy.effectiveRoles());
        view.put("action", policy.mode().name());
        view.put("using", policy.usingExpr());
        view.put("withCheck", policy.checkExpr());
        if (includeDefinition) {
            view.put("definition", policy.definition());
        }
        return view;
    }

    static Map<String, Object> pagination(long total, int limit, int offset, boolean hasMore) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("total", total);
        view.put("limit", limit);
        view.put("offset", offset);
        view.put("hasMore", hasMore);
        return view;
    }
}
