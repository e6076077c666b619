package com.pgbroker.api.tools;

import com.pgbroker.core.PolicyEngine;
import com.pgbroker.core.PolicyFilter;
import com.pgbroker.core.PolicyPage;

import java.util.LinkedHashMap;
import java.util.Map;

public class ListPoliciesTool extends BrokerTool {
    private final PolicyEngine policies;

    public ListPoliciesTool(PolicyEngine policies) {
        super("list-realtime-policies", "List row level security policies on the realtime messages table");
        this.policies = policies;
    }

    @Override
    protected ToolResult handle(Params params) {
        PolicyFilter filter = new PolicyFilter(
                params.string("policyName"),
                params.integer("limit", 50),
                params.integer("offset", 0),
                params.bool("includeDefinition", true));
        PolicyPage page = policies.list(filter);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("policies", page.policies().stream()
                .map(p -> Views.policy(p, filter.includeDefinition()))
                .toList());
        body.put("pagination", Views.pagination(page.total(), page.limit(), page.offset(), page.hasMore()));
        return ToolResult.ok(body);
    }
}
