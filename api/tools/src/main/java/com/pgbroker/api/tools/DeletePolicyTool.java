package com.pgbroker.api.tools;

import com.pgbroker.core.Policy;
import com.pgbroker.core.PolicyEngine;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

public class DeletePolicyTool extends BrokerTool {
    private final PolicyEngine policies;

    public DeletePolicyTool(PolicyEngine policies) {
        super("delete-realtime-policy", "Drop a row level security policy from the realtime messages table");
        this.policies = policies;
    }

    @Override
    protected ToolResult handle(Params params) {
        String name = params.required("name");
        Optional<Policy> deleted = policies.delete(name, params.bool("ifExists", true));

        Map<String, Object> body = new LinkedHashMap<>();
        if (deleted.isEmpty()) {
            body.put("message", "Policy '" + name + "' does not exist on the realtime messages table. No action taken.");
        } else {
            body.put("message", "Policy '" + name + "' deleted");
            body.put("policy", Views.policy(deleted.get(), true));
        }
        return ToolResult.ok(body);
    }
}
