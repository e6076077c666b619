package com.pgbroker.api.tools;

import com.pgbroker.core.Policy;
import com.pgbroker.core.PolicyCommand;
import com.pgbroker.core.PolicyEngine;
import com.pgbroker.core.PolicyMode;
import com.pgbroker.core.PolicyPatch;

import java.util.LinkedHashMap;
import java.util.Map;

public class UpdatePolicyTool extends BrokerTool {
    private final PolicyEngine policies;

    public UpdatePolicyTool(PolicyEngine policies) {
        super("update-realtime-policy", "Rename or redefine a row level security policy on the realtime messages table");
        this.policies = policies;
    }

    @Override
    protected ToolResult handle(Params params) {
        String name = params.required("name");
        Boolean restrictive = params.optionalBool("asRestrictive");
        PolicyPatch patch = new PolicyPatch(
                params.string("newName"),
                params.has("command") ? PolicyCommand.parse(params.string("command")) : null,
                params.strings("roles"),
                restrictive == null ? null : (restrictive ? PolicyMode.RESTRICTIVE : PolicyMode.PERMISSIVE),
                params.string("using"),
                params.string("withCheck"),
                params.bool("recreate", true));
        Policy updated = policies.update(name, patch);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("message", "Policy '" + name + "' updated");
        body.put("policy", Views.policy(updated, true));
        return ToolResult.ok(body);
    }
}
