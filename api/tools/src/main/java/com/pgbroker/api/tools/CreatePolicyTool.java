package com.pgbroker.api.tools;

import com.pgbroker.core.Policy;
import com.pgbroker.core.PolicyCommand;
import com.pgbroker.core.PolicyEngine;
import com.pgbroker.core.PolicyMode;
import com.pgbroker.core.PolicySpec;

import java.util.LinkedHashMap;
import java.util.Map;

public class CreatePolicyTool extends BrokerTool {
    private final PolicyEngine policies;

    public CreatePolicyTool(PolicyEngine policies) {
        super("create-realtime-policy", "Create a row level security policy on the realtime messages table");
        this.policies = policies;
    }

    @Override
    protected ToolResult handle(Params params) {
        PolicySpec spec = new PolicySpec(
                params.required("name"),
                PolicyCommand.parse(params.required("command")),
                params.strings("roles"),
                params.bool("asRestrictive", false) ? PolicyMode.RESTRICTIVE : PolicyMode.PERMISSIVE,
                params.string("using"),
                params.string("withCheck"));
        Policy created = policies.create(spec);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("message", "Policy '" + created.name() + "' created on " + created.schema() + "." + created.table());
        body.put("policy", Views.policy(created, true));
        return ToolResult.ok(body);
    }
}
