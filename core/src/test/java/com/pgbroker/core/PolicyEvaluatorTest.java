package com.pgbroker.core;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class PolicyEvaluatorTest {

    private static Policy policy(String name, PolicyCommand command, PolicyMode mode, String... roles) {
        return new Policy(name, "realtime", "messages", command, List.of(roles), mode, "true", null);
    }

    @Test
    void noPoliciesDeniesWhenRlsIsActive() {
        assertFalse(PolicyEvaluator.permits(true, List.of(), "authenticated", PolicyCommand.SELECT, p -> true));
    }

    @Test
    void noPoliciesAllowsWhenRlsIsInactive() {
        assertTrue(PolicyEvaluator.permits(false, List.of(), "authenticated", PolicyCommand.SELECT, p -> false));
    }

    @Test
    void onePassingPermissivePolicyIsEnough() {
        List<Policy> policies = List.of(
                policy("a", PolicyCommand.SELECT, PolicyMode.PERMISSIVE, "authenticated"),
                policy("b", PolicyCommand.SELECT, PolicyMode.PERMISSIVE, "authenticated"));

        assertTrue(PolicyEvaluator.permits(true, policies, "authenticated", PolicyCommand.SELECT,
                p -> p.name().equals("b")));
    }

    @Test
    void everyRestrictivePolicyMustPass() {
        List<Policy> policies = List.of(
                policy("allow", PolicyCommand.ALL, PolicyMode.PERMISSIVE),
                policy("r1", PolicyCommand.SELECT, PolicyMode.RESTRICTIVE),
                policy("r2", PolicyCommand.SELECT, PolicyMode.RESTRICTIVE));
        Set<String> passing = Set.of("allow", "r1");

        assertFalse(PolicyEvaluator.permits(true, policies, "anon", PolicyCommand.SELECT,
                p -> passing.contains(p.name())));
        assertTrue(PolicyEvaluator.permits(true, policies, "anon", PolicyCommand.SELECT, p -> true));
    }

    @Test
    void restrictivePoliciesAloneNeverGrantAccess() {
        List<Policy> policies = List.of(policy("r", PolicyCommand.SELECT, PolicyMode.RESTRICTIVE));

        assertFalse(PolicyEvaluator.permits(true, policies, "anon", PolicyCommand.SELECT, p -> true));
    }

    @Test
    void policiesForOtherRolesOrCommandsDoNotApply() {
        List<Policy> policies = List.of(
                policy("insert-only", PolicyCommand.INSERT, PolicyMode.PERMISSIVE, "authenticated"),
                policy("admins", PolicyCommand.SELECT, PolicyMode.PERMISSIVE, "admin"));

        assertTrue(PolicyEvaluator.applicable(policies, "authenticated", PolicyCommand.SELECT).isEmpty());
        assertFalse(PolicyEvaluator.permits(true, policies, "authenticated", PolicyCommand.SELECT, p -> true));
        assertEquals(1, PolicyEvaluator.applicable(policies, "Admin", PolicyCommand.SELECT).size());
    }

    @Test
    void emptyRoleListMeansPublic() {
        Policy everyone = policy("everyone", PolicyCommand.SELECT, PolicyMode.PERMISSIVE);

        assertEquals(List.of("PUBLIC"), everyone.effectiveRoles());
        assertEquals(1, PolicyEvaluator.applicable(List.of(everyone), "whoever", PolicyCommand.SELECT).size());
    }

    @Test
    void expressionDependsOnTheCommand() {
        Policy p = new Policy("p", "realtime", "messages", PolicyCommand.ALL, List.of(), PolicyMode.PERMISSIVE,
                "owner = current_user", "length(message::text) < 100");

        assertEquals("length(message::text) < 100", PolicyEvaluator.expressionFor(p, PolicyCommand.INSERT));
        assertEquals("owner = current_user", PolicyEvaluator.expressionFor(p, PolicyCommand.SELECT));
        assertEquals("owner = current_user", PolicyEvaluator.expressionFor(p, PolicyCommand.DELETE));
        assertEquals("length(message::text) < 100", PolicyEvaluator.expressionFor(p, PolicyCommand.UPDATE));
    }
}
