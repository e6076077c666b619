package com.pgbroker.api.tools;

import com.pgbroker.core.Policy;
import com.pgbroker.core.PolicyCommand;
import com.pgbroker.core.PolicyEngine;
import com.pgbroker.core.PolicyFilter;
import com.pgbroker.core.PolicyMode;
import com.pgbroker.core.PolicyPage;
import com.pgbroker.core.PolicyPatch;
import com.pgbroker.core.PolicySpec;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class PolicyToolsTest {
    private static final Policy READERS = new Policy("readers", "realtime", "messages", PolicyCommand.SELECT,
            List.of(), PolicyMode.PERMISSIVE, "true", null);

    private PolicyEngine policies;

    @BeforeEach
    void setUp() {
        policies = mock(PolicyEngine.class);
    }

    @Test
    void createBuildsASpecFromParameters() {
        PolicySpec expected = new PolicySpec("readers", PolicyCommand.SELECT, List.of("authenticated", "anon"),
                PolicyMode.RESTRICTIVE, "true", null);
        when(policies.create(expected)).thenReturn(READERS);

        ToolResult result = new CreatePolicyTool(policies).call(Map.of(
                "name", "readers", "command", "select", "roles", "authenticated, anon",
                "asRestrictive", true, "using", "true"));

        assertTrue(result.success());
        verify(policies).create(expected);
    }

    @Test
    void invalidCombinationsNeverReachTheEngine() {
        ToolResult result = new CreatePolicyTool(policies).call(Map.of(
                "name", "writers", "command", "INSERT", "using", "true"));

        assertFalse(result.success());
        assertEquals("validation", result.body().get("kind"));
        verifyNoInteractions(policies);
    }

    @Test
    void policiesRenderWithPublicForEmptyRoles() {
        when(policies.list(any())).thenReturn(new PolicyPage(List.of(READERS), 1, 50, 0));

        ToolResult result = new ListPoliciesTool(policies).call(Map.of("includeDefinition", false));

        @SuppressWarnings("unchecked")
        Map<String, Object> policy = ((List<Map<String, Object>>) result.body().get("policies")).get(0);
        assertEquals(List.of("PUBLIC"), policy.get("roles"));
        assertEquals("PERMISSIVE", policy.get("action"));
        assertFalse(policy.containsKey("definition"));
        verify(policies).list(new PolicyFilter(null, 50, 0, false));
    }

    @Test
    void updateDefaultsToRecreate() {
        when(policies.update(eq("readers"), any())).thenReturn(READERS);

        new UpdatePolicyTool(policies).call(Map.of("name", "readers", "using", "auth.uid() IS NOT NULL"));

        verify(policies).update("readers",
                new PolicyPatch(null, null, null, null, "auth.uid() IS NOT NULL", null, true));
    }

    @Test
    void renameOnlyUpdate() {
        when(policies.update(eq("readers"), any())).thenReturn(READERS);

        new UpdatePolicyTool(policies).call(Map.of("name", "readers", "newName", "viewers", "recreate", false));

        verify(policies).update("readers", PolicyPatch.rename("viewers"));
    }

    @Test
    void deleteOfAnAbsentPolicyIsANoOpByDefault() {
        when(policies.delete("ghost", true)).thenReturn(Optional.empty());

        ToolResult result = new DeletePolicyTool(policies).call(Map.of("name", "ghost"));

        assertTrue(result.success());
        assertFalse(result.body().containsKey("policy"));
    }

    @Test
    void deleteReturnsTheDefinition() {
        when(policies.delete("readers", false)).thenReturn(Optional.of(READERS));

        ToolResult result = new DeletePolicyTool(policies).call(Map.of("name", "readers", "ifExists", false));

        @SuppressWarnings("unchecked")
        Map<String, Object> policy = (Map<String, Object>) result.body().get("policy");
        assertTrue(policy.get("definition").toString().startsWith("CREATE POLICY \"readers\" ON realtime.messages"));
    }
}
