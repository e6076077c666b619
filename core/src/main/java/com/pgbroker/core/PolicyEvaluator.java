package com.pgbroker.core;

import java.util.List;
import java.util.Locale;
import java.util.function.Predicate;

/**
 * How PostgreSQL combines row level security policies for one command and role.
 * <p>
 * A policy applies when its command covers the command being run and its roles
 * include the current role or {@code PUBLIC}. A row is then visible or writable
 * when every applicable RESTRICTIVE policy passes and at least one applicable
 * PERMISSIVE policy passes. With no applicable permissive policy the row is
 * denied. None of this applies while row level security is disabled on the table.
 * <p>
 * Expressions are evaluated by the caller through a {@link Predicate}; this class
 * only encodes the combination.
 */
public final class PolicyEvaluator {
    private PolicyEvaluator() {}

    public static List<Policy> applicable(List<Policy> policies, String role, PolicyCommand command) {
        return policies.stream()
                .filter(p -> p.command().covers(command))
                .filter(p -> appliesTo(p, role))
                .toList();
    }

    public static boolean permits(boolean rlsEnabled,
                                  List<Policy> policies,
                                  String role,
                                  PolicyCommand command,
                                  Predicate<Policy> passes) {
        if (!rlsEnabled) {
            return true;
        }
        List<Policy> relevant = applicable(policies, role, command);
        boolean restrictiveOk = relevant.stream()
                .filter(p -> p.mode() == PolicyMode.RESTRICTIVE)
                .allMatch(passes);
        boolean permissiveOk = relevant.stream()
                .filter(p -> p.mode() == PolicyMode.PERMISSIVE)
                .anyMatch(passes);
        return restrictiveOk && permissiveOk;
    }

    /**
     * The expression PostgreSQL checks for {@code command}. Inserts use
     * {@code WITH CHECK}; reads and deletes use {@code USING}; updates check the new
     * row with {@code WITH CHECK}, falling back to {@code USING}.
     */
    public static String expressionFor(Policy policy, PolicyCommand command) {
        return switch (command) {
            case INSERT -> policy.checkExpr();
            case SELECT, DELETE -> policy.usingExpr();
            case UPDATE, ALL -> policy.checkExpr() != null ? policy.checkExpr() : policy.usingExpr();
        };
    }

    private static boolean appliesTo(Policy policy, String role) {
        for (String r : policy.effectiveRoles()) {
            if (Policy.PUBLIC.equalsIgnoreCase(r)) {
                return true;
            }
            if (role != null && r.toLowerCase(Locale.ROOT).equals(role.toLowerCase(Locale.ROOT))) {
                return true;
            }
        }
        return false;
    }
}
