package com.pgbroker.core;

import java.util.List;

/**
 * Changes to an existing policy. {@code null} fields inherit the current value.
 * Without {@code recreate} only {@code newName} can be applied.
 */
public record PolicyPatch(
        String newName,
        PolicyCommand command,
        List<String> roles,
        PolicyMode mode,
        String usingExpr,
        String checkExpr,
        boolean recreate
) {
    public static PolicyPatch rename(String newName) {
        return new PolicyPatch(newName, null, null, null, null, null, false);
    }

    /**
     * Inherited expressions the new command cannot carry are left behind: an
     * INSERT keeps no USING, a SELECT or DELETE keeps no WITH CHECK. Expressions
     * given in the patch itself are always validated.
     */
    public PolicySpec applyTo(Policy existing) {
        PolicyCommand target = command != null ? command : existing.command();
        String inheritedUsing = target == PolicyCommand.INSERT ? null : existing.usingExpr();
        String inheritedCheck = target == PolicyCommand.SELECT || target == PolicyCommand.DELETE
                ? null
                : existing.checkExpr();
        return new PolicySpec(
                newName != null ? newName : existing.name(),
                target,
                roles != null ? roles : existing.roles(),
                mode != null ? mode : existing.mode(),
                usingExpr != null ? usingExpr : inheritedUsing,
                checkExpr != null ? checkExpr : inheritedCheck);
    }
}
