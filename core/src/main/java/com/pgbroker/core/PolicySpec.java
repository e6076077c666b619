package com.pgbroker.core;

import java.util.List;

/**
 * Everything needed to create a policy. At least one of {@code usingExpr} and
 * {@code checkExpr} must be present.
 */
public record PolicySpec(
        String name,
        PolicyCommand command,
        List<String> roles,
        PolicyMode mode,
        String usingExpr,
        String checkExpr
) {
    public PolicySpec {
        if (name == null || name.isBlank()) {
            throw BrokerException.validation("policy name is required");
        }
        if (command == null) {
            throw BrokerException.validation("policy command is required");
        }
        if (isBlank(usingExpr) && isBlank(checkExpr)) {
            throw BrokerException.validation("policy '" + name + "' needs a USING or a WITH CHECK expression");
        }
        if (command == PolicyCommand.INSERT && !isBlank(usingExpr)) {
            throw BrokerException.validation("INSERT policies only accept a WITH CHECK expression");
        }
        if ((command == PolicyCommand.SELECT || command == PolicyCommand.DELETE) && !isBlank(checkExpr)) {
            throw BrokerException.validation(command + " policies only accept a USING expression");
        }
        roles = roles == null ? List.of() : List.copyOf(roles);
        mode = mode == null ? PolicyMode.PERMISSIVE : mode;
        usingExpr = isBlank(usingExpr) ? null : usingExpr;
        checkExpr = isBlank(checkExpr) ? null : checkExpr;
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    public PolicySpec rename(String newName) {
        return new PolicySpec(newName, command, roles, mode, usingExpr, checkExpr);
    }
}
