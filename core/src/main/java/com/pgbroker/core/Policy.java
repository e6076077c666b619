package com.pgbroker.core;

import java.util.List;

/**
 * A row level security policy attached to the message log, as read back from
 * {@code pg_policy}.
 */
public record Policy(
        String name,
        String schema,
        String table,
        PolicyCommand command,
        List<String> roles,
        PolicyMode mode,
        String usingExpr,
        String checkExpr
) {
    public static final String PUBLIC = "PUBLIC";

    public List<String> effectiveRoles() {
        return roles == null || roles.isEmpty() ? List.of(PUBLIC) : roles;
    }

    /**
     * The statement that would recreate this policy.
     */
    public String definition() {
        StringBuilder sb = new StringBuilder("CREATE POLICY ")
                .append(Identifiers.quote(name))
                .append(" ON ").append(schema).append('.').append(table).append('\n');
        if (mode == PolicyMode.RESTRICTIVE) {
            sb.append("  AS RESTRICTIVE\n");
        }
        sb.append("  FOR ").append(command).append('\n');
        sb.append("  TO ").append(String.join(", ", effectiveRoles())).append('\n');
        if (usingExpr != null) {
            sb.append("  USING (").append(usingExpr).append(")\n");
        }
        if (checkExpr != null) {
            sb.append("  WITH CHECK (").append(checkExpr).append(")\n");
        }
        return sb.append(';').toString();
    }
}
