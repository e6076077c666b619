package com.pgbroker.repositories.postgres;

/**
 * Catalog queries used to inspect the broker's objects. Every query takes the
 * schema (and where relevant the relation) as bound parameters.
 */
public final class PostgresQueries {
    private PostgresQueries() {}

    public static final String COLUMNS = """
            SELECT column_name
            FROM information_schema.columns
            WHERE table_schema = ?
              AND table_name = ?
            ORDER BY ordinal_position
            """;

    public static final String SCHEMA_EXISTS = """
            SELECT EXISTS (
                SELECT 1 FROM information_schema.schemata WHERE schema_name = ?
            ) AS present
            """;

    public static final String TABLE_EXISTS = """
            SELECT EXISTS (
                SELECT 1
                FROM information_schema.tables
                WHERE table_schema = ?
                  AND table_name = ?
                  AND table_type = 'BASE TABLE'
            ) AS present
            """;

    public static final String VIEW_EXISTS = """
            SELECT EXISTS (
                SELECT 1 FROM information_schema.views WHERE table_schema = ? AND table_name = ?
            ) AS present
            """;

    public static final String RLS_ENABLED = """
            SELECT c.relrowsecurity AS present
            FROM pg_class c
            JOIN pg_namespace n ON n.oid = c.relnamespace
            WHERE n.nspname = ?
              AND c.relname = ?
            """;

    public static final String EXTENSION_EXISTS = """
            SELECT EXISTS (SELECT 1 FROM pg_extension WHERE extname = ?) AS present
            """;

    public static final String EXTENSION_AVAILABLE = """
            SELECT EXISTS (SELECT 1 FROM pg_available_extensions WHERE name = ?) AS present
            """;

    public static final String ROLE_EXISTS = """
            SELECT EXISTS (SELECT 1 FROM pg_roles WHERE rolname = ?) AS present
            """;

    /**
     * Parameters: schema, table, pattern, pattern. A {@code NULL} pattern matches
     * every policy.
     */
    public static final String POLICY_COUNT = """
            SELECT COUNT(*) AS count
            FROM pg_policy p
            JOIN pg_class c ON c.oid = p.polrelid
            JOIN pg_namespace n ON n.oid = c.relnamespace
            WHERE n.nspname = ?
              AND c.relname = ?
              AND (CAST(? AS text) IS NULL OR p.polname LIKE '%' || CAST(? AS text) || '%')
            """;

    /**
     * Parameters: schema, table, pattern, pattern, limit, offset. Role OID 0 stands
     * for {@code PUBLIC}.
     */
    public static final String POLICIES = """
            SELECT p.polname AS name,
                   n.nspname AS schema_name,
                   c.relname AS table_name,
                   p.polcmd::text AS command,
                   p.polpermissive AS permissive,
                   ARRAY(
                       SELECT CASE WHEN r = 0 THEN 'PUBLIC' ELSE pg_get_userbyid(r)::text END
                       FROM unnest(p.polroles) AS r
                   ) AS roles,
                   pg_get_expr(p.polqual, p.polrelid) AS using_expr,
                   pg_get_expr(p.polwithcheck, p.polrelid) AS check_expr
            FROM pg_policy p
            JOIN pg_class c ON c.oid = p.polrelid
            JOIN pg_namespace n ON n.oid = c.relnamespace
            WHERE n.nspname = ?
              AND c.relname = ?
              AND (CAST(? AS text) IS NULL OR p.polname LIKE '%' || CAST(? AS text) || '%')
            ORDER BY p.polname
            LIMIT ? OFFSET ?
            """;

    public static final String POLICY_BY_NAME = """
            SELECT p.polname AS name,
                   n.nspname AS schema_name,
                   c.relname AS table_name,
                   p.polcmd::text AS command,
                   p.polpermissive AS permissive,
                   ARRAY(
                       SELECT CASE WHEN r = 0 THEN 'PUBLIC' ELSE pg_get_userbyid(r)::text END
                       FROM unnest(p.polroles) AS r
                   ) AS roles,
                   pg_get_expr(p.polqual, p.polrelid) AS using_expr,
                   pg_get_expr(p.polwithcheck, p.polrelid) AS check_expr
            FROM pg_policy p
            JOIN pg_class c ON c.oid = p.polrelid
            JOIN pg_namespace n ON n.oid = c.relnamespace
            WHERE n.nspname = ?
              AND c.relname = ?
              AND p.polname = ?
            """;
}
