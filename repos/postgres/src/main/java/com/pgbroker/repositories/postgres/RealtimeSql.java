package com.pgbroker.repositories.postgres;

import com.github.jknack.handlebars.Handlebars;
import com.github.jknack.handlebars.Template;
import com.pgbroker.core.Identifiers;
import com.pgbroker.core.MessageQuery;
import com.pgbroker.core.PolicyMode;
import com.pgbroker.core.PolicySpec;
import com.pgbroker.core.SchemaShape;
import com.pgbroker.core.StoreDescriptor;
import com.pgbroker.core.SubscriptionEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Handlebars templates for every statement whose text depends on the message
 * log's layout or on identifiers. Templates are compiled once; identifiers are
 * quoted before rendering and values stay bound parameters.
 */
public class RealtimeSql {
    private static final Logger logger = LoggerFactory.getLogger(RealtimeSql.class);

    /** NOTIFY rejects payloads of this many bytes or more. */
    public static final int NOTIFY_PAYLOAD_LIMIT = 8000;

    /** Columns left out of a row whose notification would exceed the limit. */
    public static final List<String> PAYLOAD_COLUMNS = List.of("message", "payload");

    private final Handlebars handlebars = new Handlebars();
    private final Map<String, Template> templates;

    public RealtimeSql() {
        Map<String, String> templateStrings = new HashMap<>();

        templateStrings.put("createSchema", "CREATE SCHEMA IF NOT EXISTS {{{schema}}}");

        templateStrings.put("createMessagesTable",
                "CREATE TABLE IF NOT EXISTS {{{table}}} (" +
                        "    id UUID PRIMARY KEY DEFAULT gen_random_uuid()," +
                        "    {{{keyColumn}}} TEXT NOT NULL," +
                        "    message JSONB NOT NULL," +
                        "    created_at TIMESTAMP WITH TIME ZONE NOT NULL DEFAULT now()" +
                        ")");

        templateStrings.put("createMessagesIndex",
                "CREATE INDEX IF NOT EXISTS {{{index}}} ON {{{table}}} ({{{keyColumn}}}, created_at)");

        templateStrings.put("rowLevelSecurity", "ALTER TABLE {{{table}}} {{action}} ROW LEVEL SECURITY");

        templateStrings.put("createRole", "CREATE ROLE {{{role}}} NOLOGIN");

        templateStrings.put("createExtension", "CREATE EXTENSION IF NOT EXISTS {{{extension}}}");

        templateStrings.put("dropSchema", "DROP SCHEMA IF EXISTS {{{schema}}} CASCADE");

        templateStrings.put("dropExtension", "DROP EXTENSION IF EXISTS {{{extension}}}");

        templateStrings.put("insertMessage",
                "INSERT INTO {{{table}}} ({{#if keyColumn}}{{{keyColumn}}}, {{/if}}{{{payloadColumn}}}) " +
                        "VALUES ({{#if keyColumn}}?, {{/if}}CAST(? AS jsonb)) " +
                        "RETURNING {{{columns}}}");

        templateStrings.put("selectMessages",
                "SELECT {{{columns}}} FROM {{{table}}} " +
                        "WHERE {{{predicate}}} " +
                        "ORDER BY {{{orderColumn}}} {{direction}}, {{{idColumn}}} {{direction}} " +
                        "LIMIT ? OFFSET ?");

        templateStrings.put("countMessages", "SELECT COUNT(*) AS count FROM {{{table}}} WHERE {{{predicate}}}");

        templateStrings.put("messagePredicate",
                "{{{channelExpr}}} = ?" +
                        "{{#if eventFilter}} AND {{{payloadExpr}}}->>'event' = ?{{/if}}" +
                        "{{#if startDate}} AND {{{timestampExpr}}} >= ?{{/if}}" +
                        "{{#if endDate}} AND {{{timestampExpr}}} <= ?{{/if}}");

        templateStrings.put("purgeMessages", "DELETE FROM {{{table}}} WHERE {{{channelExpr}}} = ?");

        templateStrings.put("messageExists",
                "SELECT EXISTS (SELECT 1 FROM {{{table}}} WHERE {{{channelExpr}}} = ?) AS present");

        templateStrings.put("createChannelsView",
                "CREATE OR REPLACE VIEW {{{view}}} AS " +
                        "SELECT m.channel AS id, " +
                        "       m.channel AS name, " +
                        "       'standard'::text AS type, " +
                        "       MIN(m.ts) AS created_at, " +
                        "       MAX(m.ts) AS updated_at, " +
                        "       COUNT(*)::bigint AS broadcast_count " +
                        "FROM (SELECT ({{{channelExpr}}})::text AS channel, " +
                        "             ({{{timestampExpr}}})::timestamptz AS ts " +
                        "      FROM {{{table}}}) m " +
                        "GROUP BY m.channel " +
                        "HAVING COUNT(*) > 0");

        templateStrings.put("createCustomView", "CREATE OR REPLACE VIEW {{{view}}} AS {{{definition}}}");

        templateStrings.put("dropView", "DROP VIEW IF EXISTS {{{view}}}");

        templateStrings.put("findChannel",
                "SELECT id, name, type, created_at, updated_at, broadcast_count FROM {{{view}}} WHERE id = ?");

        templateStrings.put("listChannels",
                "SELECT id, name, type, created_at, updated_at, broadcast_count FROM {{{view}}} " +
                        "WHERE (CAST(? AS text) IS NULL OR name LIKE '%' || CAST(? AS text) || '%') " +
                        "ORDER BY name LIMIT ? OFFSET ?");

        templateStrings.put("createPolicy",
                "CREATE POLICY {{{name}}} ON {{{table}}}" +
                        "{{#if restrictive}} AS RESTRICTIVE{{/if}}" +
                        " FOR {{command}} TO {{{roles}}}" +
                        "{{#if using}} USING ({{{using}}}){{/if}}" +
                        "{{#if check}} WITH CHECK ({{{check}}}){{/if}}");

        templateStrings.put("dropPolicy", "DROP POLICY IF EXISTS {{{name}}} ON {{{table}}}");

        templateStrings.put("renamePolicy", "ALTER POLICY {{{name}}} ON {{{table}}} RENAME TO {{{newName}}}");

        templateStrings.put("notifyFunction",
                "CREATE OR REPLACE FUNCTION {{{function}}}() RETURNS trigger LANGUAGE plpgsql AS $realtime$\n" +
                        "DECLARE\n" +
                        "  row_data jsonb;\n" +
                        "  body text;\n" +
                        "BEGIN\n" +
                        "  IF TG_OP = 'DELETE' THEN row_data := to_jsonb(OLD); ELSE row_data := to_jsonb(NEW); END IF;\n" +
                        "  body := jsonb_build_object('event', TG_OP, 'schema', TG_TABLE_SCHEMA, 'table', TG_TABLE_NAME,\n" +
                        "    'data', row_data)::text;\n" +
                        "  IF octet_length(body) >= {{limit}} THEN\n" +
                        "    body := jsonb_build_object('event', TG_OP, 'schema', TG_TABLE_SCHEMA, 'table', TG_TABLE_NAME,\n" +
                        "      'truncated', true, 'data', row_data{{#each payloadColumns}} - {{{this}}}{{/each}})::text;\n" +
                        "  END IF;\n" +
                        "  IF octet_length(body) >= {{limit}} THEN\n" +
                        "    body := jsonb_build_object('event', TG_OP, 'schema', TG_TABLE_SCHEMA, 'table', TG_TABLE_NAME,\n" +
                        "      'truncated', true, 'data', jsonb_build_object('id', row_data->'id'))::text;\n" +
                        "  END IF;\n" +
                        "  PERFORM pg_notify({{{channel}}}, body);\n" +
                        "  RETURN COALESCE(NEW, OLD);\n" +
                        "END;\n" +
                        "$realtime$");

        templateStrings.put("dropFunction", "DROP FUNCTION IF EXISTS {{{function}}}()");

        templateStrings.put("dropTrigger", "DROP TRIGGER IF EXISTS {{{trigger}}} ON {{{table}}}");

        templateStrings.put("createTrigger",
                "CREATE TRIGGER {{{trigger}}} AFTER {{event}} ON {{{table}}} FOR EACH ROW " +
                        "{{#if when}}WHEN ({{{when}}}) {{/if}}" +
                        "EXECUTE FUNCTION {{{function}}}()");

        Map<String, Template> compiled = new HashMap<>();
        templateStrings.forEach((name, text) -> compiled.put(name, compile(name, text)));
        this.templates = Map.copyOf(compiled);
    }

    private Template compile(String name, String text) {
        try {
            return handlebars.compileInline(text);
        } catch (IOException e) {
            logger.error("Failed to compile template {}", name, e);
            throw new UncheckedIOException("Failed to compile template " + name, e);
        }
    }

    String render(String name, Map<String, Object> context) {
        try {
            return templates.get(name).apply(context);
        } catch (IOException e) {
            logger.error("Failed to render SQL template {}", name, e);
            throw new UncheckedIOException("Failed to render SQL template " + name, e);
        }
    }

    // lifecycle

    public String createSchema(StoreDescriptor store) {
        return render("createSchema", Map.of("schema", Identifiers.quote(store.schema())));
    }

    public String createMessagesTable(StoreDescriptor store, String keyColumn) {
        return render("createMessagesTable", Map.of(
                "table", store.qualifiedTable(),
                "keyColumn", Identifiers.quote(keyColumn)));
    }

    public String createMessagesIndex(StoreDescriptor store, String keyColumn) {
        return render("createMessagesIndex", Map.of(
                "index", Identifiers.quote(store.table() + "_" + keyColumn + "_created_at_idx"),
                "table", store.qualifiedTable(),
                "keyColumn", Identifiers.quote(keyColumn)));
    }

    public String rowLevelSecurity(StoreDescriptor store, boolean enabled) {
        return render("rowLevelSecurity", Map.of(
                "table", store.qualifiedTable(),
                "action", enabled ? "ENABLE" : "DISABLE"));
    }

    public String createRole(String role) {
        return render("createRole", Map.of("role", Identifiers.quote(role)));
    }

    public String createExtension(String extension) {
        return render("createExtension", Map.of("extension", Identifiers.quote(extension)));
    }

    public String dropSchema(StoreDescriptor store) {
        return render("dropSchema", Map.of("schema", Identifiers.quote(store.schema())));
    }

    public String dropExtension(String extension) {
        return render("dropExtension", Map.of("extension", Identifiers.quote(extension)));
    }

    // messages

    private static Map<String, Object> shapeContext(StoreDescriptor store, SchemaShape shape) {
        Map<String, Object> context = new HashMap<>();
        context.put("table", store.qualifiedTable());
        context.put("channelExpr", shape.channelKey().expression());
        context.put("payloadExpr", shape.payloadExpression());
        context.put("timestampExpr", shape.timestampExpression());
        context.put("idColumn", Identifiers.quote(SchemaShape.ID_COLUMN));
        context.put("columns", messageColumns(shape));
        return context;
    }

    /**
     * The select list every message query returns: id, channel, payload, created_at.
     */
    static String messageColumns(SchemaShape shape) {
        return Identifiers.quote(SchemaShape.ID_COLUMN) + "::text AS id, "
                + "(" + shape.channelKey().expression() + ")::text AS channel, "
                + shape.payloadExpression() + " AS payload, "
                + "(" + shape.timestampExpression() + ")::timestamptz AS created_at";
    }

    public String insertMessage(StoreDescriptor store, SchemaShape shape) {
        Map<String, Object> context = shapeContext(store, shape);
        String keyColumn = shape.channelKey().keyColumn();
        if (keyColumn != null) {
            context.put("keyColumn", Identifiers.quote(keyColumn));
        }
        context.put("payloadColumn", Identifiers.quote(shape.payloadColumn()));
        return render("insertMessage", context);
    }

    /**
     * The predicate shared by a page query and its count.
     */
    public BoundSql messagePredicate(SchemaShape shape, String channel, MessageQuery query) {
        Map<String, Object> context = new HashMap<>();
        context.put("channelExpr", shape.channelKey().expression());
        context.put("payloadExpr", shape.payloadExpression());
        context.put("timestampExpr", shape.timestampExpression());
        List<Object> params = new ArrayList<>();
        params.add(channel);
        if (query.eventFilter() != null) {
            context.put("eventFilter", true);
            params.add(query.eventFilter());
        }
        if (query.startDate() != null) {
            context.put("startDate", true);
            params.add(query.startDate());
        }
        if (query.endDate() != null) {
            context.put("endDate", true);
            params.add(query.endDate());
        }
        return new BoundSql(render("messagePredicate", context), params);
    }

    public BoundSql selectMessages(StoreDescriptor store, SchemaShape shape, String channel, MessageQuery query) {
        BoundSql predicate = messagePredicate(shape, channel, query);
        Map<String, Object> context = shapeContext(store, shape);
        context.put("predicate", predicate.sql());
        context.put("orderColumn", orderColumn(shape, query.orderBy()));
        context.put("direction", query.direction().name());
        List<Object> params = new ArrayList<>(predicate.params());
        params.add(query.limit());
        params.add(query.offset());
        return new BoundSql(render("selectMessages", context), params);
    }

    public BoundSql countMessages(StoreDescriptor store, SchemaShape shape, String channel, MessageQuery query) {
        BoundSql predicate = messagePredicate(shape, channel, query);
        Map<String, Object> context = shapeContext(store, shape);
        context.put("predicate", predicate.sql());
        return new BoundSql(render("countMessages", context), predicate.params());
    }

    private static String orderColumn(SchemaShape shape, MessageQuery.OrderBy orderBy) {
        if (orderBy == MessageQuery.OrderBy.CREATED_AT && shape.hasTimestamp()) {
            return Identifiers.quote(SchemaShape.TIMESTAMP_COLUMN);
        }
        return Identifiers.quote(SchemaShape.ID_COLUMN);
    }

    public String purgeMessages(StoreDescriptor store, SchemaShape shape) {
        return render("purgeMessages", shapeContext(store, shape));
    }

    public String messageExists(StoreDescriptor store, SchemaShape shape) {
        return render("messageExists", shapeContext(store, shape));
    }

    // channels view

    public String createChannelsView(StoreDescriptor store, SchemaShape shape) {
        Map<String, Object> context = shapeContext(store, shape);
        context.put("view", store.qualifiedView());
        return render("createChannelsView", context);
    }

    public String createCustomView(StoreDescriptor store, String definition) {
        return render("createCustomView", Map.of("view", store.qualifiedView(), "definition", definition));
    }

    public String dropView(StoreDescriptor store) {
        return render("dropView", Map.of("view", store.qualifiedView()));
    }

    public String findChannel(StoreDescriptor store) {
        return render("findChannel", Map.of("view", store.qualifiedView()));
    }

    public String listChannels(StoreDescriptor store) {
        return render("listChannels", Map.of("view", store.qualifiedView()));
    }

    // policies

    public String createPolicy(StoreDescriptor store, PolicySpec spec) {
        Map<String, Object> context = new HashMap<>();
        context.put("name", Identifiers.quote(spec.name()));
        context.put("table", store.qualifiedTable());
        context.put("restrictive", spec.mode() == PolicyMode.RESTRICTIVE);
        context.put("command", spec.command().name());
        context.put("roles", spec.roles().isEmpty()
                ? "PUBLIC"
                : spec.roles().stream().map(Identifiers::role).collect(Collectors.joining(", ")));
        context.put("using", spec.usingExpr());
        context.put("check", spec.checkExpr());
        return render("createPolicy", context);
    }

    public String dropPolicy(StoreDescriptor store, String name) {
        return render("dropPolicy", Map.of("name", Identifiers.quote(name), "table", store.qualifiedTable()));
    }

    public String renamePolicy(StoreDescriptor store, String name, String newName) {
        return render("renamePolicy", Map.of(
                "name", Identifiers.quote(name),
                "table", store.qualifiedTable(),
                "newName", Identifiers.quote(newName)));
    }

    // triggers

    public String notifyFunction(String function, String channel) {
        return render("notifyFunction", Map.of(
                "function", function,
                "channel", Identifiers.literal(channel),
                "limit", NOTIFY_PAYLOAD_LIMIT,
                "payloadColumns", PAYLOAD_COLUMNS.stream().map(Identifiers::literal).collect(Collectors.toList())));
    }

    public String dropFunction(String function) {
        return render("dropFunction", Map.of("function", function));
    }

    public String dropTrigger(String trigger, String table) {
        return render("dropTrigger", Map.of("trigger", Identifiers.quote(trigger), "table", table));
    }

    /**
     * @param when optional row condition, {@code null} to fire for every row
     */
    public String createTrigger(String trigger, SubscriptionEvent event, String table, String function, String when) {
        Map<String, Object> context = new HashMap<>();
        context.put("trigger", Identifiers.quote(trigger));
        context.put("event", event.name());
        context.put("table", table);
        context.put("function", function);
        context.put("when", when);
        return render("createTrigger", context);
    }
}
