package com.pgbroker.repositories.postgres;

import com.pgbroker.core.BrokerLifecycle;
import com.pgbroker.core.BrokerOptions;
import com.pgbroker.core.BrokerStatus;
import com.pgbroker.core.LifecycleResult;
import com.pgbroker.core.PolicyCommand;
import com.pgbroker.core.PolicyMode;
import com.pgbroker.core.PolicySpec;
import com.pgbroker.core.QueryExecutor;
import com.pgbroker.core.Rows;
import com.pgbroker.core.SchemaShape;
import com.pgbroker.core.StoreDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * Provisions and tears down the broker's schema, message log, view, row level
 * security and default policies.
 */
public class PostgresBrokerLifecycle implements BrokerLifecycle {
    private static final Logger logger = LoggerFactory.getLogger(PostgresBrokerLifecycle.class);

    static final String READ_POLICY = "Allow authenticated users to read messages";
    static final String INSERT_POLICY = "Allow authenticated users to insert messages";

    private final QueryExecutor executor;
    private final SchemaAdapter adapter;
    private final RealtimeSql sql;
    private final PostgresChannelRegistry channels;
    private final RealtimeConfig config;
    private final StoreDescriptor store;

    public PostgresBrokerLifecycle(QueryExecutor executor,
                                   SchemaAdapter adapter,
                                   RealtimeSql sql,
                                   PostgresChannelRegistry channels,
                                   RealtimeConfig config) {
        this.executor = executor;
        this.adapter = adapter;
        this.sql = sql;
        this.channels = channels;
        this.config = config;
        this.store = config.store();
    }

    @Override
    public BrokerStatus status() {
        return status(executor);
    }

    private BrokerStatus status(QueryExecutor q) {
        boolean schema = present(q, PostgresQueries.SCHEMA_EXISTS, store.schema());
        boolean table = schema && present(q, PostgresQueries.TABLE_EXISTS, store.schema(), store.table());
        boolean rls = table && present(q, PostgresQueries.RLS_ENABLED, store.schema(), store.table());
        boolean extension = present(q, PostgresQueries.EXTENSION_EXISTS, config.extension());
        if (!table) {
            return new BrokerStatus(schema, false, false, extension, null, null, false);
        }
        SchemaShape shape = adapter.detect(q, store);
        return new BrokerStatus(schema, true, rls, extension, null, shape.channelKey().describe(), shape.degraded());
    }

    @Override
    public LifecycleResult enable(BrokerOptions options) {
        BrokerOptions features = options == null ? BrokerOptions.defaults() : options;
        logger.info("Enabling realtime in schema {} (rls: {})", store.schema(), features.rowLevelSecurity());

        executor.inTransaction(tx -> {
            ensureExtension(tx);
            tx.execute(sql.createSchema(store));
            ensureMessagesTable(tx);
            tx.execute(sql.rowLevelSecurity(store, features.rowLevelSecurity()));
            if (features.rowLevelSecurity()) {
                ensureDefaultPolicies(tx);
            }
            if (!present(tx, PostgresQueries.VIEW_EXISTS, store.schema(), store.view())) {
                channels.createOrUpdateView(tx, adapter.detect(tx, store));
            }
            return null;
        });

        BrokerStatus status = status().withFeatures(features);
        logger.info("Realtime enabled: {}", status);
        return new LifecycleResult(status, "Realtime enabled");
    }

    private void ensureExtension(QueryExecutor tx) {
        String extension = config.extension();
        if (present(tx, PostgresQueries.EXTENSION_EXISTS, extension)) {
            return;
        }
        if (!present(tx, PostgresQueries.EXTENSION_AVAILABLE, extension)) {
            logger.info("Extension {} is not available on this server, skipping", extension);
            return;
        }
        if (!tx.attempt("realtime_extension", sql.createExtension(extension))) {
            logger.warn("Could not create extension {}, continuing without it", extension);
        }
    }

    private void ensureMessagesTable(QueryExecutor tx) {
        if (present(tx, PostgresQueries.TABLE_EXISTS, store.schema(), store.table())) {
            return;
        }
        String keyColumn = SchemaShape.PRIMARY_KEY_COLUMN;
        if (!tx.attempt("realtime_messages", sql.createMessagesTable(store, keyColumn))) {
            keyColumn = SchemaShape.ALTERNATE_KEY_COLUMN;
            logger.warn("Falling back to a {} column for {}", keyColumn, store.displayName());
            tx.execute(sql.createMessagesTable(store, keyColumn));
        }
        tx.execute(sql.createMessagesIndex(store, keyColumn));
        logger.info("Created message log {} keyed by {}", store.displayName(), keyColumn);
    }

    private void ensureDefaultPolicies(QueryExecutor tx) {
        List<Map<String, Object>> counted = tx.query(PostgresQueries.POLICY_COUNT,
                store.schema(), store.table(), null, null);
        if (Rows.count(counted) > 0) {
            return;
        }
        String role = config.authenticatedRole();
        if (!present(tx, PostgresQueries.ROLE_EXISTS, role)) {
            logger.info("Creating role {}", role);
            tx.execute(sql.createRole(role));
        }
        tx.execute(sql.createPolicy(store, new PolicySpec(
                READ_POLICY, PolicyCommand.SELECT, List.of(role), PolicyMode.PERMISSIVE, "true", null)));
        tx.execute(sql.createPolicy(store, new PolicySpec(
                INSERT_POLICY, PolicyCommand.INSERT, List.of(role), PolicyMode.PERMISSIVE, null, "true")));
        logger.info("Created default policies on {}", store.displayName());
    }

    @Override
    public LifecycleResult disable() {
        BrokerStatus before = status();
        if (!before.schemaExists() && !before.extensionExists()) {
            logger.info("Realtime already disabled");
            return new LifecycleResult(BrokerStatus.disabled(), "Realtime already disabled");
        }

        executor.inTransaction(tx -> {
            tx.execute(sql.dropSchema(store));
            if (before.extensionExists()) {
                tx.execute(sql.dropExtension(config.extension()));
            }
            return null;
        });

        logger.info("Realtime disabled, dropped schema {}", store.schema());
        return new LifecycleResult(status(), "Realtime disabled");
    }

    private static boolean present(QueryExecutor q, String query, Object... params) {
        List<Map<String, Object>> rows = q.query(query, params);
        return !rows.isEmpty() && Rows.bool(rows.get(0), "present");
    }
}
