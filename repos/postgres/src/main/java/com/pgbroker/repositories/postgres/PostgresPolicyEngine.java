package com.pgbroker.repositories.postgres;

import com.pgbroker.core.BrokerException;
import com.pgbroker.core.Policy;
import com.pgbroker.core.PolicyCommand;
import com.pgbroker.core.PolicyEngine;
import com.pgbroker.core.PolicyFilter;
import com.pgbroker.core.PolicyMode;
import com.pgbroker.core.PolicyPage;
import com.pgbroker.core.PolicyPatch;
import com.pgbroker.core.PolicySpec;
import com.pgbroker.core.QueryExecutor;
import com.pgbroker.core.Rows;
import com.pgbroker.core.StoreDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Row level security policies on the message log, read back from {@code pg_policy}.
 */
public class PostgresPolicyEngine implements PolicyEngine {
    private static final Logger logger = LoggerFactory.getLogger(PostgresPolicyEngine.class);

    private final QueryExecutor executor;
    private final RealtimeSql sql;
    private final StoreDescriptor store;

    public PostgresPolicyEngine(QueryExecutor executor, RealtimeSql sql, StoreDescriptor store) {
        this.executor = executor;
        this.sql = sql;
        this.store = store;
    }

    @Override
    public PolicyPage list(PolicyFilter filter) {
        PolicyFilter f = filter == null ? PolicyFilter.all() : filter;
        requireTable();
        String pattern = f.hasPattern() ? f.namePattern() : null;
        List<Policy> policies = executor.query(PostgresQueries.POLICIES,
                        store.schema(), store.table(), pattern, pattern, f.limit(), f.offset())
                .stream()
                .map(PostgresPolicyEngine::toPolicy)
                .toList();
        long total = Rows.count(executor.query(PostgresQueries.POLICY_COUNT,
                store.schema(), store.table(), pattern, pattern));
        return new PolicyPage(policies, total, f.limit(), f.offset());
    }

    @Override
    public Policy create(PolicySpec spec) {
        requireTable();
        if (find(executor, spec.name()).isPresent()) {
            throw BrokerException.precondition("Policy '" + spec.name() + "' already exists on " + store.displayName());
        }
        executor.execute(sql.createPolicy(store, spec));
        logger.info("Created policy {} on {}", spec.name(), store.displayName());
        return readBack(executor, spec.name());
    }

    @Override
    public Policy update(String name, PolicyPatch patch) {
        requireName(name);
        if (!patch.recreate() && (patch.newName() == null || patch.newName().isBlank())) {
            throw BrokerException.validation("Without recreate only a rename is possible; newName is required");
        }
        requireTable();
        Policy existing = find(executor, name)
                .orElseThrow(() -> BrokerException.notFound("Policy '" + name + "' not found on " + store.displayName()));
        boolean renaming = patch.newName() != null && !patch.newName().equals(name);
        if (renaming && find(executor, patch.newName()).isPresent()) {
            throw BrokerException.precondition("Policy '" + patch.newName() + "' already exists on " + store.displayName());
        }

        if (!patch.recreate()) {
            executor.execute(sql.renamePolicy(store, name, patch.newName()));
            logger.info("Renamed policy {} to {}", name, patch.newName());
            return readBack(executor, patch.newName());
        }

        PolicySpec replacement = patch.applyTo(existing);
        Policy updated = executor.inTransaction(tx -> {
            tx.execute(sql.dropPolicy(store, name));
            tx.execute(sql.createPolicy(store, replacement));
            return readBack(tx, replacement.name());
        });
        logger.info("Recreated policy {} as {}", name, replacement.name());
        return updated;
    }

    @Override
    public Optional<Policy> delete(String name, boolean ifExists) {
        requireName(name);
        requireTable();
        Optional<Policy> existing = find(executor, name);
        if (existing.isEmpty()) {
            if (ifExists) {
                return Optional.empty();
            }
            throw BrokerException.notFound("Policy '" + name + "' not found on " + store.displayName());
        }
        executor.execute(sql.dropPolicy(store, name));
        logger.info("Dropped policy {} on {}", name, store.displayName());
        return existing;
    }

    private Optional<Policy> find(QueryExecutor q, String name) {
        return q.query(PostgresQueries.POLICY_BY_NAME, store.schema(), store.table(), name)
                .stream()
                .findFirst()
                .map(PostgresPolicyEngine::toPolicy);
    }

    private Policy readBack(QueryExecutor q, String name) {
        return find(q, name)
                .orElseThrow(() -> BrokerException.notFound("Policy '" + name + "' vanished after being written"));
    }

    private void requireTable() {
        List<Map<String, Object>> rows = executor.query(PostgresQueries.TABLE_EXISTS, store.schema(), store.table());
        if (rows.isEmpty() || !Rows.bool(rows.get(0), "present")) {
            throw BrokerException.precondition("Table " + store.displayName() + " does not exist; enable realtime first");
        }
    }

    private static void requireName(String name) {
        if (name == null || name.isBlank()) {
            throw BrokerException.validation("policy name is required");
        }
    }

    static Policy toPolicy(Map<String, Object> row) {
        return new Policy(
                Rows.string(row, "name"),
                Rows.string(row, "schema_name"),
                Rows.string(row, "table_name"),
                PolicyCommand.fromCatalogCode(Rows.string(row, "command")),
                Rows.strings(row, "roles"),
                Rows.bool(row, "permissive") ? PolicyMode.PERMISSIVE : PolicyMode.RESTRICTIVE,
                Rows.string(row, "using_expr"),
                Rows.string(row, "check_expr"));
    }
}
