package com.pgbroker.repositories.postgres;

import com.pgbroker.core.BrokerException;
import com.pgbroker.core.Channel;
import com.pgbroker.core.ChannelRegistry;
import com.pgbroker.core.QueryExecutor;
import com.pgbroker.core.Rows;
import com.pgbroker.core.SchemaShape;
import com.pgbroker.core.StoreDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Channel registry backed by a view that groups the message log by channel key.
 * The view has fixed column types so it can be replaced in place whenever the
 * log's layout changes.
 */
public class PostgresChannelRegistry implements ChannelRegistry {
    private static final Logger logger = LoggerFactory.getLogger(PostgresChannelRegistry.class);

    private final QueryExecutor executor;
    private final SchemaAdapter adapter;
    private final RealtimeSql sql;
    private final StoreDescriptor store;

    public PostgresChannelRegistry(QueryExecutor executor, SchemaAdapter adapter, RealtimeSql sql, StoreDescriptor store) {
        this.executor = executor;
        this.adapter = adapter;
        this.sql = sql;
        this.store = store;
    }

    @Override
    public void createOrUpdateView() {
        executor.inTransaction(tx -> {
            createOrUpdateView(tx, adapter.detect(tx, store));
            return null;
        });
    }

    /**
     * Regenerates the view on {@code tx} from {@code shape}. An incompatible existing
     * view is dropped and recreated.
     */
    void createOrUpdateView(QueryExecutor tx, SchemaShape shape) {
        replaceView(tx, sql.createChannelsView(store, shape));
        logger.info("Channel view {} now groups by {}", store.view(), shape.channelKey().describe());
    }

    @Override
    public void createOrUpdateView(String definition) {
        if (definition == null || definition.isBlank()) {
            throw BrokerException.validation("view definition is required");
        }
        String head = definition.stripLeading().toUpperCase(Locale.ROOT);
        if (!head.startsWith("SELECT") && !head.startsWith("WITH")) {
            throw BrokerException.validation("view definition must be a SELECT query");
        }
        executor.inTransaction(tx -> {
            replaceView(tx, sql.createCustomView(store, definition.strip()));
            return null;
        });
        logger.info("Channel view {} replaced with a custom definition", store.view());
    }

    private void replaceView(QueryExecutor tx, String createSql) {
        if (!tx.attempt("realtime_view", createSql)) {
            tx.execute(sql.dropView(store));
            tx.execute(createSql);
        }
    }

    @Override
    public boolean viewExists() {
        List<Map<String, Object>> rows = executor.query(PostgresQueries.VIEW_EXISTS, store.schema(), store.view());
        return !rows.isEmpty() && Rows.bool(rows.get(0), "present");
    }

    @Override
    public boolean dropView() {
        if (!viewExists()) {
            return false;
        }
        executor.execute(sql.dropView(store));
        logger.info("Dropped channel view {}", store.view());
        return true;
    }

    @Override
    public Optional<Channel> find(String channelId) {
        requireView();
        return executor.query(sql.findChannel(store), channelId)
                .stream()
                .findFirst()
                .map(PostgresChannelRegistry::toChannel);
    }

    @Override
    public List<Channel> list(String nameFilter, int limit, int offset) {
        if (limit < 1) {
            throw BrokerException.validation("limit must be positive");
        }
        if (offset < 0) {
            throw BrokerException.validation("offset must not be negative");
        }
        requireView();
        String pattern = nameFilter == null || nameFilter.isBlank() ? null : nameFilter;
        return executor.query(sql.listChannels(store), pattern, pattern, limit, offset)
                .stream()
                .map(PostgresChannelRegistry::toChannel)
                .toList();
    }

    private void requireView() {
        if (!viewExists()) {
            throw BrokerException.precondition("Realtime is not enabled: view " + store.schema() + "." + store.view() + " does not exist");
        }
    }

    static Channel toChannel(Map<String, Object> row) {
        String type = Rows.string(row, "type");
        return new Channel(
                Rows.string(row, "id"),
                Rows.string(row, "name"),
                type == null ? Channel.STANDARD : type,
                Rows.instant(row, "created_at"),
                Rows.instant(row, "updated_at"),
                Rows.longValue(row, "broadcast_count"));
    }
}
