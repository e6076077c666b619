package com.pgbroker.repositories.postgres;

import com.pgbroker.core.ChannelKey;
import com.pgbroker.core.QueryExecutor;
import com.pgbroker.core.Rows;
import com.pgbroker.core.SchemaShape;
import com.pgbroker.core.StoreDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Detects the layout of the message log. The catalog is read on every call so a
 * layout change made by someone else is picked up by the next operation.
 */
public class SchemaAdapter {
    private static final Logger logger = LoggerFactory.getLogger(SchemaAdapter.class);

    private final QueryExecutor executor;

    public SchemaAdapter(QueryExecutor executor) {
        this.executor = executor;
    }

    public SchemaShape detect(StoreDescriptor store) {
        return detect(executor, store);
    }

    /**
     * Detects through {@code executor}, so a caller inside a transaction sees its
     * own uncommitted DDL.
     */
    public SchemaShape detect(QueryExecutor executor, StoreDescriptor store) {
        List<String> columns = executor.query(PostgresQueries.COLUMNS, store.schema(), store.table())
                .stream()
                .map(row -> Rows.string(row, "column_name"))
                .toList();
        SchemaShape shape = SchemaShape.fromColumns(columns);
        if (shape.degraded() && !columns.isEmpty()) {
            logger.warn("{} has no channel or payload column, treating every message as channel '{}'",
                    store.displayName(), ChannelKey.DEFAULT_CHANNEL);
        }
        logger.debug("Detected shape of {}: {}", store.displayName(), shape.describe());
        return shape;
    }
}
