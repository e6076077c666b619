package com.pgbroker.core;

import java.util.List;
import java.util.Map;

/**
 * Narrow SQL seam used by every broker component. Rows come back as ordered maps
 * keyed by column label; JSON columns are decoded to maps, timestamps to
 * {@link java.time.Instant}, arrays to lists.
 */
public interface QueryExecutor {

    List<Map<String, Object>> query(String sql, Object... params);

    int update(String sql, Object... params);

    void execute(String sql);

    /**
     * Runs {@code work} on one connection inside a transaction. Commits when the
     * work returns, rolls back when it throws.
     */
    <T> T inTransaction(TransactionWork<T> work);

    /**
     * Runs a statement that is allowed to fail. Inside a transaction the statement
     * is isolated by a savepoint so a failure leaves the transaction usable.
     *
     * @return whether the statement succeeded
     */
    boolean attempt(String savepoint, String sql);
}
