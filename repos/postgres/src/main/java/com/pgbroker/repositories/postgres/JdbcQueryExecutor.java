package com.pgbroker.repositories.postgres;

import com.pgbroker.core.BrokerException;
import com.pgbroker.core.ErrorKind;
import com.pgbroker.core.QueryExecutor;
import com.pgbroker.core.TransactionWork;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * {@link QueryExecutor} over a pooled DataSource. Each call borrows a connection;
 * {@link #inTransaction} hands the work an executor bound to one connection.
 */
public class JdbcQueryExecutor implements QueryExecutor {
    private static final Logger logger = LoggerFactory.getLogger(JdbcQueryExecutor.class);

    /** Kinds that describe the caller's request rather than the transaction, rethrown as is. */
    private static final Set<ErrorKind> PASS_THROUGH = EnumSet.of(ErrorKind.PRECONDITION, ErrorKind.NOT_FOUND, ErrorKind.VALIDATION);

    private final DataSource dataSource;

    public JdbcQueryExecutor(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public List<Map<String, Object>> query(String sql, Object... params) {
        try (Connection conn = dataSource.getConnection()) {
            return new ConnectionQueryExecutor(conn).query(sql, params);
        } catch (SQLException e) {
            throw backend(e);
        }
    }

    @Override
    public int update(String sql, Object... params) {
        try (Connection conn = dataSource.getConnection()) {
            return new ConnectionQueryExecutor(conn).update(sql, params);
        } catch (SQLException e) {
            throw backend(e);
        }
    }

    @Override
    public void execute(String sql) {
        try (Connection conn = dataSource.getConnection()) {
            new ConnectionQueryExecutor(conn).execute(sql);
        } catch (SQLException e) {
            throw backend(e);
        }
    }

    @Override
    public <T> T inTransaction(TransactionWork<T> work) {
        Connection conn = null;
        try {
            conn = dataSource.getConnection();
            conn.setAutoCommit(false);
            T result = work.apply(new ConnectionQueryExecutor(conn));
            conn.commit();
            return result;
        } catch (SQLException e) {
            rollback(conn);
            throw new BrokerException(ErrorKind.TRANSACTION, "Transaction failed and was rolled back: " + e.getMessage(), e);
        } catch (BrokerException e) {
            rollback(conn);
            if (PASS_THROUGH.contains(e.kind())) {
                throw e;
            }
            throw new BrokerException(ErrorKind.TRANSACTION, "Transaction failed and was rolled back: " + e.getMessage(), e);
        } catch (RuntimeException e) {
            rollback(conn);
            throw new BrokerException(ErrorKind.TRANSACTION, "Transaction failed and was rolled back: " + e.getMessage(), e);
        } finally {
            if (conn != null) {
                try {
                    conn.setAutoCommit(true);
                    conn.close();
                } catch (SQLException closeException) {
                    logger.error("Failed to close connection", closeException);
                }
            }
        }
    }

    @Override
    public boolean attempt(String savepoint, String sql) {
        try {
            execute(sql);
            return true;
        } catch (BrokerException e) {
            logger.warn("Optional step {} failed: {}", savepoint, e.getMessage());
            return false;
        }
    }

    private static void rollback(Connection conn) {
        if (conn == null) {
            return;
        }
        try {
            conn.rollback();
        } catch (SQLException rollbackException) {
            logger.error("Failed to rollback transaction", rollbackException);
        }
    }

    static BrokerException backend(SQLException e) {
        return new BrokerException(ErrorKind.BACKEND, e.getMessage(), e);
    }
}
