package com.pgbroker.repositories.postgres;

import com.pgbroker.core.QueryExecutor;
import com.pgbroker.core.TransactionWork;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Savepoint;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static com.pgbroker.repositories.postgres.Converters.resultSetToRow;
import static com.pgbroker.repositories.postgres.Converters.toJdbc;
import static com.pgbroker.repositories.postgres.JdbcQueryExecutor.backend;

/**
 * {@link QueryExecutor} bound to a single connection, used inside a transaction.
 * Nested transactions join the current one.
 */
class ConnectionQueryExecutor implements QueryExecutor {
    private static final Logger logger = LoggerFactory.getLogger(ConnectionQueryExecutor.class);

    private final Connection conn;

    ConnectionQueryExecutor(Connection conn) {
        this.conn = conn;
    }

    @Override
    public List<Map<String, Object>> query(String sql, Object... params) {
        logger.debug("query: {}", sql);
        try (PreparedStatement stmt = prepare(sql, params);
             ResultSet rs = stmt.executeQuery()) {
            List<Map<String, Object>> rows = new ArrayList<>();
            while (rs.next()) {
                rows.add(resultSetToRow(rs));
            }
            return rows;
        } catch (SQLException e) {
            throw backend(e);
        }
    }

    @Override
    public int update(String sql, Object... params) {
        logger.debug("update: {}", sql);
        try (PreparedStatement stmt = prepare(sql, params)) {
            return stmt.executeUpdate();
        } catch (SQLException e) {
            throw backend(e);
        }
    }

    @Override
    public void execute(String sql) {
        logger.debug("execute: {}", sql);
        try (Statement stmt = conn.createStatement()) {
            stmt.execute(sql);
        } catch (SQLException e) {
            throw backend(e);
        }
    }

    @Override
    public <T> T inTransaction(TransactionWork<T> work) {
        return work.apply(this);
    }

    @Override
    public boolean attempt(String savepoint, String sql) {
        logger.debug("attempt {}: {}", savepoint, sql);
        Savepoint sp = null;
        try {
            if (!conn.getAutoCommit()) {
                sp = conn.setSavepoint(savepoint);
            }
            try (Statement stmt = conn.createStatement()) {
                stmt.execute(sql);
            }
            if (sp != null) {
                conn.releaseSavepoint(sp);
            }
            return true;
        } catch (SQLException e) {
            logger.warn("Optional step {} failed: {}", savepoint, e.getMessage());
            if (sp != null) {
                try {
                    conn.rollback(sp);
                } catch (SQLException rollbackException) {
                    throw backend(rollbackException);
                }
            }
            return false;
        }
    }

    private PreparedStatement prepare(String sql, Object... params) throws SQLException {
        PreparedStatement stmt = conn.prepareStatement(sql);
        try {
            if (params != null) {
                for (int i = 0; i < params.length; i++) {
                    stmt.setObject(i + 1, toJdbc(params[i]));
                }
            }
            return stmt;
        } catch (SQLException e) {
            stmt.close();
            throw e;
        }
    }
}
