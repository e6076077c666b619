package com.pgbroker.repositories.postgres;

import com.pgbroker.core.BrokerException;
import com.pgbroker.core.DedicatedConnection;
import com.pgbroker.core.DedicatedConnectionFactory;
import com.pgbroker.core.ErrorKind;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;

/**
 * Opens listener connections straight from the driver so they never occupy a
 * pool slot.
 */
public class PgDedicatedConnectionFactory implements DedicatedConnectionFactory {
    private final PostgresConfig config;
    private final long pollIntervalMillis;

    public PgDedicatedConnectionFactory(PostgresConfig config, long pollIntervalMillis) {
        this.config = config;
        this.pollIntervalMillis = pollIntervalMillis;
    }

    @Override
    public DedicatedConnection acquire() {
        try {
            Connection conn = config.username != null
                    ? DriverManager.getConnection(config.uri, config.username, config.password)
                    : DriverManager.getConnection(config.uri);
            return new PgDedicatedConnection(conn, pollIntervalMillis);
        } catch (SQLException e) {
            throw new BrokerException(ErrorKind.BACKEND, "Could not open listener connection: " + e.getMessage(), e);
        }
    }
}
