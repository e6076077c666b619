package com.pgbroker.repositories.postgres;

import com.pgbroker.core.DedicatedConnection;
import com.pgbroker.core.Identifiers;
import com.pgbroker.core.Notification;
import org.postgresql.PGConnection;
import org.postgresql.PGNotification;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.function.Consumer;

/**
 * A connection held outside the pool for {@code LISTEN}. One daemon thread polls
 * the driver for notifications and pushes them to the handler. Losing the
 * connection ends the thread; the owner decides whether to acquire a new one.
 */
public class PgDedicatedConnection implements DedicatedConnection {
    private static final Logger logger = LoggerFactory.getLogger(PgDedicatedConnection.class);

    private final Connection connection;
    private final PGConnection pgConnection;
    private final int pollIntervalMillis;
    private final Thread consumer;
    private volatile Consumer<Notification> handler = n -> { };
    private volatile boolean running = true;

    public PgDedicatedConnection(Connection connection, long pollIntervalMillis) throws SQLException {
        this.connection = connection;
        this.pgConnection = connection.unwrap(PGConnection.class);
        this.pollIntervalMillis = (int) Math.max(1, pollIntervalMillis);
        this.consumer = new Thread(this::poll, "pgbroker-listener");
        this.consumer.setDaemon(true);
        this.consumer.start();
    }

    private void poll() {
        logger.debug("Listener thread started");
        while (running) {
            PGNotification[] notifications;
            try {
                notifications = pgConnection.getNotifications(pollIntervalMillis);
            } catch (SQLException e) {
                if (running) {
                    logger.error("Listener connection lost, subscriptions will not receive events until re-subscribed", e);
                    running = false;
                }
                break;
            }
            if (notifications == null) {
                continue;
            }
            for (PGNotification n : notifications) {
                try {
                    handler.accept(new Notification(n.getName(), n.getParameter(), n.getPID()));
                } catch (RuntimeException e) {
                    logger.error("Notification handler failed for channel {}", n.getName(), e);
                }
            }
        }
        logger.debug("Listener thread stopped");
    }

    @Override
    public void listen(String channel) {
        run("LISTEN " + Identifiers.quote(channel));
        logger.info("Listening on channel {}", channel);
    }

    @Override
    public void unlisten(String channel) {
        run("UNLISTEN " + Identifiers.quote(channel));
        logger.info("Stopped listening on channel {}", channel);
    }

    private void run(String sql) {
        try (Statement stmt = connection.createStatement()) {
            stmt.execute(sql);
        } catch (SQLException e) {
            throw JdbcQueryExecutor.backend(e);
        }
    }

    @Override
    public void onNotification(Consumer<Notification> handler) {
        this.handler = handler;
    }

    @Override
    public boolean isOpen() {
        return running && consumer.isAlive();
    }

    @Override
    public void release() {
        running = false;
        try {
            consumer.join(pollIntervalMillis * 2L);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        try {
            connection.close();
        } catch (SQLException e) {
            logger.warn("Failed to close listener connection: {}", e.getMessage());
        }
        logger.info("Released listener connection");
    }
}
