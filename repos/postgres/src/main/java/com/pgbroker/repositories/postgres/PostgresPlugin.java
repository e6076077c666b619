package com.pgbroker.repositories.postgres;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.pgbroker.core.ChannelOperations;
import com.pgbroker.core.InMemorySubscriptionRegistry;
import com.pgbroker.core.NotificationDispatcher;
import com.pgbroker.core.RealtimeBroker;
import com.pgbroker.core.StoreDescriptor;
import com.pgbroker.core.SubscriptionRegistry;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;

import javax.sql.DataSource;
import java.time.Clock;
import java.util.HashMap;
import java.util.Map;

/**
 * PostgreSQL plugin implementation.
 * Manages connection pools and wires the broker services onto them.
 */
public class PostgresPlugin {
    private final Map<String, HikariDataSource> dataSources = new HashMap<>();
    private final ObjectMapper mapper;

    public PostgresPlugin() {
        this(Converters.OBJECT_MAPPER);
    }

    public PostgresPlugin(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public RealtimeBroker createBroker(PostgresConfig config, RealtimeConfig realtime) {
        DataSource dataSource = getOrCreateDataSource(config);
        JdbcQueryExecutor executor = new JdbcQueryExecutor(dataSource);
        StoreDescriptor store = realtime.store();
        SchemaAdapter adapter = new SchemaAdapter(executor);
        RealtimeSql sql = new RealtimeSql();

        PostgresMessageStore messages = new PostgresMessageStore(executor, adapter, sql, store);
        PostgresChannelRegistry channels = new PostgresChannelRegistry(executor, adapter, sql, store);
        PostgresBrokerLifecycle lifecycle = new PostgresBrokerLifecycle(executor, adapter, sql, channels, realtime);
        PostgresPolicyEngine policies = new PostgresPolicyEngine(executor, sql, store);

        SubscriptionRegistry registry = new InMemorySubscriptionRegistry();
        NotificationDispatcher dispatcher = new NotificationDispatcher(registry, mapper);
        PostgresNotificationBridge notifications = new PostgresNotificationBridge(
                executor, adapter, sql, store, registry,
                new PgDedicatedConnectionFactory(config, realtime.pollIntervalMillis()),
                dispatcher, Clock.systemUTC());

        return new RealtimeBroker(lifecycle, messages, channels,
                new ChannelOperations(channels, messages), notifications, policies);
    }

    public void cleanUp() {
        for (HikariDataSource dataSource : dataSources.values()) {
            dataSource.close();
        }
        dataSources.clear();
    }

    public boolean isHealthy() {
        try {
            for (HikariDataSource ds : dataSources.values()) {
                try (var conn = ds.getConnection()) {
                    if (!conn.isValid(1)) return false;
                }
            }
            return !dataSources.isEmpty();
        } catch (Exception e) {
            return false;
        }
    }

    /**
     * Gets or creates a DataSource for the given config.
     * Reuses DataSources for the same connection URL.
     */
    private DataSource getOrCreateDataSource(PostgresConfig config) {
        String key = config.uri != null ? config.uri : "default";

        return dataSources.computeIfAbsent(key, k -> {
            HikariConfig hikariConfig = new HikariConfig();
            hikariConfig.setJdbcUrl(config.uri);

            if (config.username != null) {
                hikariConfig.setUsername(config.username);
            }
            if (config.password != null) {
                hikariConfig.setPassword(config.password);
            }

            hikariConfig.setMaximumPoolSize(config.maxPoolSize);
            hikariConfig.setMinimumIdle(config.minIdle);

            return new HikariDataSource(hikariConfig);
        });
    }
}
