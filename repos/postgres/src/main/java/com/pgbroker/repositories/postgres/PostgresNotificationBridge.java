package com.pgbroker.repositories.postgres;

import com.fasterxml.uuid.Generators;
import com.fasterxml.uuid.impl.TimeBasedGenerator;
import com.pgbroker.core.BrokerException;
import com.pgbroker.core.DedicatedConnection;
import com.pgbroker.core.DedicatedConnectionFactory;
import com.pgbroker.core.Identifiers;
import com.pgbroker.core.NotificationBridge;
import com.pgbroker.core.NotificationDispatcher;
import com.pgbroker.core.QueryExecutor;
import com.pgbroker.core.RealtimeListener;
import com.pgbroker.core.Rows;
import com.pgbroker.core.SchemaShape;
import com.pgbroker.core.StoreDescriptor;
import com.pgbroker.core.Subscription;
import com.pgbroker.core.SubscriptionEvent;
import com.pgbroker.core.SubscriptionRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Subscriptions over row triggers and one shared {@code LISTEN} connection.
 * <p>
 * Subscribing listens on the channel, then installs a notify function and an
 * AFTER trigger per channel and event; a failed install stops listening again
 * unless other subscriptions still need the channel. Unsubscribing removes them
 * all. The dedicated connection is opened with the first listened channel and
 * released with the last.
 */
public class PostgresNotificationBridge implements NotificationBridge {
    private static final Logger logger = LoggerFactory.getLogger(PostgresNotificationBridge.class);
    private static final String DEFAULT_SCHEMA = "public";

    private final QueryExecutor executor;
    private final SchemaAdapter adapter;
    private final RealtimeSql sql;
    private final StoreDescriptor store;
    private final SubscriptionRegistry registry;
    private final DedicatedConnectionFactory connections;
    private final NotificationDispatcher dispatcher;
    private final Clock clock;
    private final TimeBasedGenerator ids = Generators.timeBasedGenerator();

    private final Object lock = new Object();
    private final Set<String> listening = new HashSet<>();
    private DedicatedConnection connection;

    public PostgresNotificationBridge(QueryExecutor executor,
                                      SchemaAdapter adapter,
                                      RealtimeSql sql,
                                      StoreDescriptor store,
                                      SubscriptionRegistry registry,
                                      DedicatedConnectionFactory connections,
                                      NotificationDispatcher dispatcher,
                                      Clock clock) {
        this.executor = executor;
        this.adapter = adapter;
        this.sql = sql;
        this.store = store;
        this.registry = registry;
        this.connections = connections;
        this.dispatcher = dispatcher;
        this.clock = clock;
    }

    @Override
    public Subscription subscribe(String channel,
                                  SubscriptionEvent event,
                                  Map<String, Object> filter,
                                  RealtimeListener listener,
                                  String table) {
        if (channel == null || channel.isBlank()) {
            throw BrokerException.validation("channel is required");
        }
        if (event == null) {
            throw BrokerException.validation("event is required");
        }
        if (listener == null) {
            throw BrokerException.validation("listener is required");
        }

        String schema;
        String relation;
        String when = null;
        if (table == null || table.isBlank()) {
            schema = store.schema();
            relation = store.table();
            requireTable(schema, relation);
            SchemaShape shape = adapter.detect(store);
            String row = event == SubscriptionEvent.DELETE ? "OLD" : "NEW";
            when = shape.channelKey().expression(row) + " = " + Identifiers.literal(channel);
        } else {
            int dot = table.indexOf('.');
            schema = dot < 0 ? DEFAULT_SCHEMA : table.substring(0, dot);
            relation = dot < 0 ? table : table.substring(dot + 1);
            requireTable(schema, relation);
        }

        String qualifiedTable = Identifiers.quote(schema) + "." + Identifiers.quote(relation);
        String stem = Identifiers.objectName(channel);
        String function = Identifiers.quote(schema) + "." + Identifiers.quote("realtime_" + stem + "_notify");
        String trigger = "realtime_" + stem + "_" + event.slug() + "_trigger";
        String condition = when;

        listen(channel);
        try {
            executor.inTransaction(tx -> {
                tx.execute(sql.notifyFunction(function, channel));
                tx.execute(sql.dropTrigger(trigger, qualifiedTable));
                tx.execute(sql.createTrigger(trigger, event, qualifiedTable, function, condition));
                return null;
            });
        } catch (RuntimeException e) {
            if (registry.forChannel(channel).isEmpty()) {
                unlisten(channel);
            }
            throw e;
        }

        Subscription subscription = new Subscription(
                channel + ":" + event.name() + ":" + ids.generate(),
                channel,
                event,
                filter,
                schema + "." + relation,
                trigger,
                function,
                clock.instant(),
                listener);
        registry.add(subscription);
        logger.info("Subscribed {} to {} on {}", subscription.id(), event, subscription.table());
        return subscription;
    }

    private void requireTable(String schema, String relation) {
        List<Map<String, Object>> rows = executor.query(PostgresQueries.TABLE_EXISTS, schema, relation);
        if (rows.isEmpty() || !Rows.bool(rows.get(0), "present")) {
            throw BrokerException.precondition("Table " + schema + "." + relation + " does not exist");
        }
    }

    private void listen(String channel) {
        synchronized (lock) {
            if (connection == null || !connection.isOpen()) {
                if (connection != null) {
                    logger.warn("Listener connection was lost, opening a new one");
                    connection.release();
                }
                connection = connections.acquire();
                connection.onNotification(dispatcher::dispatch);
                for (String previous : listening) {
                    connection.listen(previous);
                }
            }
            if (listening.add(channel)) {
                connection.listen(channel);
            }
        }
    }

    @Override
    public int unsubscribe(String channel) {
        List<Subscription> subscriptions = registry.forChannel(channel);
        if (subscriptions.isEmpty()) {
            throw BrokerException.notFound("No subscriptions found for channel '" + channel + "'");
        }

        Set<String> functions = new LinkedHashSet<>();
        executor.inTransaction(tx -> {
            for (Subscription s : subscriptions) {
                tx.execute(sql.dropTrigger(s.triggerName(), qualify(s.table())));
                functions.add(s.functionName());
            }
            for (String function : functions) {
                tx.execute(sql.dropFunction(function));
            }
            return null;
        });

        int removed = registry.removeChannel(channel).size();
        unlisten(channel);
        logger.info("Unsubscribed {} subscriptions from channel {}", removed, channel);
        return removed;
    }

    private static String qualify(String table) {
        int dot = table.indexOf('.');
        return Identifiers.quote(table.substring(0, dot)) + "." + Identifiers.quote(table.substring(dot + 1));
    }

    private void unlisten(String channel) {
        synchronized (lock) {
            if (!listening.remove(channel) || connection == null) {
                return;
            }
            if (connection.isOpen()) {
                connection.unlisten(channel);
            }
            if (listening.isEmpty()) {
                connection.release();
                connection = null;
            }
        }
    }

    @Override
    public List<Subscription> list() {
        return registry.all();
    }

    @Override
    public void close() {
        for (String channel : registry.channels()) {
            try {
                unsubscribe(channel);
            } catch (RuntimeException e) {
                logger.error("Failed to unsubscribe channel {} during shutdown", channel, e);
            }
        }
        synchronized (lock) {
            if (connection != null) {
                connection.release();
                connection = null;
            }
            listening.clear();
        }
    }
}
