package com.pgbroker.repositories.postgres;

import com.pgbroker.core.BrokerException;
import com.pgbroker.core.Message;
import com.pgbroker.core.MessagePage;
import com.pgbroker.core.MessageQuery;
import com.pgbroker.core.MessageStore;
import com.pgbroker.core.QueryExecutor;
import com.pgbroker.core.Rows;
import com.pgbroker.core.SchemaShape;
import com.pgbroker.core.StoreDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.pgbroker.repositories.postgres.Converters.toJson;

public class PostgresMessageStore implements MessageStore {
    private static final Logger logger = LoggerFactory.getLogger(PostgresMessageStore.class);

    private final QueryExecutor executor;
    private final SchemaAdapter adapter;
    private final RealtimeSql sql;
    private final StoreDescriptor store;

    public PostgresMessageStore(QueryExecutor executor, SchemaAdapter adapter, RealtimeSql sql, StoreDescriptor store) {
        this.executor = executor;
        this.adapter = adapter;
        this.sql = sql;
        this.store = store;
    }

    @Override
    public Message publish(String channel, Map<String, Object> payload, String event) {
        requireChannel(channel);
        SchemaShape shape = adapter.detect(store);
        if (!shape.hasPayload()) {
            throw BrokerException.precondition(store.displayName() + " has no payload column (" + shape.describe() + ")");
        }

        Map<String, Object> body = new LinkedHashMap<>();
        if (payload != null) {
            body.putAll(payload);
        }
        if (event != null) {
            body.put(Message.EVENT_KEY, event);
        }
        if (shape.channelKey().embedded()) {
            body.put(Message.CHANNEL_KEY, channel);
        }

        String insert = sql.insertMessage(store, shape);
        List<Map<String, Object>> rows = shape.channelKey().keyColumn() != null
                ? executor.query(insert, channel, toJson(body))
                : executor.query(insert, toJson(body));
        Message message = toMessage(rows.get(0));
        logger.debug("Published message {} to channel {}", message.id(), message.channel());
        return message;
    }

    @Override
    public MessagePage list(String channel, MessageQuery query) {
        requireChannel(channel);
        MessageQuery q = query == null ? MessageQuery.defaults() : query;
        SchemaShape shape = adapter.detect(store);
        if (q.eventFilter() != null && !shape.hasPayload()) {
            throw BrokerException.validation("eventFilter needs a payload column; " + store.displayName() + " has none");
        }
        if ((q.startDate() != null || q.endDate() != null) && !shape.hasTimestamp()) {
            throw BrokerException.validation("date filters need a created_at column; " + store.displayName() + " has none");
        }

        BoundSql page = sql.selectMessages(store, shape, channel, q);
        BoundSql count = sql.countMessages(store, shape, channel, q);
        List<Message> messages = executor.query(page.sql(), page.paramArray())
                .stream()
                .map(PostgresMessageStore::toMessage)
                .toList();
        long total = Rows.count(executor.query(count.sql(), count.paramArray()));
        return new MessagePage(messages, total, q.limit(), q.offset());
    }

    @Override
    public long purge(String channel) {
        requireChannel(channel);
        SchemaShape shape = adapter.detect(store);
        int deleted = executor.update(sql.purgeMessages(store, shape), channel);
        logger.info("Purged {} messages from channel {}", deleted, channel);
        return deleted;
    }

    @Override
    public boolean exists(String channel) {
        requireChannel(channel);
        SchemaShape shape = adapter.detect(store);
        List<Map<String, Object>> rows = executor.query(sql.messageExists(store, shape), channel);
        return !rows.isEmpty() && Rows.bool(rows.get(0), "present");
    }

    static Message toMessage(Map<String, Object> row) {
        return new Message(
                Rows.string(row, "id"),
                Rows.string(row, "channel"),
                Rows.json(row, "payload"),
                Rows.instant(row, "created_at"));
    }

    private static void requireChannel(String channel) {
        if (channel == null || channel.isBlank()) {
            throw BrokerException.validation("channel is required");
        }
    }
}
