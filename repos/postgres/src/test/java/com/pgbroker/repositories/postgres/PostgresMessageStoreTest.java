package com.pgbroker.repositories.postgres;

import com.pgbroker.core.BrokerException;
import com.pgbroker.core.ErrorKind;
import com.pgbroker.core.Message;
import com.pgbroker.core.MessagePage;
import com.pgbroker.core.MessageQuery;
import com.pgbroker.core.QueryExecutor;
import com.pgbroker.core.StoreDescriptor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.startsWith;
import static org.mockito.Mockito.*;

class PostgresMessageStoreTest {
    private static final Instant T = Instant.parse("2024-04-04T04:04:04Z");

    private QueryExecutor executor;
    private PostgresMessageStore store;

    @BeforeEach
    void setUp() {
        executor = mock(QueryExecutor.class);
        StoreDescriptor descriptor = StoreDescriptor.defaults();
        store = new PostgresMessageStore(executor, new SchemaAdapter(executor), new RealtimeSql(), descriptor);
    }

    private void layout(String... columns) {
        when(executor.query(PostgresQueries.COLUMNS, "realtime", "messages"))
                .thenReturn(java.util.Arrays.stream(columns).map(c -> Map.<String, Object>of("column_name", c)).toList());
    }

    private static Map<String, Object> row(String id, String channel, Map<String, Object> payload) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("id", id);
        row.put("channel", channel);
        row.put("payload", payload);
        row.put("created_at", T);
        return row;
    }

    @Test
    void publishBindsTheKeyColumnAndMergesTheEvent() {
        layout("id", "channel_id", "message", "created_at");
        when(executor.query(startsWith("INSERT INTO"), eq("room"), anyString()))
                .thenReturn(List.of(row("m1", "room", Map.of("text", "hi", "event", "chat"))));

        Message message = store.publish("room", Map.of("text", "hi"), "chat");

        assertEquals("m1", message.id());
        assertEquals("chat", message.event());
        assertEquals(T, message.createdAt());
        verify(executor).query(startsWith("INSERT INTO"), eq("room"), eq("{\"text\":\"hi\",\"event\":\"chat\"}"));
    }

    @Test
    void publishEmbedsTheChannelForTheJsonPathShape() {
        layout("id", "payload", "created_at");
        when(executor.query(startsWith("INSERT INTO"), anyString()))
                .thenReturn(List.of(row("m1", "room", Map.of("channel", "room"))));

        store.publish("room", Map.of(), null);

        verify(executor).query(startsWith("INSERT INTO"), eq("{\"channel\":\"room\"}"));
    }

    @Test
    void publishWithoutAPayloadColumnIsAPrecondition() {
        layout("id", "channel_id");

        BrokerException e = assertThrows(BrokerException.class, () -> store.publish("room", Map.of(), null));

        assertEquals(ErrorKind.PRECONDITION, e.kind());
    }

    @Test
    void eventFilterNeedsAPayloadColumn() {
        layout("id", "channel", "created_at");

        BrokerException e = assertThrows(BrokerException.class,
                () -> store.list("room", MessageQuery.builder().eventFilter("x").build()));

        assertEquals(ErrorKind.VALIDATION, e.kind());
    }

    @Test
    void dateFiltersNeedATimestampColumn() {
        layout("id", "channel", "message");

        BrokerException e = assertThrows(BrokerException.class,
                () -> store.list("room", MessageQuery.builder().startDate(T).build()));

        assertEquals(ErrorKind.VALIDATION, e.kind());
    }

    @Test
    void emptyChannelYieldsAnEmptyPage() {
        layout("id", "channel_id", "message", "created_at");
        when(executor.query(startsWith("SELECT \"id\""), any(Object[].class))).thenReturn(List.of());
        when(executor.query(startsWith("SELECT COUNT(*)"), any(Object[].class))).thenReturn(List.of(Map.of("count", 0L)));

        MessagePage page = store.list("nobody", MessageQuery.defaults());

        assertTrue(page.messages().isEmpty());
        assertEquals(0, page.totalCount());
        assertFalse(page.hasMore());
    }

    @Test
    void purgeReturnsTheDeletedCount() {
        layout("id", "channel_id", "message", "created_at");
        when(executor.update(startsWith("DELETE FROM"), eq("room"))).thenReturn(3, 0);

        assertEquals(3, store.purge("room"));
        assertEquals(0, store.purge("room"));
    }

    @Test
    void blankChannelIsRejectedBeforeAnyQuery() {
        assertThrows(BrokerException.class, () -> store.publish(" ", Map.of(), null));
        verifyNoInteractions(executor);
    }
}
