package com.pgbroker.repositories.postgres;

import com.pgbroker.core.BrokerException;
import com.pgbroker.core.BrokerOptions;
import com.pgbroker.core.Channel;
import com.pgbroker.core.ChannelResult;
import com.pgbroker.core.ErrorKind;
import com.pgbroker.core.LifecycleResult;
import com.pgbroker.core.Message;
import com.pgbroker.core.MessagePage;
import com.pgbroker.core.MessageQuery;
import com.pgbroker.core.Policy;
import com.pgbroker.core.PolicyCommand;
import com.pgbroker.core.PolicyFilter;
import com.pgbroker.core.PolicyMode;
import com.pgbroker.core.PolicyPatch;
import com.pgbroker.core.PolicySpec;
import com.pgbroker.core.RealtimeBroker;
import com.pgbroker.core.RealtimeEvent;
import com.pgbroker.core.SubscriptionEvent;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.MethodOrderer;
import org.junit.jupiter.api.Order;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;
import org.junit.jupiter.api.TestMethodOrder;
import org.junit.jupiter.api.condition.EnabledIfEnvironmentVariable;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.Statement;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@Testcontainers
@EnabledIfEnvironmentVariable(named = "TESTCONTAINERS", matches = "1")
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
@TestMethodOrder(MethodOrderer.OrderAnnotation.class)
class PostgresRealtimeIntegrationTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16")
            .withDatabaseName("realtime_db")
            .withUsername("test")
            .withPassword("test");

    private PostgresPlugin plugin;
    private PostgresConfig config;
    private RealtimeBroker broker;

    @BeforeAll
    void setUp() {
        config = new PostgresConfig();
        config.uri = postgres.getJdbcUrl();
        config.username = postgres.getUsername();
        config.password = postgres.getPassword();
        plugin = new PostgresPlugin();
        broker = plugin.createBroker(config, RealtimeConfig.builder().pollIntervalMillis(100).build());
    }

    @AfterAll
    void tearDown() {
        broker.close();
        plugin.cleanUp();
        assertFalse(plugin.isHealthy());
    }

    private void sql(String... statements) throws Exception {
        try (Connection conn = DriverManager.getConnection(postgres.getJdbcUrl(), postgres.getUsername(), postgres.getPassword());
             Statement stmt = conn.createStatement()) {
            for (String s : statements) {
                stmt.execute(s);
            }
        }
    }

    @Test
    @Order(1)
    void enableProvisionsTheStoreAndIsIdempotent() {
        assertFalse(broker.lifecycle().status().enabled());

        LifecycleResult first = broker.lifecycle().enable(new BrokerOptions(true, false, true));
        LifecycleResult second = broker.lifecycle().enable(new BrokerOptions(true, false, true));

        assertTrue(first.status().enabled());
        assertTrue(second.status().enabled());
        assertEquals(first.status(), second.status());
        assertTrue(second.status().rlsEnabled());
        assertFalse(second.status().degraded());
        assertTrue(broker.channels().viewExists());
        assertEquals(2, broker.policies().list(PolicyFilter.all()).total());
        assertTrue(plugin.isHealthy());
    }

    @Test
    @Order(2)
    void publishedMessagesPageNewestFirst() {
        broker.messages().publish("room", Map.of("text", "m1"), "chat");
        broker.messages().publish("room", Map.of("text", "m2"), "chat");
        broker.messages().publish("room", Map.of("text", "m3"), "typing");

        MessagePage newest = broker.messages().list("room", MessageQuery.builder().limit(2).build());
        assertEquals(3, newest.totalCount());
        assertTrue(newest.hasMore());
        assertEquals("m3", newest.messages().get(0).payload().get("text"));

        MessagePage ascending = broker.messages().list("room",
                MessageQuery.builder().direction(MessageQuery.Direction.ASC).build());
        assertEquals(List.of("m1", "m2", "m3"),
                ascending.messages().stream().map(m -> m.payload().get("text")).toList());

        MessagePage typing = broker.messages().list("room", MessageQuery.builder().eventFilter("typing").build());
        assertEquals(1, typing.totalCount());

        Channel room = broker.channelOperations().details("room");
        assertEquals(3, room.broadcastCount());
    }

    @Test
    @Order(3)
    void createdChannelsCarryASystemMessage() {
        ChannelResult created = broker.channelOperations().create("lobby", "presence", Map.of("topic", "hello"));

        assertEquals("lobby", created.channel().id());
        Message system = broker.messages().list("lobby", MessageQuery.defaults()).messages().get(0);
        assertEquals("channel_created", system.event());
        assertEquals(Boolean.TRUE, system.payload().get("system"));
        assertTrue(broker.channels().list("lob", 50, 0).stream().anyMatch(c -> c.id().equals("lobby")));
    }

    @Test
    @Order(4)
    void deletingAChannelPurgesItsMessages() {
        assertEquals(1, broker.channelOperations().delete("lobby").deletedCount());

        assertEquals(0, broker.messages().list("lobby", MessageQuery.defaults()).totalCount());
        BrokerException e = assertThrows(BrokerException.class, () -> broker.channelOperations().details("lobby"));
        assertEquals(ErrorKind.NOT_FOUND, e.kind());
        assertFalse(broker.channelOperations().delete("lobby").found());
    }

    @Test
    @Order(5)
    void policiesRoundTripThroughTheCatalog() {
        Policy created = broker.policies().create(new PolicySpec("Owners delete", PolicyCommand.DELETE,
                List.of("authenticated"), PolicyMode.RESTRICTIVE, "message->>'owner' = current_user", null));
        assertEquals(PolicyMode.RESTRICTIVE, created.mode());
        assertEquals(List.of("authenticated"), created.roles());

        Policy renamed = broker.policies().update("Owners delete", PolicyPatch.rename("Owner deletes"));
        assertEquals("Owner deletes", renamed.name());

        Policy recreated = broker.policies().update("Owner deletes",
                new PolicyPatch(null, null, null, PolicyMode.PERMISSIVE, null, null, true));
        assertEquals(PolicyMode.PERMISSIVE, recreated.mode());
        assertNotNull(recreated.usingExpr());

        assertEquals(1, broker.policies().list(new PolicyFilter("Owner", 10, 0, true)).total());
        assertTrue(broker.policies().delete("Owner deletes", false).isPresent());
        assertTrue(broker.policies().delete("Owner deletes", true).isEmpty());
    }

    @Test
    @Order(6)
    void subscribersReceiveFilteredInserts() throws Exception {
        List<RealtimeEvent> received = new CopyOnWriteArrayList<>();
        CountDownLatch latch = new CountDownLatch(1);
        broker.notifications().subscribe("alerts", SubscriptionEvent.INSERT, Map.of("type", "error"), event -> {
            received.add(event);
            latch.countDown();
        }, null);

        broker.messages().publish("alerts", Map.of("type", "info"), null);
        broker.messages().publish("room", Map.of("type", "error"), null);
        broker.messages().publish("alerts", Map.of("type", "error"), null);

        assertTrue(latch.await(10, TimeUnit.SECONDS));
        Thread.sleep(300);
        assertEquals(1, received.size());
        assertEquals("alerts", received.get(0).channel());
        assertEquals("messages", received.get(0).table());

        assertEquals(1, broker.notifications().unsubscribe("alerts"));
        BrokerException e = assertThrows(BrokerException.class, () -> broker.notifications().unsubscribe("alerts"));
        assertEquals(ErrorKind.NOT_FOUND, e.kind());
    }

    @Test
    @Order(6)
    void oversizedRowsStillPublishAndNotifyATruncatedRow() throws Exception {
        List<RealtimeEvent> received = new CopyOnWriteArrayList<>();
        CountDownLatch latch = new CountDownLatch(1);
        broker.notifications().subscribe("bulk", SubscriptionEvent.INSERT, Map.of(), event -> {
            received.add(event);
            latch.countDown();
        }, null);

        Message message = broker.messages().publish("bulk", Map.of("blob", "x".repeat(10_000)), null);

        assertTrue(latch.await(10, TimeUnit.SECONDS));
        RealtimeEvent event = received.get(0);
        assertTrue(event.truncated());
        assertEquals(message.id(), event.data().get("id"));
        assertEquals("bulk", event.data().get("channel_id"));
        assertFalse(event.data().containsKey("message"));
        MessagePage stored = broker.messages().list("bulk", MessageQuery.builder().build());
        assertEquals(10_000, ((String) stored.messages().get(0).payload().get("blob")).length());

        assertEquals(1, broker.notifications().unsubscribe("bulk"));
    }

    @Test
    @Order(7)
    void alternateLayoutsGroupByTheDetectedKey() throws Exception {
        sql("CREATE SCHEMA legacy",
                "CREATE TABLE legacy.messages (id BIGSERIAL PRIMARY KEY, channel TEXT NOT NULL, payload JSONB NOT NULL, "
                        + "created_at TIMESTAMPTZ NOT NULL DEFAULT now())",
                "CREATE SCHEMA embedded",
                "CREATE TABLE embedded.messages (id BIGSERIAL PRIMARY KEY, payload JSONB NOT NULL)");

        for (String schema : List.of("legacy", "embedded")) {
            RealtimeBroker alternate = plugin.createBroker(config, RealtimeConfig.builder().schema(schema).build());
            alternate.channels().createOrUpdateView();
            alternate.messages().publish("a", Map.of("n", 1), null);
            alternate.messages().publish("a", Map.of("n", 2), null);
            alternate.messages().publish("b", Map.of("n", 3), null);

            List<Channel> channels = alternate.channels().list(null, 50, 0);
            assertEquals(List.of("a", "b"), channels.stream().map(Channel::id).sorted().toList(), schema);
            assertEquals(2, alternate.channelOperations().details("a").broadcastCount(), schema);
            alternate.close();
        }
    }

    @Test
    @Order(8)
    void disableDropsEverythingOnceAndThenDoesNothing() {
        LifecycleResult disabled = broker.lifecycle().disable();
        assertFalse(disabled.status().enabled());
        assertFalse(broker.lifecycle().status().schemaExists());

        LifecycleResult again = broker.lifecycle().disable();
        assertEquals("Realtime already disabled", again.message());
    }
}
