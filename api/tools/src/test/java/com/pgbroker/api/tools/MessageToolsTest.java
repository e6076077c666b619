package com.pgbroker.api.tools;

import com.pgbroker.core.BrokerException;
import com.pgbroker.core.Channel;
import com.pgbroker.core.ChannelRegistry;
import com.pgbroker.core.Message;
import com.pgbroker.core.MessagePage;
import com.pgbroker.core.MessageQuery;
import com.pgbroker.core.MessageStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class MessageToolsTest {
    private static final Instant T = Instant.parse("2024-06-01T10:00:00Z");

    private MessageStore messages;
    private ChannelRegistry channels;

    @BeforeEach
    void setUp() {
        messages = mock(MessageStore.class);
        channels = mock(ChannelRegistry.class);
    }

    @Test
    void sendCreatesTheChannelByDefault() {
        when(messages.exists("room")).thenReturn(false);
        when(messages.publish("room", Map.of("text", "hi"), "chat"))
                .thenReturn(new Message("m1", "room", Map.of("text", "hi", "event", "chat"), T));

        ToolResult result = new SendMessageTool(messages)
                .call(Map.of("channelId", "room", "message", Map.of("text", "hi"), "event", "chat"));

        assertTrue(result.success());
        assertEquals(true, result.body().get("channelCreated"));
        @SuppressWarnings("unchecked")
        Map<String, Object> message = (Map<String, Object>) result.body().get("message");
        assertEquals("chat", message.get("event"));
    }

    @Test
    void sendToAnUnknownChannelWithoutCreateIsNotFound() {
        when(messages.exists("room")).thenReturn(false);

        ToolResult result = new SendMessageTool(messages)
                .call(Map.of("channelId", "room", "message", Map.of(), "createChannelIfNotExists", false));

        assertFalse(result.success());
        assertEquals("not_found", result.body().get("kind"));
        verify(messages, never()).publish(any(), any(), any());
    }

    @Test
    void sendRequiresAnObjectMessage() {
        ToolResult result = new SendMessageTool(messages).call(Map.of("channelId", "room", "message", "hi"));

        assertEquals("validation", result.body().get("kind"));
    }

    @Test
    void getMessagesBuildsTheQueryFromParameters() {
        when(messages.exists("room")).thenReturn(true);
        when(messages.list(eq("room"), any())).thenReturn(new MessagePage(
                List.of(new Message("m1", "room", Map.of(), T)), 3, 1, 0));
        when(channels.viewExists()).thenReturn(true);
        when(channels.find("room")).thenReturn(Optional.of(new Channel("room", "room", "standard", T, T, 3)));

        Map<String, Object> params = new HashMap<>();
        params.put("channelId", "room");
        params.put("limit", 1);
        params.put("orderDirection", "asc");
        params.put("eventFilter", "chat");
        params.put("startDate", "2024-06-01T00:00:00Z");
        ToolResult result = new GetMessagesTool(messages, channels).call(params);

        assertTrue(result.success());
        ArgumentCaptor<MessageQuery> query = ArgumentCaptor.forClass(MessageQuery.class);
        verify(messages).list(eq("room"), query.capture());
        assertEquals(1, query.getValue().limit());
        assertEquals(MessageQuery.Direction.ASC, query.getValue().direction());
        assertEquals("chat", query.getValue().eventFilter());
        assertEquals(Instant.parse("2024-06-01T00:00:00Z"), query.getValue().startDate());
        assertEquals(Map.of("total", 3L, "limit", 1, "offset", 0, "hasMore", true), result.body().get("pagination"));
        assertTrue(result.body().containsKey("channel"));
    }

    @Test
    void getMessagesOfAnUnknownChannelIsNotFound() {
        when(messages.exists("ghost")).thenReturn(false);

        ToolResult result = new GetMessagesTool(messages, channels).call(Map.of("channelId", "ghost"));

        assertEquals("not_found", result.body().get("kind"));
    }

    @Test
    void badDatesAndLimitsAreRejectedBeforeTheStore() {
        GetMessagesTool tool = new GetMessagesTool(messages, channels);

        assertEquals("validation", tool.call(Map.of("channelId", "room", "startDate", "yesterday")).body().get("kind"));
        assertEquals("validation", tool.call(Map.of("channelId", "room", "limit", 0)).body().get("kind"));
        assertEquals("validation", tool.call(Map.of("channelId", "room", "orderBy", "name")).body().get("kind"));
        verifyNoInteractions(messages);
    }

    @Test
    void storeFailuresSurfaceWithTheirKind() {
        when(messages.exists("room")).thenThrow(BrokerException.precondition("Realtime is not enabled"));

        ToolResult result = new SendMessageTool(messages).call(Map.of("channelId", "room", "message", Map.of()));

        assertEquals("precondition", result.body().get("kind"));
        assertEquals("Realtime is not enabled", result.body().get("error"));
    }
}
