package com.pgbroker.core;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SchemaShapeTest {

    @Test
    void channelIdColumnWinsOverEverythingElse() {
        SchemaShape shape = SchemaShape.fromColumns(List.of("id", "channel", "channel_id", "message", "created_at"));

        assertEquals(new ChannelKey.DedicatedColumn("channel_id"), shape.channelKey());
        assertEquals("message", shape.payloadColumn());
        assertTrue(shape.hasTimestamp());
        assertFalse(shape.degraded());
        assertEquals("\"channel_id\"", shape.channelKey().expression());
    }

    @Test
    void channelColumnIsUsedWhenChannelIdIsMissing() {
        SchemaShape shape = SchemaShape.fromColumns(List.of("id", "channel", "payload", "created_at"));

        assertEquals(new ChannelKey.DedicatedColumn("channel"), shape.channelKey());
        assertEquals("payload", shape.payloadColumn());
        assertEquals("NEW.\"channel\"", shape.channelKey().expression("NEW"));
    }

    @Test
    void jsonPathIsUsedWhenOnlyAPayloadColumnExists() {
        SchemaShape shape = SchemaShape.fromColumns(List.of("id", "message", "created_at"));

        assertInstanceOf(ChannelKey.JsonPath.class, shape.channelKey());
        assertTrue(shape.channelKey().embedded());
        assertNull(shape.channelKey().keyColumn());
        assertEquals("COALESCE(\"message\"->>'channel', 'default')", shape.channelKey().expression());
        assertEquals("COALESCE(OLD.\"message\"->>'channel', 'default')", shape.channelKey().expression("OLD"));
    }

    @Test
    void messageColumnIsPreferredOverPayload() {
        SchemaShape shape = SchemaShape.fromColumns(List.of("id", "payload", "message"));

        assertEquals("message", shape.payloadColumn());
    }

    @Test
    void noUsableColumnDegradesToTheDefaultChannel() {
        SchemaShape shape = SchemaShape.fromColumns(List.of("id", "body"));

        assertTrue(shape.degraded());
        assertFalse(shape.hasPayload());
        assertFalse(shape.hasTimestamp());
        assertEquals("'default'::text", shape.channelKey().expression());
        assertEquals("NULL::jsonb", shape.payloadExpression());
        assertEquals("now()", shape.timestampExpression());
        assertTrue(shape.describe().contains("constant 'default'"));
    }

    @Test
    void missingTableYieldsTheConstantShape() {
        SchemaShape shape = SchemaShape.fromColumns(List.of());

        assertTrue(shape.degraded());
        assertFalse(shape.hasPayload());
        assertFalse(shape.hasTimestamp());
    }

    @Test
    void columnNamesAreMatchedCaseInsensitively() {
        SchemaShape shape = SchemaShape.fromColumns(List.of("ID", "Channel_Id", "MESSAGE", "Created_At"));

        assertEquals(new ChannelKey.DedicatedColumn("channel_id"), shape.channelKey());
        assertEquals("message", shape.payloadColumn());
        assertTrue(shape.hasTimestamp());
    }
}
