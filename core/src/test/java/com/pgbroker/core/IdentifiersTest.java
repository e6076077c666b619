package com.pgbroker.core;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class IdentifiersTest {

    @Test
    void objectNamesStayDistinctForChannelsThatFoldAlike() {
        assertEquals("room_1f1c5b2f", Identifiers.objectName("room"));
        assertEquals("a_b_d44362d6", Identifiers.objectName("a-b"));
        assertEquals("a_b_648fa9b3", Identifiers.objectName("a_b"));
    }

    @Test
    void longChannelNamesKeepTheirDigest() {
        String longName = "x".repeat(100);

        assertEquals(39, Identifiers.objectName(longName).length());
        assertNotEquals(Identifiers.objectName(longName), Identifiers.objectName(longName + "y"));
    }

    @Test
    void quotingDoublesEmbeddedQuotes() {
        assertEquals("\"a\"\"b\"", Identifiers.quote("a\"b"));
        assertEquals("'it''s'", Identifiers.literal("it's"));
        assertEquals("PUBLIC", Identifiers.role("public"));
        assertEquals("\"authenticated\"", Identifiers.role(" authenticated "));
    }
}
