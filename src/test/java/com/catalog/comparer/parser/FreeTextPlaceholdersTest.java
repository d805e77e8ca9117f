package com.catalog.comparer.parser;

import org.junit.jupiter.api.*;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test placeholder protection of free-text values
 */
class FreeTextPlaceholdersTest {

    @Test
    @DisplayName("Protected value contains none of the protected characters and restores exactly")
    void testRoundTripWithSemicolonDelimiter() {
        String value = "a;b,c\r\nd§e\"f\"";

        String protectedValue = FreeTextPlaceholders.protect(value, ';');

        for (char ch : new char[] {';', ',', '\r', '\n', '§', '"'}) {
            assertEquals(-1, protectedValue.indexOf(ch), "Should not contain '" + ch + "'");
        }
        assertEquals(value, FreeTextPlaceholders.restore(protectedValue, ';'));
    }

    @Test
    @DisplayName("CR and LF keep distinct tokens so CRLF survives")
    void testCarriageReturnLineFeedDistinct() {
        String protectedValue = FreeTextPlaceholders.protect("x\r\ny", ',');

        assertEquals("x\r\ny", FreeTextPlaceholders.restore(protectedValue, ','));
    }

    @Test
    @DisplayName("Null and empty values pass through")
    void testNullAndEmpty() {
        assertNull(FreeTextPlaceholders.protect(null, ','));
        assertEquals("", FreeTextPlaceholders.restore("", ','));
    }
}
