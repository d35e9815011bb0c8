package com.flagship.pledge_ledger.receipt;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ReceiptNumberTest {

    @Test
    @DisplayName("Sequence is zero padded to five digits")
    void formatsWithPadding() {
        assertEquals("SPDJMSJ-2024-00001", ReceiptNumber.of("SPDJMSJ", 2024, 1).format());
        assertEquals("SPDJMSJ-2024-00201", ReceiptNumber.of("SPDJMSJ", 2024, 201).toString());
    }

    @Test
    @DisplayName("Sequences above 99999 print unpadded")
    void wideSequence() {
        assertEquals("SPDJMSJ-2024-123456", ReceiptNumber.of("SPDJMSJ", 2024, 123456).format());
    }

    @Test
    void parsesStoredNumber() {
        ReceiptNumber parsed = ReceiptNumber.parse("SPDJMSJ-2025-00342").orElseThrow();

        assertEquals("SPDJMSJ", parsed.getPrefix());
        assertEquals(2025, parsed.getYear());
        assertEquals(342, parsed.getSequence());
        assertTrue(parsed.belongsTo("SPDJMSJ", 2025));
        assertFalse(parsed.belongsTo("SPDJMSJ", 2024));
    }

    @Test
    @DisplayName("Prefixes containing dashes still parse")
    void prefixWithDash() {
        ReceiptNumber parsed = ReceiptNumber.parse("ABC-X-2025-00007").orElseThrow();
        assertEquals("ABC-X", parsed.getPrefix());
        assertEquals(7, parsed.getSequence());
    }

    @Test
    @DisplayName("Free text is ignored rather than rejected")
    void ignoresUnparseable() {
        assertEquals(Optional.empty(), ReceiptNumber.parse("cash receipt"));
        assertEquals(Optional.empty(), ReceiptNumber.parse("SPDJMSJ-24-00001"));
        assertEquals(Optional.empty(), ReceiptNumber.parse(null));
    }

    @Test
    void rejectsInvalidParts() {
        assertThrows(IllegalArgumentException.class, () -> ReceiptNumber.of("", 2024, 1));
        assertThrows(IllegalArgumentException.class, () -> ReceiptNumber.of("SPDJMSJ", 2024, 0));
    }
}
