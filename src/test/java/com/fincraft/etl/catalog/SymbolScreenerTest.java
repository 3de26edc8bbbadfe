package com.fincraft.etl.catalog;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SymbolScreenerTest {
    private final SymbolScreener screener = new SymbolScreener();

    @Test
    void commonEquity_shouldBeAccepted() {
        assertTrue(screener.accept("IBM"));
        assertTrue(screener.accept("AAPL"));
        assertTrue(screener.accept("BRK.B"));
        assertNull(screener.rejectReason("msft"));
    }

    @Test
    void derivativeListings_shouldBeRejected() {
        assertEquals("warrant", screener.rejectReason("ACAH.WS"));
        assertEquals("warrant", screener.rejectReason("ABCDW"));
        assertEquals("right", screener.rejectReason("ABCDR"));
        assertEquals("unit", screener.rejectReason("ABC-U"));
        assertEquals("preferred", screener.rejectReason("BAC-PL"));
        assertEquals("preferred", screener.rejectReason("JPM^C"));
    }

    @Test
    void blankSymbol_shouldBeRejected() {
        assertFalse(screener.accept(" "));
        assertEquals("blank", screener.rejectReason(null));
    }
}
