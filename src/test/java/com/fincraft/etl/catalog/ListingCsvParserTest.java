package com.fincraft.etl.catalog;

import com.fincraft.etl.model.CatalogEntity;
import com.fincraft.etl.model.EntityKind;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ListingCsvParserTest {
    private final ListingCsvParser parser = new ListingCsvParser();

    @Test
    void parse_shouldReadListingColumns() {
        String body = "symbol,name,exchange,assetType,ipoDate,delistingDate,status\r\n"
                + "IBM,International Business Machines Corp,NYSE,Stock,1962-01-02,null,Active\r\n"
                + "SPY,\"SPDR S&P 500 ETF Trust, Series 1\",NYSE ARCA,ETF,1993-01-29,null,Active\r\n"
                + "OLD,Old Co,NASDAQ,Stock,2001-01-01,2020-01-01,Delisted\r\n"
                + "\r\n";

        List<CatalogEntity> rows = parser.parse(body, "listing");

        assertEquals(3, rows.size());
        CatalogEntity ibm = rows.get(0);
        assertEquals("IBM", ibm.entityId);
        assertEquals(EntityKind.SYMBOL, ibm.kind);
        assertEquals("Stock", ibm.assetType);
        assertEquals("NYSE", ibm.exchange);
        assertEquals("listing", ibm.source);
        assertTrue(ibm.active);
        assertEquals("SPDR S&P 500 ETF Trust, Series 1", rows.get(1).name);
        assertFalse(rows.get(2).active);
    }

    @Test
    void unexpectedHeader_shouldBeRejected() {
        assertThrows(IllegalArgumentException.class, () -> parser.parse("{\"Information\":\"limit\"}", "listing"));
    }

    @Test
    void blankBody_shouldYieldNothing() {
        assertTrue(parser.parse("  ", "listing").isEmpty());
    }

    @Test
    void splitLine_shouldUnescapeDoubledQuotes() {
        assertEquals(List.of("a", "say \"hi\"", ""), ListingCsvParser.splitLine("a,\"say \"\"hi\"\"\","));
    }
}
