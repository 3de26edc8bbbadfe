package com.fincraft.etl.db;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SqlLogProxyTest {

    @Test
    void normalizeSql_shouldCollapseWhitespaceAndTruncate() {
        assertEquals("SELECT 1 FROM x", SqlLogProxy.normalizeSql("SELECT  1\n\tFROM   x "));
        assertEquals("", SqlLogProxy.normalizeSql(null));

        String longSql = "SELECT " + "a,".repeat(600) + "b";
        String out = SqlLogProxy.normalizeSql(longSql);
        assertTrue(out.endsWith("..."));
        assertEquals(803, out.length());
    }
}
