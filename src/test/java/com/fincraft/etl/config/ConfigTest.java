package com.fincraft.etl.config;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConfigTest {

    @Test
    void values_shouldFallBackToDefaults() {
        Config config = Config.of(Map.of("fetch.concurrent", "8"));

        assertEquals(8, config.getInt("fetch.concurrent"));
        assertEquals(3, config.getInt("extract.max_failures"));
        assertEquals("source", config.getString("db.schema"));
        assertFalse(config.getBoolean("db.sql_log.enabled"));
        assertEquals("default", config.sourceOf("db.schema"));
        assertEquals("override", config.sourceOf("fetch.concurrent"));
    }

    @Test
    void springBoundMaps_shouldBeFlattened() {
        Config config = Config.fromConfigurationProperties(
                java.nio.file.Path.of("."),
                Map.of("extract", Map.of("batch_size", 12, "tables", List.of("cash_flow", "balance_sheet")))
        );

        assertEquals(12, config.getInt("extract.batch_size"));
        assertEquals(List.of("cash_flow", "balance_sheet"), config.getList("extract.tables"));
        assertTrue(config.has("extract.batch_size"));
    }

    @Test
    void requireString_shouldRejectMissingKeys() {
        assertThrows(IllegalArgumentException.class, () -> Config.of(Map.of()).requireString("alphavantage.api_key"));
    }
}
