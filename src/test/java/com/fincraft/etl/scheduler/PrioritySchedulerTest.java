package com.fincraft.etl.scheduler;

import com.fincraft.etl.catalog.EntityCatalog;
import com.fincraft.etl.catalog.SymbolScreener;
import com.fincraft.etl.config.Config;
import com.fincraft.etl.config.ExtractionSettings;
import com.fincraft.etl.model.Tier;
import com.fincraft.etl.store.CoverageSignalProvider;
import com.fincraft.etl.support.InMemoryBusinessRecordRepository;
import com.fincraft.etl.support.InMemoryCatalogRepository;
import com.fincraft.etl.support.InMemoryWatermarkRepository;
import com.fincraft.etl.support.Payloads;
import com.fincraft.etl.table.TableDescriptor;
import com.fincraft.etl.watermark.WatermarkStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PrioritySchedulerTest {
    private static final Instant NOW = Instant.parse("2026-10-17T12:00:00Z");
    private static final Map<String, Double> SCORES = Map.of("AAA", 0.9, "BBB", 0.5, "CCC", 0.1);

    private InMemoryCatalogRepository catalogRepo;
    private WatermarkStore store;
    private TableDescriptor table;
    private ExtractionSettings settings;

    @BeforeEach
    void setUp() {
        catalogRepo = new InMemoryCatalogRepository().addSymbols("AAA", "BBB", "CCC", "DDD");
        store = new WatermarkStore(new EntityCatalog(catalogRepo, new SymbolScreener()),
                new InMemoryWatermarkRepository(), new InMemoryBusinessRecordRepository());
        table = Payloads.statementTable();
        settings = ExtractionSettings.forTable(Config.of(Map.of()), table.getTableName());
    }

    @Test
    void schedule_shouldOrderByTierAndPushBelowFloorLast() throws Exception {
        PriorityScheduler scheduler = new PriorityScheduler(store, (t, d) -> SCORES);

        ScheduleResult result = scheduler.schedule(table, settings, 10, NOW);

        assertFalse(result.degraded);
        assertEquals(4, result.dueCount);
        // DDD has no score and lands in the neutral tier.
        assertEquals(List.of("AAA", "BBB", "DDD", "CCC"), ids(result));
        assertEquals(Tier.CORE, result.entities.get(0).tier);
        assertEquals(Tier.EXTENDED, result.entities.get(2).tier);
        assertNull(result.entities.get(2).coverageScore);
        assertTrue(result.entities.get(3).belowFloor);
    }

    @Test
    void schedule_shouldCapAtBatchSize() throws Exception {
        PriorityScheduler scheduler = new PriorityScheduler(store, (t, d) -> SCORES);

        ScheduleResult result = scheduler.schedule(table, settings, 2, NOW);

        assertEquals(List.of("AAA", "BBB"), ids(result));
        assertEquals(4, result.dueCount);
    }

    @Test
    void schedule_shouldBeDeterministic() throws Exception {
        PriorityScheduler scheduler = new PriorityScheduler(store, (t, d) -> SCORES);
        assertEquals(ids(scheduler.schedule(table, settings, 10, NOW)), ids(scheduler.schedule(table, settings, 10, NOW)));
    }

    @Test
    void unavailableCoverage_shouldFallBackToStalenessOrder() throws Exception {
        CoverageSignalProvider broken = (t, d) -> {
            throw new SQLException("coverage view missing");
        };
        store.recordSuccess(table.getTableName(), "AAA", null, "fp", NOW.minus(Duration.ofHours(30)));
        store.recordSuccess(table.getTableName(), "BBB", null, "fp", NOW.minus(Duration.ofHours(60)));

        ScheduleResult result = new PriorityScheduler(store, broken).schedule(table, settings, 10, NOW);

        assertTrue(result.degraded);
        assertEquals(List.of("CCC", "DDD", "BBB", "AAA"), ids(result));
    }

    @Test
    void missingProvider_shouldRunDegraded() throws Exception {
        assertTrue(new PriorityScheduler(store, null).schedule(table, settings, 10, NOW).degraded);
    }

    @Test
    void stalenessThreshold_shouldFollowTier() throws Exception {
        // core refreshes after 24h, long tail after 168h
        store.recordSuccess(table.getTableName(), "AAA", null, "fp", NOW.minus(Duration.ofHours(30)));
        store.recordSuccess(table.getTableName(), "BBB", null, "fp", NOW.minus(Duration.ofHours(30)));
        store.recordSuccess(table.getTableName(), "CCC", null, "fp", NOW.minus(Duration.ofHours(100)));
        store.recordSuccess(table.getTableName(), "DDD", null, "fp", NOW.minus(Duration.ofHours(100)));

        ScheduleResult result = new PriorityScheduler(store, (t, d) -> SCORES).schedule(table, settings, 10, NOW);

        assertEquals(List.of("AAA", "DDD"), ids(result));
    }

    @Test
    void nonPositiveBatchSize_shouldBeRejected() {
        PriorityScheduler scheduler = new PriorityScheduler(store, (t, d) -> SCORES);
        assertThrows(IllegalArgumentException.class, () -> scheduler.schedule(table, settings, 0, NOW));
    }

    private static List<String> ids(ScheduleResult result) {
        return result.entities.stream().map(ScheduledEntity::entityId).collect(Collectors.toList());
    }
}
