package com.fincraft.etl.watermark;

import com.fincraft.etl.catalog.EntityCatalog;
import com.fincraft.etl.catalog.SymbolScreener;
import com.fincraft.etl.config.Config;
import com.fincraft.etl.config.ExtractionSettings;
import com.fincraft.etl.model.FailureReason;
import com.fincraft.etl.model.Watermark;
import com.fincraft.etl.support.InMemoryBusinessRecordRepository;
import com.fincraft.etl.support.InMemoryCatalogRepository;
import com.fincraft.etl.support.InMemoryWatermarkRepository;
import com.fincraft.etl.support.Payloads;
import com.fincraft.etl.table.TableDescriptor;
import com.fincraft.etl.table.TableRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class WatermarkStoreTest {
    private static final Instant NOW = Instant.parse("2026-10-17T12:00:00Z");
    private static final StalenessPolicy DAILY = StalenessPolicy.uniform(Duration.ofHours(24));

    private InMemoryCatalogRepository catalogRepo;
    private InMemoryWatermarkRepository watermarkRepo;
    private InMemoryBusinessRecordRepository recordRepo;
    private WatermarkStore store;
    private TableDescriptor table;
    private ExtractionSettings settings;

    @BeforeEach
    void setUp() {
        catalogRepo = new InMemoryCatalogRepository();
        watermarkRepo = new InMemoryWatermarkRepository();
        recordRepo = new InMemoryBusinessRecordRepository();
        store = new WatermarkStore(new EntityCatalog(catalogRepo, new SymbolScreener()), watermarkRepo, recordRepo);
        table = Payloads.statementTable();
        settings = ExtractionSettings.forTable(Config.of(Map.of()), table.getTableName());
    }

    @Test
    void getDue_shouldOrderNeverProcessedFirstThenOldestSuccess() throws Exception {
        catalogRepo.addSymbols("AAA", "BBB", "CCC", "DDD");
        store.recordSuccess(table.getTableName(), "AAA", null, "fp", NOW.minus(Duration.ofHours(30)));
        store.recordSuccess(table.getTableName(), "BBB", null, "fp", NOW.minus(Duration.ofHours(50)));

        List<String> due = ids(store.getDue(table, settings, NOW, DAILY, id -> null));

        assertEquals(List.of("CCC", "DDD", "BBB", "AAA"), due);
    }

    @Test
    void getDue_shouldSkipFreshEntitiesUntilThresholdElapses() throws Exception {
        catalogRepo.addSymbols("IBM");
        store.recordSuccess(table.getTableName(), "IBM", null, "fp", NOW.minus(Duration.ofHours(23)));

        assertTrue(store.getDue(table, settings, NOW, DAILY, id -> null).isEmpty());
        assertEquals(List.of("IBM"), ids(store.getDue(table, settings, NOW.plus(Duration.ofHours(1)), DAILY, id -> null)));
    }

    @Test
    void getDue_shouldExcludeSuspendedEntitiesUntilReset() throws Exception {
        catalogRepo.addSymbols("IBM", "MSFT");
        for (int i = 0; i < settings.failureCeiling; i++) {
            assertEquals(i + 1, store.recordFailure(table.getTableName(), "IBM", FailureReason.TIMEOUT, NOW));
        }

        assertEquals(List.of("MSFT"), ids(store.getDue(table, settings, NOW, DAILY, id -> null)));
        assertEquals(1, store.listSuspended(table.getTableName(), settings.failureCeiling).size());

        assertEquals(1, store.resetFailures(table.getTableName(), "IBM", NOW));

        assertEquals(List.of("IBM", "MSFT"), ids(store.getDue(table, settings, NOW, DAILY, id -> null)));
        assertTrue(store.listSuspended(table.getTableName(), settings.failureCeiling).isEmpty());
    }

    @Test
    void failingEntityBelowCeiling_shouldStayDue() throws Exception {
        catalogRepo.addSymbols("IBM");
        store.recordSuccess(table.getTableName(), "IBM", null, "fp", NOW.minus(Duration.ofHours(48)));
        store.recordFailure(table.getTableName(), "IBM", FailureReason.RATE_LIMIT, NOW);

        assertEquals(List.of("IBM"), ids(store.getDue(table, settings, NOW, DAILY, id -> null)));
    }

    @Test
    void getDue_shouldSkipEntitiesHoldingExpectedPeriod() throws Exception {
        TableDescriptor balanceSheet = TableRegistry.builtIn().require(TableRegistry.BALANCE_SHEET);
        catalogRepo.addSymbols("IBM", "MSFT");
        Instant longAgo = NOW.minus(Duration.ofDays(30));
        // On 2026-10-17 with a 45 day lag the expected quarter is 2026-06-30.
        store.recordSuccess(balanceSheet.getTableName(), "IBM", LocalDate.of(2026, 6, 30), "fp", longAgo);
        store.recordSuccess(balanceSheet.getTableName(), "MSFT", LocalDate.of(2026, 3, 31), "fp", longAgo);

        List<String> due = ids(store.getDue(balanceSheet, settings, NOW, DAILY, id -> null));

        assertEquals(List.of("MSFT"), due);
    }

    @Test
    void recordSuccess_shouldKeepPeriodMonotonic() throws Exception {
        store.recordSuccess(table.getTableName(), "IBM", LocalDate.of(2026, 6, 30), "fp1", NOW);
        store.recordSuccess(table.getTableName(), "IBM", LocalDate.of(2025, 12, 31), "fp2", NOW.plusSeconds(5));

        Watermark wm = store.find(table.getTableName(), "IBM").orElseThrow();
        assertEquals(LocalDate.of(2026, 6, 30), wm.lastPeriodCovered);
        assertEquals("fp2", wm.lastFingerprint);
        assertEquals(NOW.plusSeconds(5), wm.lastSuccessTime);
    }

    @Test
    void recordEmpty_shouldClearFailuresAndCountAsSuccess() throws Exception {
        catalogRepo.addSymbols("IBM");
        store.recordFailure(table.getTableName(), "IBM", FailureReason.TIMEOUT, NOW);
        store.recordEmpty(table.getTableName(), "IBM", NOW);

        Watermark wm = store.find(table.getTableName(), "IBM").orElseThrow();
        assertEquals(0, wm.consecutiveFailures);
        assertEquals(NOW, wm.lastSuccessTime);
        assertTrue(store.getDue(table, settings, NOW.plusSeconds(60), DAILY, id -> null).isEmpty());
    }

    @Test
    void blankEntityId_shouldBeRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> store.recordFailure(table.getTableName(), " ", FailureReason.OTHER, NOW));
        assertThrows(IllegalArgumentException.class,
                () -> store.recordSuccess(table.getTableName(), null, null, null, NOW));
    }

    private static List<String> ids(List<DueEntity> due) {
        return due.stream().map(DueEntity::entityId).collect(Collectors.toList());
    }
}
