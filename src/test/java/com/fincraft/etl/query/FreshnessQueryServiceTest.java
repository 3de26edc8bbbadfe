package com.fincraft.etl.query;

import com.fincraft.etl.model.BusinessRecord;
import com.fincraft.etl.model.EntityFreshness;
import com.fincraft.etl.model.EntityState;
import com.fincraft.etl.model.FailureReason;
import com.fincraft.etl.model.Watermark;
import com.fincraft.etl.support.InMemoryBusinessRecordRepository;
import com.fincraft.etl.support.InMemoryWatermarkRepository;
import com.fincraft.etl.support.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FreshnessQueryServiceTest {
    private static final Instant NOW = Instant.parse("2026-10-17T12:00:00Z");
    private static final String TABLE = "balance_sheet";

    private final InMemoryWatermarkRepository watermarks = new InMemoryWatermarkRepository();
    private final InMemoryBusinessRecordRepository records = new InMemoryBusinessRecordRepository();
    private final FreshnessQueryService service = new FreshnessQueryService(watermarks, records, new MutableClock(NOW));

    @Test
    void freshness_shouldDescribeEachState() throws Exception {
        watermarks.put(Watermark.initial(TABLE, "OK", NOW)
                .withSuccess(LocalDate.of(2026, 6, 30), "fp", NOW.minus(Duration.ofHours(30))));
        watermarks.put(Watermark.initial(TABLE, "BAD", NOW)
                .withFailure(FailureReason.TIMEOUT, NOW)
                .withFailure(FailureReason.TIMEOUT, NOW)
                .withFailure(FailureReason.TIMEOUT, NOW));
        records.upsert(TABLE, new BusinessRecord("OK", LocalDate.of(2026, 6, 30), "quarterly",
                Map.of(), "r1", "run", NOW));

        EntityFreshness ok = service.freshness(TABLE, "OK", 3);
        EntityFreshness bad = service.freshness(TABLE, "BAD", 3);
        EntityFreshness unknown = service.freshness(TABLE, "NEW", 3);

        assertEquals(EntityState.SUCCESS, ok.state);
        assertEquals(30L, ok.ageHours);
        assertEquals(LocalDate.of(2026, 6, 30), ok.latestStoredPeriod);
        assertEquals(EntityState.SUSPENDED, bad.state);
        assertEquals("timeout", bad.lastFailureReason);
        assertNull(bad.ageHours);
        assertEquals(EntityState.NEVER_FETCHED, unknown.state);
    }

    @Test
    void tableFreshness_shouldListStalestFirst() throws Exception {
        watermarks.put(Watermark.initial(TABLE, "NEWER", NOW).withSuccess(null, "a", NOW.minusSeconds(60)));
        watermarks.put(Watermark.initial(TABLE, "OLDER", NOW).withSuccess(null, "b", NOW.minusSeconds(3600)));
        watermarks.put(Watermark.initial(TABLE, "NEVER", NOW).withFailure(FailureReason.HTTP_STATUS, NOW));

        List<EntityFreshness> all = service.freshness(TABLE, 3);

        assertEquals(List.of("NEVER", "OLDER", "NEWER"), all.stream().map(f -> f.entityId).toList());
        assertEquals(EntityState.ERROR, all.get(0).state);
    }

    @Test
    void suspended_shouldHonourPerTableCeilingAndSort() throws Exception {
        watermarks.put(Watermark.initial("income_statement", "ZZZ", NOW).withFailure(FailureReason.OTHER, NOW));
        watermarks.put(Watermark.initial(TABLE, "BBB", NOW)
                .withFailure(FailureReason.RATE_LIMIT, NOW)
                .withFailure(FailureReason.RATE_LIMIT, NOW));
        watermarks.put(Watermark.initial(TABLE, "AAA", NOW).withFailure(FailureReason.RATE_LIMIT, NOW));

        SuspensionReport report = service.suspended(List.of(TABLE, "income_statement"),
                t -> t.equals(TABLE) ? 2 : 1);

        assertEquals(2, report.size());
        assertEquals("BBB", report.entries.get(0).entityId);
        assertEquals("income_statement", report.entries.get(1).tableName);
        assertTrue(report.toLines().get(1).contains("rate_limit"));
    }

    @Test
    void emptySuspensionReport_shouldSaySo() throws Exception {
        SuspensionReport report = service.suspended(List.of(TABLE), t -> 3);

        assertTrue(report.isEmpty());
        assertEquals(List.of("no suspended entities"), report.toLines());
    }
}
