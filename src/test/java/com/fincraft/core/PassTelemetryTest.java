package com.fincraft.core;

import com.fincraft.etl.model.FetchOutcome;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PassTelemetryTest {

    @Test
    void summary_shouldContainRequiredFields() {
        PassTelemetry telemetry = new PassTelemetry("run-42", "balance_sheet", Instant.parse("2026-10-17T00:00:00Z"));
        telemetry.setScheduled(3, true);
        telemetry.recordStep(PassTelemetry.STEP_FETCH, 120, 1, 0);
        telemetry.recordStep(PassTelemetry.STEP_FETCH, 80, 0, 1);
        telemetry.recordOutcome(FetchOutcome.INSERTED);
        telemetry.recordOutcome(FetchOutcome.ERROR);
        telemetry.recordOutcome(FetchOutcome.ERROR);
        telemetry.finish(Instant.parse("2026-10-17T00:00:05Z"));

        String summary = telemetry.getSummary();

        assertTrue(summary.contains("run_id=run-42"));
        assertTrue(summary.contains("table=balance_sheet"));
        assertTrue(summary.contains("total_elapsed_ms=5000"));
        assertTrue(summary.contains("scheduled=3 order=staleness_only"));
        assertTrue(summary.contains("inserted=1"));
        assertTrue(summary.contains("error=2"));
        assertTrue(summary.contains("FETCH calls=2 elapsed_ms=200 out=1 err=1"));
    }

    @Test
    void stepRecords_shouldAggregatePerStep() {
        PassTelemetry telemetry = new PassTelemetry("run-1", "cash_flow", Instant.parse("2026-10-17T00:00:00Z"));
        telemetry.recordStep("upsert", 5, 2, 0);
        telemetry.recordStep(PassTelemetry.STEP_UPSERT, 7, 3, 0);

        assertEquals(1, telemetry.stepRecords().size());
        PassTelemetry.StepRecord upsert = telemetry.stepRecords().get(0);
        assertEquals(PassTelemetry.STEP_UPSERT, upsert.name());
        assertEquals(2, upsert.calls());
        assertEquals(12, upsert.elapsedMs());
        assertEquals(5, upsert.itemsOut());
        assertEquals(0, telemetry.count(FetchOutcome.SKIPPED));
    }
}
