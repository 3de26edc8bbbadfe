package com.fincraft.etl.table;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ReportingLagRuleTest {

    @Test
    void quarterly_shouldWaitForLagBeforeExpectingNewQuarter() {
        ReportingLagRule rule = ReportingLagRule.quarterly(45);
        // Q1 ends 03-31 and becomes available on 05-16.
        assertEquals(LocalDate.of(2025, 12, 31), rule.expectedLatestPeriod(LocalDate.of(2026, 5, 15)));
        assertEquals(LocalDate.of(2026, 3, 31), rule.expectedLatestPeriod(LocalDate.of(2026, 5, 16)));
    }

    @Test
    void quarterly_shouldCrossYearBoundary() {
        ReportingLagRule rule = ReportingLagRule.quarterly(45);
        assertEquals(LocalDate.of(2025, 9, 30), rule.expectedLatestPeriod(LocalDate.of(2026, 1, 10)));
    }

    @Test
    void monthly_shouldUseMonthEnds() {
        ReportingLagRule rule = ReportingLagRule.monthly(10);
        assertEquals(LocalDate.of(2026, 1, 31), rule.expectedLatestPeriod(LocalDate.of(2026, 3, 10)));
        assertEquals(LocalDate.of(2026, 2, 28), rule.expectedLatestPeriod(LocalDate.of(2026, 3, 11)));
    }

    @Test
    void daily_shouldSkipWeekends() {
        ReportingLagRule rule = ReportingLagRule.daily(0);
        // 2026-10-17 is a Saturday.
        assertEquals(LocalDate.of(2026, 10, 16), rule.expectedLatestPeriod(LocalDate.of(2026, 10, 17)));
        assertEquals(LocalDate.of(2026, 10, 16), rule.expectedLatestPeriod(LocalDate.of(2026, 10, 18)));
    }

    @Test
    void none_shouldNeverCoverAnything() {
        ReportingLagRule rule = ReportingLagRule.none();
        assertNull(rule.expectedLatestPeriod(LocalDate.of(2026, 10, 17)));
        assertFalse(rule.coversExpected(LocalDate.of(2030, 1, 1), LocalDate.of(2026, 10, 17)));
    }

    @Test
    void coversExpected_shouldCompareLatestPeriod() {
        ReportingLagRule rule = ReportingLagRule.quarterly(45);
        LocalDate asOf = LocalDate.of(2026, 6, 1);
        assertTrue(rule.coversExpected(LocalDate.of(2026, 3, 31), asOf));
        assertFalse(rule.coversExpected(LocalDate.of(2025, 12, 31), asOf));
        assertFalse(rule.coversExpected(null, asOf));
    }

    @Test
    void negativeLag_shouldBeRejected() {
        assertThrows(IllegalArgumentException.class, () -> ReportingLagRule.quarterly(-1));
    }

    @Test
    void descriptorOverride_shouldKeepFrequency() {
        TableDescriptor table = TableRegistry.builtIn().require(TableRegistry.BALANCE_SHEET);
        ReportingLagRule rule = table.lagRule(10);
        assertEquals(ReportingLagRule.Frequency.QUARTERLY, rule.frequency());
        assertEquals(10, rule.lagDays());
        assertEquals(45, table.lagRule(null).lagDays());
    }
}
