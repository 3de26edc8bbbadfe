package com.fincraft.etl.catalog;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CoverageScorerTest {
    private static final LocalDate AS_OF = LocalDate.of(2026, 10, 17);
    private final CoverageScorer scorer = new CoverageScorer();

    @Test
    void fullCoverage_shouldScoreOne() {
        CoverageInputs inputs = new CoverageInputs("IBM", 4, 4, AS_OF.minusDays(30), 80);
        assertEquals(1.0, scorer.score(inputs, AS_OF), 1e-9);
    }

    @Test
    void noData_shouldScoreZero() {
        CoverageInputs inputs = new CoverageInputs("NEW", 0, 4, null, 0);
        assertEquals(0.0, scorer.score(inputs, AS_OF), 1e-9);
        assertEquals(0.0, scorer.score(null, AS_OF), 1e-9);
    }

    @Test
    void score_shouldWeighBreadthRecencyAndDepth() {
        // breadth 0.5, recency 1.0, depth 0.5
        CoverageInputs inputs = new CoverageInputs("IBM", 2, 4, AS_OF.minusDays(10), 20);
        assertEquals(0.5 * 0.5 + 0.3 * 1.0 + 0.2 * 0.5, scorer.score(inputs, AS_OF), 1e-9);
    }

    @Test
    void olderData_shouldScoreLower() {
        CoverageInputs fresh = new CoverageInputs("A", 2, 4, AS_OF.minusDays(100), 20);
        CoverageInputs old = new CoverageInputs("B", 2, 4, AS_OF.minusDays(500), 20);
        CoverageInputs ancient = new CoverageInputs("C", 2, 4, AS_OF.minusDays(2000), 20);
        double f = scorer.score(fresh, AS_OF);
        double o = scorer.score(old, AS_OF);
        double a = scorer.score(ancient, AS_OF);
        assertTrue(f > o);
        assertTrue(o > a);
        assertEquals(0.5 * 0.5 + 0.2 * 0.5, a, 1e-9);
    }
}
