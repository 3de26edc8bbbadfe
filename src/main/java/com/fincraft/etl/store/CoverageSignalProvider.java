package com.fincraft.etl.store;

import java.sql.SQLException;
import java.time.LocalDate;
import java.util.Map;

/**
 * Supplies the composite coverage score in [0,1] per entity. Entities missing from the map
 * are treated as having a neutral score.
 */
public interface CoverageSignalProvider {

    Map<String, Double> coverageScores(String tableName, LocalDate asOf) throws SQLException;
}
