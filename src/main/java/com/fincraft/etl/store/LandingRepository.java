package com.fincraft.etl.store;

import com.fincraft.etl.model.LandingRecord;

import java.sql.SQLException;
import java.util.List;

/**
 * Append-only fetch audit log.
 */
public interface LandingRepository {

    long append(LandingRecord record) throws SQLException;

    List<LandingRecord> listByRun(String runId) throws SQLException;
}
