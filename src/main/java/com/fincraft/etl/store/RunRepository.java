package com.fincraft.etl.store;

import com.fincraft.etl.model.RunRow;

import java.sql.SQLException;
import java.time.Instant;
import java.util.List;

public interface RunRepository {

    /**
     * @throws IllegalStateException when another pass of the same table is still RUNNING
     */
    void startRun(String runId, String tableName, Instant startedAt, String notes) throws SQLException;

    void finishRun(RunRow row) throws SQLException;

    int recoverDanglingRuns(Instant at) throws SQLException;

    List<RunRow> listRecent(int limit) throws SQLException;
}
