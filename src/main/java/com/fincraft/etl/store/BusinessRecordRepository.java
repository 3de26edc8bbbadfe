package com.fincraft.etl.store;

import com.fincraft.etl.model.BusinessRecord;
import com.fincraft.etl.model.NaturalKey;
import com.fincraft.etl.model.UpsertResult;

import java.sql.SQLException;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public interface BusinessRecordRepository {

    Optional<BusinessRecord> find(String tableName, NaturalKey key) throws SQLException;

    /**
     * Inserts the row, replaces it when the stored fingerprint differs, or leaves it untouched.
     */
    UpsertResult upsert(String tableName, BusinessRecord record) throws SQLException;

    /**
     * Same as {@link #upsert} for every record, inside one transaction.
     */
    List<UpsertResult> upsertAll(String tableName, List<BusinessRecord> records) throws SQLException;

    Map<String, LocalDate> latestPeriods(String tableName) throws SQLException;

    Optional<LocalDate> latestPeriod(String tableName, String entityId, String reportType) throws SQLException;

    int countByEntity(String tableName, String entityId) throws SQLException;
}
