package com.fincraft.etl.store;

import com.fincraft.etl.model.FailureReason;
import com.fincraft.etl.model.Watermark;

import java.sql.SQLException;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Durable watermark rows keyed by (table, entity). Every mutation is a single atomic statement
 * scoped to one entity.
 */
public interface WatermarkRepository {

    Optional<Watermark> find(String tableName, String entityId) throws SQLException;

    Map<String, Watermark> findAll(String tableName) throws SQLException;

    void markSuccess(String tableName, String entityId, LocalDate period, String fingerprint, Instant at) throws SQLException;

    void markEmpty(String tableName, String entityId, Instant at) throws SQLException;

    /**
     * @return the failure streak after the increment
     */
    int markFailure(String tableName, String entityId, FailureReason reason, Instant at) throws SQLException;

    /**
     * Clears the failure streak of one entity, or of every entity of the table when {@code entityId} is null.
     */
    int resetFailures(String tableName, String entityId, Instant at) throws SQLException;

    List<Watermark> listAtOrAboveFailures(String tableName, int failureCeiling) throws SQLException;
}
