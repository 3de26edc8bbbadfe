package com.fincraft.etl.db;

import com.fincraft.etl.db.mybatis.LandingMapper;
import com.fincraft.etl.db.mybatis.LandingRow;
import com.fincraft.etl.db.mybatis.MyBatisSupport;
import com.fincraft.etl.model.FetchStatus;
import com.fincraft.etl.model.LandingRecord;
import com.fincraft.etl.store.LandingRepository;
import org.apache.ibatis.exceptions.PersistenceException;
import org.apache.ibatis.session.SqlSession;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

/**
 * Append-only writes to {@code api_responses_landing}.
 */
public final class LandingDao implements LandingRepository {
    private static final int MAX_PAYLOAD_CHARS = 1_000_000;

    private final Database database;

    public LandingDao(Database database) {
        this.database = database;
    }

    @Override
    public long append(LandingRecord record) throws SQLException {
        LandingRow row = LandingRow.builder()
                .tableName(record.tableName)
                .entityId(record.entityId)
                .runId(record.runId)
                .status(record.status.label())
                .contentFingerprint(record.contentFingerprint)
                .failureReason(record.failureReason)
                .message(record.message)
                .payload(truncate(record.payload))
                .fetchedAt(DbTime.utc(record.fetchedAt))
                .build();
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            conn.setAutoCommit(false);
            session.getMapper(LandingMapper.class).insert(row);
            conn.commit();
            return row.getId() == null ? 0L : row.getId();
        } catch (PersistenceException e) {
            throw MyBatisSupport.toSqlException(e);
        }
    }

    @Override
    public List<LandingRecord> listByRun(String runId) throws SQLException {
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            List<LandingRecord> out = new ArrayList<>();
            for (LandingRow row : session.getMapper(LandingMapper.class).listByRun(runId)) {
                out.add(new LandingRecord(
                        row.getId() == null ? 0L : row.getId(),
                        row.getTableName(),
                        row.getEntityId(),
                        row.getRunId(),
                        FetchStatus.fromLabel(row.getStatus()),
                        row.getContentFingerprint(),
                        row.getFailureReason(),
                        row.getMessage(),
                        row.getPayload(),
                        DbTime.instant(row.getFetchedAt())
                ));
            }
            return out;
        } catch (PersistenceException e) {
            throw MyBatisSupport.toSqlException(e);
        }
    }

    private static String truncate(String payload) {
        if (payload == null || payload.length() <= MAX_PAYLOAD_CHARS) {
            return payload;
        }
        return payload.substring(0, MAX_PAYLOAD_CHARS);
    }
}
