package com.fincraft.etl.db;

import com.fincraft.etl.db.mybatis.MyBatisSupport;
import com.fincraft.etl.db.mybatis.WatermarkMapper;
import com.fincraft.etl.db.mybatis.WatermarkRow;
import com.fincraft.etl.db.mybatis.WatermarkUpdateParam;
import com.fincraft.etl.model.FailureReason;
import com.fincraft.etl.model.FetchStatus;
import com.fincraft.etl.model.Watermark;
import com.fincraft.etl.store.WatermarkRepository;
import org.apache.ibatis.exceptions.PersistenceException;
import org.apache.ibatis.session.SqlSession;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Watermark rows. Every mutation is one upsert statement, so concurrent writers for
 * different entities never touch the same row.
 */
public final class WatermarkDao implements WatermarkRepository {
    private final Database database;

    public WatermarkDao(Database database) {
        this.database = database;
    }

    @Override
    public Optional<Watermark> find(String tableName, String entityId) throws SQLException {
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            WatermarkRow row = session.getMapper(WatermarkMapper.class).find(tableName, entityId);
            return row == null ? Optional.empty() : Optional.of(toWatermark(row));
        } catch (PersistenceException e) {
            throw MyBatisSupport.toSqlException(e);
        }
    }

    @Override
    public Map<String, Watermark> findAll(String tableName) throws SQLException {
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            Map<String, Watermark> out = new LinkedHashMap<>();
            for (WatermarkRow row : session.getMapper(WatermarkMapper.class).findAll(tableName)) {
                out.put(row.getEntityId(), toWatermark(row));
            }
            return out;
        } catch (PersistenceException e) {
            throw MyBatisSupport.toSqlException(e);
        }
    }

    @Override
    public void markSuccess(String tableName, String entityId, LocalDate period, String fingerprint, Instant at)
            throws SQLException {
        upsertSuccess(tableName, entityId, period, fingerprint, FetchStatus.SUCCESS, at);
    }

    @Override
    public void markEmpty(String tableName, String entityId, Instant at) throws SQLException {
        upsertSuccess(tableName, entityId, null, null, FetchStatus.EMPTY, at);
    }

    @Override
    public int markFailure(String tableName, String entityId, FailureReason reason, Instant at) throws SQLException {
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            conn.setAutoCommit(false);
            Integer failures = session.getMapper(WatermarkMapper.class).markFailure(WatermarkUpdateParam.builder()
                    .tableName(tableName)
                    .entityId(entityId)
                    .failureReason((reason == null ? FailureReason.OTHER : reason).label())
                    .at(DbTime.utc(at))
                    .build());
            conn.commit();
            if (failures == null) {
                throw new SQLException("markFailure returned no row for " + tableName + "/" + entityId);
            }
            return failures;
        } catch (PersistenceException e) {
            throw MyBatisSupport.toSqlException(e);
        }
    }

    @Override
    public int resetFailures(String tableName, String entityId, Instant at) throws SQLException {
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            conn.setAutoCommit(false);
            int rows = session.getMapper(WatermarkMapper.class).resetFailures(tableName, entityId, DbTime.utc(at));
            conn.commit();
            return rows;
        } catch (PersistenceException e) {
            throw MyBatisSupport.toSqlException(e);
        }
    }

    @Override
    public List<Watermark> listAtOrAboveFailures(String tableName, int failureCeiling) throws SQLException {
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            List<Watermark> out = new ArrayList<>();
            for (WatermarkRow row : session.getMapper(WatermarkMapper.class).listAtOrAboveFailures(tableName, failureCeiling)) {
                out.add(toWatermark(row));
            }
            return out;
        } catch (PersistenceException e) {
            throw MyBatisSupport.toSqlException(e);
        }
    }

    private void upsertSuccess(
            String tableName,
            String entityId,
            LocalDate period,
            String fingerprint,
            FetchStatus status,
            Instant at
    ) throws SQLException {
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            conn.setAutoCommit(false);
            session.getMapper(WatermarkMapper.class).markSuccess(WatermarkUpdateParam.builder()
                    .tableName(tableName)
                    .entityId(entityId)
                    .period(period)
                    .fingerprint(fingerprint)
                    .status(status.label())
                    .at(DbTime.utc(at))
                    .build());
            conn.commit();
        } catch (PersistenceException e) {
            throw MyBatisSupport.toSqlException(e);
        }
    }

    private static Watermark toWatermark(WatermarkRow row) {
        return new Watermark(
                row.getTableName(),
                row.getEntityId(),
                row.getLastPeriodCovered(),
                DbTime.instant(row.getLastSuccessTime()),
                row.getLastFingerprint(),
                FetchStatus.fromLabel(row.getLastStatus()),
                Math.max(0, row.getConsecutiveFailures()),
                row.getLastFailureReason(),
                DbTime.instant(row.getLastFailureTime()),
                DbTime.instant(row.getUpdatedAt())
        );
    }
}
