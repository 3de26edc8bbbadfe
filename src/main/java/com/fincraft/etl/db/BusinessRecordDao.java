package com.fincraft.etl.db;

import com.fincraft.etl.db.mybatis.BusinessRecordMapper;
import com.fincraft.etl.db.mybatis.BusinessRecordRow;
import com.fincraft.etl.db.mybatis.EntityPeriodRow;
import com.fincraft.etl.db.mybatis.MyBatisSupport;
import com.fincraft.etl.model.BusinessRecord;
import com.fincraft.etl.model.NaturalKey;
import com.fincraft.etl.model.UpsertResult;
import com.fincraft.etl.store.BusinessRecordRepository;
import org.apache.ibatis.exceptions.PersistenceException;
import org.apache.ibatis.session.SqlSession;
import org.json.JSONObject;

import java.math.BigDecimal;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Business rows keyed by (table, entity, period, report type), fields stored as JSONB.
 * The upsert only rewrites a row when its content fingerprint changed.
 */
public final class BusinessRecordDao implements BusinessRecordRepository {
    private final Database database;

    public BusinessRecordDao(Database database) {
        this.database = database;
    }

    @Override
    public Optional<BusinessRecord> find(String tableName, NaturalKey key) throws SQLException {
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            BusinessRecordRow row = session.getMapper(BusinessRecordMapper.class)
                    .find(tableName, key.entityId(), key.period(), key.reportType());
            return row == null ? Optional.empty() : Optional.of(toRecord(row));
        } catch (PersistenceException e) {
            throw MyBatisSupport.toSqlException(e);
        }
    }

    @Override
    public UpsertResult upsert(String tableName, BusinessRecord record) throws SQLException {
        return upsertAll(tableName, List.of(record)).get(0);
    }

    @Override
    public List<UpsertResult> upsertAll(String tableName, List<BusinessRecord> records) throws SQLException {
        List<UpsertResult> out = new ArrayList<>(records.size());
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            conn.setAutoCommit(false);
            BusinessRecordMapper mapper = session.getMapper(BusinessRecordMapper.class);
            for (BusinessRecord record : records) {
                Boolean inserted = mapper.upsert(toRow(tableName, record));
                if (inserted == null) {
                    out.add(UpsertResult.UNCHANGED);
                } else {
                    out.add(inserted ? UpsertResult.INSERTED : UpsertResult.UPDATED);
                }
            }
            conn.commit();
            return out;
        } catch (PersistenceException e) {
            throw MyBatisSupport.toSqlException(e);
        }
    }

    @Override
    public Map<String, LocalDate> latestPeriods(String tableName) throws SQLException {
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            Map<String, LocalDate> out = new HashMap<>();
            for (EntityPeriodRow row : session.getMapper(BusinessRecordMapper.class).latestPeriods(tableName)) {
                out.put(row.getEntityId(), row.getPeriod());
            }
            return out;
        } catch (PersistenceException e) {
            throw MyBatisSupport.toSqlException(e);
        }
    }

    @Override
    public Optional<LocalDate> latestPeriod(String tableName, String entityId, String reportType) throws SQLException {
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            return Optional.ofNullable(session.getMapper(BusinessRecordMapper.class)
                    .latestPeriod(tableName, entityId, reportType));
        } catch (PersistenceException e) {
            throw MyBatisSupport.toSqlException(e);
        }
    }

    @Override
    public int countByEntity(String tableName, String entityId) throws SQLException {
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            return session.getMapper(BusinessRecordMapper.class).countByEntity(tableName, entityId);
        } catch (PersistenceException e) {
            throw MyBatisSupport.toSqlException(e);
        }
    }

    static String fieldsToJson(Map<String, Object> fields) {
        JSONObject json = new JSONObject();
        for (Map.Entry<String, Object> e : fields.entrySet()) {
            json.put(e.getKey(), e.getValue() == null ? JSONObject.NULL : e.getValue());
        }
        return json.toString();
    }

    static Map<String, Object> fieldsFromJson(String text) {
        Map<String, Object> out = new LinkedHashMap<>();
        if (text == null || text.isBlank()) {
            return out;
        }
        JSONObject json = new JSONObject(text);
        for (String key : json.keySet()) {
            Object value = json.get(key);
            if (value == JSONObject.NULL) {
                out.put(key, null);
            } else if (value instanceof Number) {
                out.put(key, new BigDecimal(value.toString()));
            } else {
                out.put(key, value.toString());
            }
        }
        return out;
    }

    private static BusinessRecordRow toRow(String tableName, BusinessRecord record) {
        return BusinessRecordRow.builder()
                .tableName(tableName)
                .entityId(record.entityId)
                .period(record.period)
                .reportType(record.reportType)
                .fieldsJson(fieldsToJson(record.fields))
                .contentFingerprint(record.fingerprint)
                .sourceRunId(record.sourceRunId)
                .fetchedAt(DbTime.utc(record.fetchedAt))
                .build();
    }

    private static BusinessRecord toRecord(BusinessRecordRow row) {
        return new BusinessRecord(
                row.getEntityId(),
                row.getPeriod(),
                row.getReportType(),
                fieldsFromJson(row.getFieldsJson()),
                row.getContentFingerprint(),
                row.getSourceRunId(),
                DbTime.instant(row.getFetchedAt())
        );
    }
}
