package com.fincraft.etl.db;

import com.fincraft.etl.db.mybatis.ExtractionRunRow;
import com.fincraft.etl.db.mybatis.MyBatisSupport;
import com.fincraft.etl.db.mybatis.RunMapper;
import com.fincraft.etl.model.RunRow;
import com.fincraft.etl.store.RunRepository;
import org.apache.ibatis.exceptions.PersistenceException;
import org.apache.ibatis.session.SqlSession;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * DAO for extraction pass bookkeeping.
 */
public final class RunDao implements RunRepository {
    private static final Logger LOG = LogManager.getLogger(RunDao.class);
    private static final String UNIQUE_VIOLATION = "23505";

    private final Database database;

    public RunDao(Database database) {
        this.database = database;
    }

    @Override
    public int recoverDanglingRuns(Instant at) throws SQLException {
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            conn.setAutoCommit(false);
            int rows = session.getMapper(RunMapper.class).recoverDanglingRuns(DbTime.utc(at));
            conn.commit();
            if (rows > 0) {
                LOG.warn("marked {} dangling extraction run(s) as ABORTED", rows);
            }
            return rows;
        } catch (PersistenceException e) {
            throw MyBatisSupport.toSqlException(e);
        }
    }

    @Override
    public void startRun(String runId, String tableName, Instant startedAt, String notes) throws SQLException {
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            conn.setAutoCommit(false);
            session.getMapper(RunMapper.class).insertRun(ExtractionRunRow.builder()
                    .runId(runId)
                    .tableName(tableName)
                    .startedAt(DbTime.utc(startedAt))
                    .notes(notes)
                    .build());
            conn.commit();
        } catch (PersistenceException e) {
            SQLException sql = MyBatisSupport.toSqlException(e);
            if (UNIQUE_VIOLATION.equals(sql.getSQLState())) {
                throw new IllegalStateException("another extraction pass is already RUNNING for table " + tableName, sql);
            }
            throw sql;
        }
    }

    @Override
    public void finishRun(RunRow row) throws SQLException {
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            conn.setAutoCommit(false);
            session.getMapper(RunMapper.class).finishRun(ExtractionRunRow.builder()
                    .runId(row.runId)
                    .finishedAt(DbTime.utc(row.finishedAt))
                    .status(row.status)
                    .scheduledCount(row.scheduledCount)
                    .insertedCount(row.insertedCount)
                    .updatedCount(row.updatedCount)
                    .unchangedCount(row.unchangedCount)
                    .emptyCount(row.emptyCount)
                    .errorCount(row.errorCount)
                    .suspendedCount(row.suspendedCount)
                    .notes(row.notes)
                    .build());
            conn.commit();
        } catch (PersistenceException e) {
            throw MyBatisSupport.toSqlException(e);
        }
    }

    @Override
    public List<RunRow> listRecent(int limit) throws SQLException {
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            List<RunRow> out = new ArrayList<>();
            for (ExtractionRunRow r : session.getMapper(RunMapper.class).listRecent(Math.max(1, limit))) {
                out.add(new RunRow(
                        r.getRunId(),
                        r.getTableName(),
                        DbTime.instant(r.getStartedAt()),
                        DbTime.instant(r.getFinishedAt()),
                        r.getStatus(),
                        r.getScheduledCount(),
                        r.getInsertedCount(),
                        r.getUpdatedCount(),
                        r.getUnchangedCount(),
                        r.getEmptyCount(),
                        r.getErrorCount(),
                        r.getSuspendedCount(),
                        r.getNotes()
                ));
            }
            return out;
        } catch (PersistenceException e) {
            throw MyBatisSupport.toSqlException(e);
        }
    }
}
