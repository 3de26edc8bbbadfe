package com.fincraft.etl.db;

import com.fincraft.etl.catalog.CoverageInputs;
import com.fincraft.etl.catalog.CoverageScorer;
import com.fincraft.etl.db.mybatis.CoverageInputRow;
import com.fincraft.etl.db.mybatis.CoverageMapper;
import com.fincraft.etl.db.mybatis.MyBatisSupport;
import com.fincraft.etl.store.CoverageSignalProvider;
import com.fincraft.etl.table.TableDescriptor;
import com.fincraft.etl.table.TableRegistry;
import org.apache.ibatis.exceptions.PersistenceException;
import org.apache.ibatis.session.SqlSession;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.LocalDate;
import java.util.HashMap;
import java.util.Map;

/**
 * Coverage signal derived from what is already stored: breadth across tables of the same
 * entity kind, recency and depth in the scheduled table.
 */
public final class CoverageDao implements CoverageSignalProvider {
    private final Database database;
    private final TableRegistry registry;
    private final CoverageScorer scorer;

    public CoverageDao(Database database, TableRegistry registry, CoverageScorer scorer) {
        this.database = database;
        this.registry = registry;
        this.scorer = scorer;
    }

    @Override
    public Map<String, Double> coverageScores(String tableName, LocalDate asOf) throws SQLException {
        TableDescriptor descriptor = registry.require(tableName);
        int tracked = 0;
        for (TableDescriptor d : registry.all()) {
            if (d.getEntityKind() == descriptor.getEntityKind()) {
                tracked++;
            }
        }
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            Map<String, Double> out = new HashMap<>();
            for (CoverageInputRow row : session.getMapper(CoverageMapper.class)
                    .selectInputs(tableName, descriptor.getEntityKind().name())) {
                CoverageInputs inputs = new CoverageInputs(
                        row.getEntityId(), row.getTablesWithData(), tracked, row.getLatestPeriod(), row.getRecordCount());
                out.put(row.getEntityId(), scorer.score(inputs, asOf));
            }
            return out;
        } catch (PersistenceException e) {
            throw MyBatisSupport.toSqlException(e);
        }
    }
}
