package com.fincraft.etl.db;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;

/**
 * Idempotent PostgreSQL schema migration runner.
 */
public final class MigrationRunner {
    private static final Logger LOG = LogManager.getLogger(MigrationRunner.class);
    public static final int SCHEMA_VERSION = 1;

    public void run(Database database) throws SQLException {
        String schema = database.schema();
        try (Connection conn = database.connect(); Statement st = conn.createStatement()) {
            st.execute("CREATE SCHEMA IF NOT EXISTS " + schema);
            st.execute(Database.searchPathSql(schema));
            st.execute("CREATE TABLE IF NOT EXISTS metadata (" +
                    "meta_key TEXT PRIMARY KEY," +
                    "meta_value TEXT NOT NULL," +
                    "updated_at TIMESTAMPTZ NOT NULL DEFAULT now()" +
                    ")");

            int currentVersion = readSchemaVersion(conn);
            String lastSql = "";
            try {
                for (String sql : buildStatements()) {
                    lastSql = sql;
                    st.execute(sql);
                }
                writeSchemaVersion(conn, SCHEMA_VERSION);
            } catch (SQLException e) {
                String detail = "migration_failed: schema_version=" + currentVersion
                        + ", target_version=" + SCHEMA_VERSION
                        + ", failed_sql=" + summarizeSql(lastSql)
                        + ", cause=" + (e.getMessage() == null ? "" : e.getMessage());
                LOG.error(detail);
                throw new SQLException(detail, e.getSQLState(), e.getErrorCode(), e);
            }
            if (currentVersion != SCHEMA_VERSION) {
                LOG.info("schema {} migrated from version {} to {}", schema, currentVersion, SCHEMA_VERSION);
            }
        }
    }

    List<String> buildStatements() {
        List<String> sqls = new ArrayList<>();
        sqls.add("CREATE TABLE IF NOT EXISTS entity_catalog (" +
                "entity_id TEXT PRIMARY KEY," +
                "name TEXT NULL," +
                "entity_kind TEXT NOT NULL DEFAULT 'SYMBOL'," +
                "asset_type TEXT NULL," +
                "exchange TEXT NULL," +
                "status TEXT NULL," +
                "active BOOLEAN NOT NULL DEFAULT TRUE," +
                "source TEXT NOT NULL," +
                "updated_at TIMESTAMPTZ NOT NULL DEFAULT now()" +
                ")");
        sqls.add("CREATE INDEX IF NOT EXISTS idx_entity_catalog_kind_active ON entity_catalog(entity_kind, active)");

        sqls.add("CREATE TABLE IF NOT EXISTS extraction_watermarks (" +
                "table_name TEXT NOT NULL," +
                "entity_id TEXT NOT NULL," +
                "last_period_covered DATE NULL," +
                "last_success_time TIMESTAMPTZ NULL," +
                "last_fingerprint TEXT NULL," +
                "last_status TEXT NULL," +
                "consecutive_failures INTEGER NOT NULL DEFAULT 0 CHECK (consecutive_failures >= 0)," +
                "last_failure_reason TEXT NULL," +
                "last_failure_time TIMESTAMPTZ NULL," +
                "updated_at TIMESTAMPTZ NOT NULL DEFAULT now()," +
                "PRIMARY KEY (table_name, entity_id)" +
                ")");
        sqls.add("CREATE INDEX IF NOT EXISTS idx_watermarks_failures ON extraction_watermarks(table_name, consecutive_failures)");

        sqls.add("CREATE TABLE IF NOT EXISTS api_responses_landing (" +
                "id BIGSERIAL PRIMARY KEY," +
                "table_name TEXT NOT NULL," +
                "entity_id TEXT NOT NULL," +
                "run_id TEXT NOT NULL," +
                "status TEXT NOT NULL," +
                "content_fingerprint TEXT NULL," +
                "failure_reason TEXT NULL," +
                "message TEXT NULL," +
                "payload TEXT NULL," +
                "fetched_at TIMESTAMPTZ NOT NULL" +
                ")");
        sqls.add("CREATE INDEX IF NOT EXISTS idx_landing_run ON api_responses_landing(run_id)");
        sqls.add("CREATE INDEX IF NOT EXISTS idx_landing_entity ON api_responses_landing(table_name, entity_id, fetched_at DESC)");

        sqls.add("CREATE TABLE IF NOT EXISTS business_records (" +
                "id BIGSERIAL PRIMARY KEY," +
                "table_name TEXT NOT NULL," +
                "entity_id TEXT NOT NULL," +
                "period DATE NOT NULL," +
                "report_type TEXT NOT NULL," +
                "fields JSONB NOT NULL," +
                "content_fingerprint TEXT NOT NULL," +
                "source_run_id TEXT NULL," +
                "fetched_at TIMESTAMPTZ NOT NULL," +
                "updated_at TIMESTAMPTZ NOT NULL DEFAULT now()," +
                "UNIQUE (table_name, entity_id, period, report_type)" +
                ")");
        sqls.add("CREATE INDEX IF NOT EXISTS idx_business_records_entity ON business_records(entity_id, table_name, period DESC)");

        sqls.add("CREATE TABLE IF NOT EXISTS extraction_runs (" +
                "run_id TEXT PRIMARY KEY," +
                "table_name TEXT NOT NULL," +
                "started_at TIMESTAMPTZ NOT NULL," +
                "finished_at TIMESTAMPTZ NULL," +
                "status TEXT NOT NULL," +
                "scheduled_count INTEGER NOT NULL DEFAULT 0," +
                "inserted_count INTEGER NOT NULL DEFAULT 0," +
                "updated_count INTEGER NOT NULL DEFAULT 0," +
                "unchanged_count INTEGER NOT NULL DEFAULT 0," +
                "empty_count INTEGER NOT NULL DEFAULT 0," +
                "error_count INTEGER NOT NULL DEFAULT 0," +
                "suspended_count INTEGER NOT NULL DEFAULT 0," +
                "notes TEXT NULL" +
                ")");
        sqls.add("CREATE UNIQUE INDEX IF NOT EXISTS uq_extraction_runs_running ON extraction_runs(table_name) " +
                "WHERE status = 'RUNNING'");
        sqls.add("CREATE INDEX IF NOT EXISTS idx_extraction_runs_started ON extraction_runs(started_at DESC)");
        return sqls;
    }

    private int readSchemaVersion(Connection conn) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement("SELECT meta_value FROM metadata WHERE meta_key='schema_version'");
             ResultSet rs = ps.executeQuery()) {
            if (rs.next()) {
                String value = rs.getString(1);
                if (value != null && value.trim().matches("\\d+")) {
                    return Integer.parseInt(value.trim());
                }
            }
        }
        return 0;
    }

    private void writeSchemaVersion(Connection conn, int version) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(
                "INSERT INTO metadata(meta_key, meta_value, updated_at) VALUES('schema_version', ?, now()) " +
                        "ON CONFLICT(meta_key) DO UPDATE SET meta_value=excluded.meta_value, updated_at=excluded.updated_at"
        )) {
            ps.setString(1, Integer.toString(version));
            ps.executeUpdate();
        }
    }

    private String summarizeSql(String sql) {
        if (sql == null || sql.trim().isEmpty()) {
            return "-";
        }
        String oneLine = sql.replaceAll("\\s+", " ").trim();
        return oneLine.length() <= 180 ? oneLine : oneLine.substring(0, 177) + "...";
    }
}
