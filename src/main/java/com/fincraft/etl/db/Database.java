package com.fincraft.etl.db;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.postgresql.ds.PGSimpleDataSource;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * PostgreSQL access for the extraction stores. Every connection is pinned to the configured schema.
 */
public final class Database {
    private static final Logger LOG = LogManager.getLogger(Database.class);
    private static final Logger SQL_LOG = LogManager.getLogger("SQL");
    private static final Pattern SCHEMA_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
    private static final int CONNECT_TIMEOUT_SEC = 10;
    public static final String DEFAULT_SCHEMA = "source";

    private final DataSource dataSource;
    private final String jdbcUrl;
    private final String schema;
    private final boolean sqlLogEnabled;
    private final long slowSqlMs;

    public Database(String jdbcUrl, String user, String pass, String schema, boolean sqlLogEnabled, long slowSqlMs) {
        this.jdbcUrl = requirePostgresUrl(jdbcUrl);
        this.schema = normalizeSchema(schema);
        this.sqlLogEnabled = sqlLogEnabled;
        this.slowSqlMs = Math.max(0L, slowSqlMs);
        this.dataSource = buildDataSource(this.jdbcUrl, user, pass, this.schema);
    }

    public Connection connect() throws SQLException {
        Connection raw;
        try {
            raw = dataSource.getConnection();
        } catch (SQLException e) {
            String hint = classifyConnectFailure(e);
            LOG.error("connect failed url={} schema={} hint={} sqlstate={}: {}",
                    maskedJdbcUrl(), schema, hint, e.getSQLState(), e.getMessage());
            throw new SQLException("cannot connect to " + maskedJdbcUrl() + " (" + hint + ")",
                    e.getSQLState(), e.getErrorCode(), e);
        }
        try (Statement st = raw.createStatement()) {
            st.execute(searchPathSql(schema));
        } catch (SQLException e) {
            raw.close();
            throw e;
        }
        return sqlLogEnabled ? SqlLogProxy.wrapConnection(raw, SQL_LOG, slowSqlMs) : raw;
    }

    public String schema() {
        return schema;
    }

    public String maskedJdbcUrl() {
        return jdbcUrl
                .replaceAll("(?i)(password=)[^&]+", "$1***")
                .replaceAll("(://[^:/@]+:)[^@]+(@)", "$1***$2");
    }

    static String searchPathSql(String schema) {
        return "SET search_path TO " + schema + ", public";
    }

    static String normalizeSchema(String raw) {
        String value = raw == null || raw.isBlank() ? DEFAULT_SCHEMA : raw.trim();
        if (!SCHEMA_NAME.matcher(value).matches()) {
            throw new IllegalArgumentException("db.schema '" + value + "' must match " + SCHEMA_NAME.pattern());
        }
        return value;
    }

    /**
     * Operator hint for a failed connect. PostgreSQL SQLSTATE first, message text as fallback.
     */
    static String classifyConnectFailure(SQLException e) {
        String state = e == null || e.getSQLState() == null ? "" : e.getSQLState();
        if (state.startsWith("28")) {
            return "auth";
        }
        if ("3D000".equals(state)) {
            return "missing_database";
        }
        if (state.startsWith("08")) {
            return "unreachable";
        }
        String msg = e == null || e.getMessage() == null ? "" : e.getMessage().toLowerCase(Locale.ROOT);
        if (msg.contains("password authentication failed") || msg.contains("permission denied")) {
            return "auth";
        }
        if (msg.contains("connection refused") || msg.contains("connection attempt failed")) {
            return "unreachable";
        }
        if (msg.contains("does not exist")) {
            return "missing_database";
        }
        return "connection_error";
    }

    private static String requirePostgresUrl(String raw) {
        String url = raw == null ? "" : raw.trim();
        if (url.isEmpty()) {
            throw new IllegalArgumentException("db.url must not be empty");
        }
        if (!url.toLowerCase(Locale.ROOT).startsWith("jdbc:postgresql:")) {
            throw new IllegalArgumentException("db.url must be a jdbc:postgresql:// URL");
        }
        return url;
    }

    private static DataSource buildDataSource(String url, String user, String pass, String schema) {
        PGSimpleDataSource pg = new PGSimpleDataSource();
        pg.setUrl(url);
        if (user != null && !user.isBlank()) {
            pg.setUser(user.trim());
        }
        if (pass != null) {
            pg.setPassword(pass);
        }
        pg.setCurrentSchema(schema);
        pg.setApplicationName("fincraft-etl");
        pg.setConnectTimeout(CONNECT_TIMEOUT_SEC);
        pg.setTcpKeepAlive(true);
        return pg;
    }
}
