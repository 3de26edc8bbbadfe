package com.fincraft.etl.db;

import org.apache.logging.log4j.Logger;

import java.lang.reflect.InvocationHandler;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Proxy;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.Statement;
import java.util.Locale;

/**
 * JDBC proxy that logs every executed statement. Statements at or above the slow threshold log at INFO.
 */
final class SqlLogProxy {
    private static final int MAX_SQL_CHARS = 800;

    private SqlLogProxy() {
    }

    static Connection wrapConnection(Connection delegate, Logger logger, long slowMs) {
        return (Connection) Proxy.newProxyInstance(
                Connection.class.getClassLoader(),
                new Class[]{Connection.class},
                new ConnectionHandler(delegate, logger, slowMs)
        );
    }

    private static final class ConnectionHandler implements InvocationHandler {
        private final Connection delegate;
        private final Logger logger;
        private final long slowMs;

        private ConnectionHandler(Connection delegate, Logger logger, long slowMs) {
            this.delegate = delegate;
            this.logger = logger;
            this.slowMs = slowMs;
        }

        @Override
        public Object invoke(Object proxy, Method method, Object[] args) throws Throwable {
            Object out = invokeDelegate(delegate, method, args);
            String name = method.getName();
            if ("prepareStatement".equals(name) && args != null && args.length > 0
                    && args[0] instanceof String && out instanceof PreparedStatement) {
                return Proxy.newProxyInstance(
                        PreparedStatement.class.getClassLoader(),
                        new Class[]{PreparedStatement.class},
                        new StatementHandler(out, (String) args[0], logger, slowMs)
                );
            }
            if ("createStatement".equals(name) && out instanceof Statement) {
                return Proxy.newProxyInstance(
                        Statement.class.getClassLoader(),
                        new Class[]{Statement.class},
                        new StatementHandler(out, null, logger, slowMs)
                );
            }
            return out;
        }
    }

    /**
     * Handles both plain and prepared statements; a null {@code preparedSql} means the SQL arrives with execute.
     */
    private static final class StatementHandler implements InvocationHandler {
        private final Object delegate;
        private final String preparedSql;
        private final Logger logger;
        private final long slowMs;
        private int pendingBatchCount;

        private StatementHandler(Object delegate, String preparedSql, Logger logger, long slowMs) {
            this.delegate = delegate;
            this.preparedSql = preparedSql;
            this.logger = logger;
            this.slowMs = slowMs;
        }

        @Override
        public Object invoke(Object proxy, Method method, Object[] args) throws Throwable {
            String name = method.getName();
            if ("addBatch".equals(name) && (args == null || args.length == 0)) {
                pendingBatchCount++;
            }
            if (!isExecuteMethod(name)) {
                return invokeDelegate(delegate, method, args);
            }
            String sql = preparedSql;
            if (sql == null) {
                sql = args != null && args.length > 0 && args[0] instanceof String ? (String) args[0] : "";
            }
            if (name.endsWith("Batch")) {
                sql = sql + " [batched_statements=" + pendingBatchCount + "]";
                pendingBatchCount = 0;
            }
            long started = System.nanoTime();
            try {
                Object out = method.invoke(delegate, args);
                logSuccess(name, sql, System.nanoTime() - started, out);
                return out;
            } catch (InvocationTargetException e) {
                Throwable target = e.getTargetException();
                logger.warn(
                        "SQL fail method={} elapsed_ms={} err={} sql={}",
                        name,
                        formatMs(System.nanoTime() - started),
                        target == null ? "" : target.getMessage(),
                        normalizeSql(sql)
                );
                throw target;
            }
        }

        private void logSuccess(String method, String sql, long elapsedNanos, Object result) {
            boolean slow = elapsedNanos / 1_000_000L >= slowMs;
            if (slow ? !logger.isInfoEnabled() : !logger.isDebugEnabled()) {
                return;
            }
            String message = "SQL ok method={} elapsed_ms={}{} sql={}";
            Object[] params = {method, formatMs(elapsedNanos), resultSummary(result), normalizeSql(sql)};
            if (slow) {
                logger.info("[slow] " + message, params);
            } else {
                logger.debug(message, params);
            }
        }
    }

    private static Object invokeDelegate(Object delegate, Method method, Object[] args) throws Throwable {
        try {
            return method.invoke(delegate, args);
        } catch (InvocationTargetException e) {
            throw e.getTargetException();
        }
    }

    private static boolean isExecuteMethod(String method) {
        return "execute".equals(method)
                || "executeQuery".equals(method)
                || "executeUpdate".equals(method)
                || "executeLargeUpdate".equals(method)
                || "executeBatch".equals(method)
                || "executeLargeBatch".equals(method);
    }

    static String normalizeSql(String sql) {
        if (sql == null) {
            return "";
        }
        String normalized = sql.replaceAll("\\s+", " ").trim();
        return normalized.length() <= MAX_SQL_CHARS ? normalized : normalized.substring(0, MAX_SQL_CHARS) + "...";
    }

    private static String resultSummary(Object result) {
        if (result instanceof Integer || result instanceof Long) {
            return " rows=" + result;
        }
        if (result instanceof int[]) {
            return " batch_size=" + ((int[]) result).length;
        }
        if (result instanceof long[]) {
            return " batch_size=" + ((long[]) result).length;
        }
        if (result instanceof Boolean) {
            return " has_result_set=" + result;
        }
        return "";
    }

    private static String formatMs(long nanos) {
        return String.format(Locale.US, "%.3f", nanos / 1_000_000.0);
    }
}
