package com.fincraft.etl.db.mybatis;

import org.apache.ibatis.exceptions.PersistenceException;
import org.apache.ibatis.session.Configuration;
import org.apache.ibatis.session.SqlSession;
import org.apache.ibatis.session.SqlSessionFactory;
import org.apache.ibatis.session.SqlSessionFactoryBuilder;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Centralized MyBatis bootstrap for the extraction store mappers.
 */
public final class MyBatisSupport {
    private static final SqlSessionFactory FACTORY = buildFactory();

    private MyBatisSupport() {
    }

    public static SqlSession openSession(Connection connection) {
        return FACTORY.openSession(connection);
    }

    /**
     * MyBatis wraps driver errors in an unchecked exception; DAOs hand them back as SQLException.
     */
    public static SQLException toSqlException(PersistenceException e) {
        Throwable cause = e.getCause();
        while (cause != null) {
            if (cause instanceof SQLException) {
                return (SQLException) cause;
            }
            cause = cause.getCause();
        }
        return new SQLException(e.getMessage(), e);
    }

    private static SqlSessionFactory buildFactory() {
        Configuration config = new Configuration();
        config.setMapUnderscoreToCamelCase(true);
        config.setCacheEnabled(false);

        config.addMapper(CatalogMapper.class);
        config.addMapper(WatermarkMapper.class);
        config.addMapper(LandingMapper.class);
        config.addMapper(BusinessRecordMapper.class);
        config.addMapper(RunMapper.class);
        config.addMapper(CoverageMapper.class);

        return new SqlSessionFactoryBuilder().build(config);
    }
}
