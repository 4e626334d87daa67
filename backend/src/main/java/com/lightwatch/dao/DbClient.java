package com.lightwatch.dao;

import com.lightwatch.config.DbConfig;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import java.sql.Connection;
import java.sql.SQLException;
import javax.sql.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.tinkoff.kora.common.Component;

@Component
public final class DbClient implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(DbClient.class);

    private final HikariDataSource dataSource;

    public DbClient(DbConfig dbConfig) {
        var cfg = new HikariConfig();
        cfg.setJdbcUrl(dbConfig.jdbcUrl());
        cfg.setUsername(dbConfig.username());
        cfg.setPassword(dbConfig.password());
        cfg.setMaximumPoolSize(dbConfig.maxPoolSize());
        cfg.setPoolName(dbConfig.poolName());
        cfg.setConnectionTimeout(dbConfig.connectionTimeout().toMillis());
        cfg.setAutoCommit(true);
        this.dataSource = new HikariDataSource(cfg);
        logger.info("Connection pool {} started, max size {}", dbConfig.poolName(), dbConfig.maxPoolSize());
    }

    public Connection getConnection() throws SQLException {
        return dataSource.getConnection();
    }

    public Connection beginTransaction() throws SQLException {
        Connection connection = dataSource.getConnection();
        connection.setAutoCommit(false);
        return connection;
    }

    public DataSource dataSource() {
        return dataSource;
    }

    @Override
    public void close() {
        dataSource.close();
    }
}
