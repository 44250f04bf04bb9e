package com.findmydevice.dao;

import com.findmydevice.config.DbConfig;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import java.sql.Connection;
import java.sql.SQLException;
import javax.sql.DataSource;

public final class DbClient implements AutoCloseable {
    private final HikariDataSource dataSource;
    private final int queryTimeoutSec;

    public DbClient(DbConfig dbConfig) {
        var cfg = new HikariConfig();
        cfg.setJdbcUrl(dbConfig.jdbcUrl());
        cfg.setUsername(dbConfig.username());
        cfg.setPassword(dbConfig.password());
        cfg.setMaximumPoolSize(dbConfig.maxPoolSize());
        cfg.setPoolName(dbConfig.poolName());
        cfg.setConnectionTimeout(dbConfig.connectionTimeoutMs());
        cfg.setAutoCommit(true);
        this.dataSource = new HikariDataSource(cfg);
        this.queryTimeoutSec = dbConfig.queryTimeoutSec();
    }

    public Connection getConnection() throws SQLException {
        return dataSource.getConnection();
    }

    public DataSource dataSource() {
        return dataSource;
    }

    public int queryTimeoutSec() {
        return queryTimeoutSec;
    }

    @Override
    public void close() {
        dataSource.close();
    }
}
