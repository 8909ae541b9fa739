package com.tabledesigner.config;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;

/**
 * Builds HikariCP pools over SQLite database files.
 */
public final class SqliteDataSources {

    private SqliteDataSources() {
    }

    public static HikariDataSource create(String path, String poolName, DesignerSettings settings) {
        HikariConfig config = new HikariConfig();
        config.setExceptionOverrideClassName(SqliteExceptionOverride.class.getName());
        config.setDriverClassName("org.sqlite.JDBC");
        config.setJdbcUrl("jdbc:sqlite:" + path);
        // passed to the driver as connection pragmas
        config.addDataSourceProperty("busy_timeout", String.valueOf(settings.busyTimeoutMs()));
        config.setMaximumPoolSize(Math.max(1, settings.poolMaxSize()));
        config.setMinimumIdle(1);
        config.setPoolName(poolName);
        return new HikariDataSource(config);
    }
}
