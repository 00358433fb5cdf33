package com.record.linkage.relational;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;

/**
 * Builds the pooled {@link javax.sql.DataSource} used for the relational candidate store.
 */
public final class DataSourceFactory {

    private DataSourceFactory() {
        // utility class
    }

    public static HikariDataSource create(RelationalSettings settings) {
        HikariConfig config = new HikariConfig();
        config.setJdbcUrl(settings.getJdbcUrl());
        if (settings.getUsername() != null) {
            config.setUsername(settings.getUsername());
        }
        if (settings.getPassword() != null) {
            config.setPassword(settings.getPassword());
        }
        if (settings.getSchema() != null) {
            config.setSchema(settings.getSchema());
        }
        config.setMaximumPoolSize(settings.getPoolSize());
        config.setMinimumIdle(1);
        config.setPoolName("record-linkage");
        return new HikariDataSource(config);
    }
}
