package com.di.featurenova.config;

import java.io.Serializable;

/**
 * Immutable JDBC source settings for one run. {@link #toString()} masks the
 * password.
 */
public record JdbcSourceSnapshot(String jdbcUrl, String username, String password, String driverClassName,
                                 String schema, String table, String keyColumn, boolean includeKeyColumn,
                                 int maximumPoolSize, long connectionTimeoutMs) implements Serializable {

    public JdbcSourceSnapshot {
        if (jdbcUrl == null || jdbcUrl.isBlank()) {
            throw new IllegalArgumentException("jdbcUrl is required for a JDBC source");
        }
        if (table == null || table.isBlank()) {
            throw new IllegalArgumentException("table is required for a JDBC source");
        }
        if (keyColumn == null || keyColumn.isBlank()) {
            throw new IllegalArgumentException("keyColumn is required for a JDBC source");
        }
        if (maximumPoolSize < 1) {
            maximumPoolSize = 1;
        }
    }

    @Override
    public String toString() {
        return "JdbcSourceSnapshot[jdbcUrl=" + jdbcUrl + ", username=" + username + ", password=***"
                + ", schema=" + schema + ", table=" + table + ", keyColumn=" + keyColumn
                + ", includeKeyColumn=" + includeKeyColumn + ", maximumPoolSize=" + maximumPoolSize + "]";
    }
}
