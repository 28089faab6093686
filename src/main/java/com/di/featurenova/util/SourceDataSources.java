package com.di.featurenova.util;

import com.di.featurenova.config.JdbcSourceSnapshot;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Creates the HikariCP pool a JDBC record source reads through. One pool per
 * run; the caller closes it when the run's ingestion finishes.
 */
@Slf4j
public final class SourceDataSources {

    /** Stable, positive pool ids for monitoring. */
    private static final AtomicInteger poolIdCounter = new AtomicInteger(0);

    private SourceDataSources() {
    }

    public static HikariDataSource open(JdbcSourceSnapshot snapshot) {
        HikariConfig config = new HikariConfig();
        config.setJdbcUrl(snapshot.jdbcUrl());
        config.setUsername(snapshot.username());
        config.setPassword(snapshot.password());
        if (snapshot.driverClassName() != null && !snapshot.driverClassName().isBlank()) {
            config.setDriverClassName(snapshot.driverClassName());
        }
        config.setMaximumPoolSize(snapshot.maximumPoolSize());
        config.setMinimumIdle(0);
        config.setConnectionTimeout(snapshot.connectionTimeoutMs());
        config.setReadOnly(true);

        // Keyset batches are independent queries; no transaction spans them
        config.setAutoCommit(true);

        if (snapshot.jdbcUrl().contains("postgresql")) {
            config.addDataSourceProperty("tcpKeepAlive", "true");
        }
        config.setPoolName("FeatureNovaSource-" + poolIdCounter.incrementAndGet() + "-" + shortPoolKey(snapshot));

        log.info("[POOL] Creating | url={} | user={} | maxPoolSize={}",
                sanitizeUrl(snapshot.jdbcUrl()), snapshot.username(), snapshot.maximumPoolSize());
        return new HikariDataSource(config);
    }

    /** Masks passwords embedded in JDBC URLs. */
    public static String sanitizeUrl(String jdbcUrl) {
        if (jdbcUrl == null) {
            return "null";
        }
        return jdbcUrl.replaceAll("password=[^;&]+", "password=***");
    }

    /** Readable pool key from host, database and user; never contains the password. */
    static String shortPoolKey(JdbcSourceSnapshot snapshot) {
        String url  = sanitizeUrl(snapshot.jdbcUrl());
        String user = snapshot.username() != null ? snapshot.username() : "unknown";
        String part = url;
        int slashSlash = url.indexOf("//");
        if (slashSlash >= 0) {
            part = url.substring(slashSlash + 2);
        }
        int slashDb = part.indexOf('/');
        String hostPort = slashDb >= 0 ? part.substring(0, slashDb) : part;
        String db = slashDb >= 0 && slashDb < part.length() - 1 ? part.substring(slashDb + 1).split("[?;]")[0] : "";
        String host = hostPort.split(":")[0];
        String safe = (host + "_" + db + "_" + user).replaceAll("[^a-zA-Z0-9_]", "_").replaceAll("_+", "_");
        return safe.isEmpty() ? "pool" : safe;
    }
}
