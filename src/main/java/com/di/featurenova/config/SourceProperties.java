package com.di.featurenova.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Binding for the record source the ingestion stage reads from.
 *
 * <pre>
 * featurenova:
 *   source:
 *     type: JDBC                 # or JSONL
 *     jsonl:
 *       path: /data/export.jsonl
 *     jdbc:
 *       url: jdbc:postgresql://db:5432/features
 *       username: reader
 *       password: ${FEATURENOVA_DB_PASSWORD:}
 *       table: customer_features
 *       key-column: id
 * </pre>
 */
@Data
@Validated
@ConfigurationProperties(prefix = "featurenova.source")
public class SourceProperties {

    public enum Type { JDBC, JSONL }

    @NotNull
    private Type type = Type.JSONL;

    @Valid
    private Jsonl jsonl = new Jsonl();

    @Valid
    private Jdbc jdbc = new Jdbc();

    @Data
    public static class Jsonl {
        /** File with one JSON object per line. */
        private String path = "";
    }

    @Data
    public static class Jdbc {
        private String url = "";
        private String username = "";
        private String password = "";
        /** Empty = let the driver be resolved from the URL. */
        private String driverClassName = "";
        /** Empty = the connection's default schema. */
        private String schema = "";
        private String table = "";
        /** Unique, non-null, ordered column used for keyset pagination. */
        private String keyColumn = "id";
        /** When false the key column is dropped from ingested records. */
        private boolean includeKeyColumn = false;
        @Min(1)
        private int maximumPoolSize = 2;
        @Min(250)
        private long connectionTimeoutMs = 30_000;
    }

    public JdbcSourceSnapshot toJdbcSnapshot() {
        return new JdbcSourceSnapshot(jdbc.url, jdbc.username, jdbc.password, jdbc.driverClassName,
                jdbc.schema, jdbc.table, jdbc.keyColumn, jdbc.includeKeyColumn,
                jdbc.maximumPoolSize, jdbc.connectionTimeoutMs);
    }
}
