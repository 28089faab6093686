package com.di.featurenova.pipeline.source;

import com.di.featurenova.config.JdbcSourceSnapshot;
import com.di.featurenova.util.SourceDataSources;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;

import javax.sql.DataSource;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads a relational table in key order with keyset pagination.
 *
 * <p>Every batch is an independent query
 * {@code SELECT * FROM t [WHERE key > ?] ORDER BY key} capped with
 * {@code setMaxRows(batchSize)} and {@code setQueryTimeout}, so no server-side
 * cursor outlives a batch. The key column must be unique and non-null.
 */
@Slf4j
public class JdbcRecordSource implements RecordSource {

    private final JdbcTemplate  jdbcTemplate;
    private final String        qualifiedTable;
    private final String        keyColumn;
    private final boolean       includeKeyColumn;
    private final String        description;
    private final AutoCloseable ownedResource;

    /**
     * Reads through a caller-owned {@link DataSource}; {@link #close()} does
     * not close it.
     */
    public JdbcRecordSource(DataSource dataSource, String schema, String table,
                            String keyColumn, boolean includeKeyColumn) {
        this(dataSource, schema, table, keyColumn, includeKeyColumn, null, "jdbc:" + table);
    }

    private JdbcRecordSource(DataSource dataSource, String schema, String table, String keyColumn,
                             boolean includeKeyColumn, AutoCloseable ownedResource, String description) {
        this.jdbcTemplate     = new JdbcTemplate(dataSource);
        this.qualifiedTable   = (schema == null || schema.isBlank() ? "" : qi(schema) + ".") + qi(table);
        this.keyColumn        = keyColumn;
        this.includeKeyColumn = includeKeyColumn;
        this.ownedResource    = ownedResource;
        this.description      = description;
    }

    /** Opens a dedicated connection pool that is closed with this source. */
    public static JdbcRecordSource pooled(JdbcSourceSnapshot snapshot) {
        var pool = SourceDataSources.open(snapshot);
        return new JdbcRecordSource(pool, snapshot.schema(), snapshot.table(), snapshot.keyColumn(),
                snapshot.includeKeyColumn(), pool,
                "jdbc:" + SourceDataSources.sanitizeUrl(snapshot.jdbcUrl()) + "/" + snapshot.table());
    }

    @Override
    public String describe() {
        return description;
    }

    @Override
    public RecordCursor openCursor(int batchSize, Duration batchTimeout) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be > 0, got " + batchSize);
        }
        if (batchTimeout == null || batchTimeout.isZero() || batchTimeout.isNegative()) {
            throw new IllegalArgumentException("batchTimeout must be positive, got " + batchTimeout);
        }
        int timeoutSeconds = (int) Math.max(1, (batchTimeout.toMillis() + 999) / 1000);
        return new KeysetCursor(batchSize, timeoutSeconds);
    }

    @Override
    public void close() {
        if (ownedResource != null) {
            try {
                ownedResource.close();
                log.info("[SOURCE] Closed connection pool for {}", description);
            } catch (Exception e) {
                log.warn("[SOURCE] Error closing connection pool for {}", description, e);
            }
        }
    }

    private final class KeysetCursor implements RecordCursor {

        private final int batchSize;
        private final int timeoutSeconds;
        private Object    lastKey;
        private boolean   exhausted;
        private long      batches;

        private KeysetCursor(int batchSize, int timeoutSeconds) {
            this.batchSize      = batchSize;
            this.timeoutSeconds = timeoutSeconds;
        }

        @Override
        public List<SourceRecord> nextBatch() {
            if (exhausted) {
                return List.of();
            }
            String sql = "SELECT * FROM " + qualifiedTable
                    + (lastKey == null ? "" : " WHERE " + qi(keyColumn) + " > ?")
                    + " ORDER BY " + qi(keyColumn);
            final Object after = lastKey;
            List<Object> keys = new ArrayList<>(1);
            List<SourceRecord> batch;
            try {
                batch = jdbcTemplate.query(
                    con -> {
                        var ps = con.prepareStatement(sql, ResultSet.TYPE_FORWARD_ONLY, ResultSet.CONCUR_READ_ONLY);
                        if (after != null) {
                            ps.setObject(1, after);
                        }
                        ps.setMaxRows(batchSize);
                        ps.setFetchSize(batchSize);
                        ps.setQueryTimeout(timeoutSeconds);
                        return ps;
                    },
                    (ResultSet rs) -> {
                        ResultSetMetaData meta   = rs.getMetaData();
                        int               cols   = meta.getColumnCount();
                        String[]          labels = new String[cols];
                        int               keyIdx = -1;
                        for (int i = 0; i < cols; i++) {
                            labels[i] = meta.getColumnLabel(i + 1);
                            if (labels[i].equalsIgnoreCase(keyColumn)) {
                                keyIdx = i;
                            }
                        }
                        if (keyIdx < 0) {
                            throw new RecordSourceException(
                                    "Key column '" + keyColumn + "' not found in " + qualifiedTable);
                        }
                        List<SourceRecord> out = new ArrayList<>();
                        Object key = null;
                        while (rs.next()) {
                            Map<String, Object> values = new LinkedHashMap<>();
                            for (int i = 0; i < cols; i++) {
                                Object v = rs.getObject(i + 1);
                                if (i == keyIdx) {
                                    key = v;
                                    if (!includeKeyColumn) {
                                        continue;
                                    }
                                }
                                values.put(labels[i], v);
                            }
                            out.add(SourceRecord.of(values));
                        }
                        if (key != null) {
                            keys.add(key);
                        }
                        return out;
                    });
            } catch (DataAccessException e) {
                throw new RecordSourceException(
                        "Batch " + (batches + 1) + " from " + qualifiedTable + " failed: " + e.getMostSpecificCause().getMessage(), e);
            }
            batches++;
            if (batch == null || batch.size() < batchSize) {
                exhausted = true;
            }
            if (!keys.isEmpty()) {
                lastKey = keys.get(0);
            }
            log.debug("[SOURCE] Batch {} from {}: {} rows (after key {})", batches, qualifiedTable,
                    batch == null ? 0 : batch.size(), after);
            return batch == null ? List.of() : batch;
        }

        @Override
        public void close() {
            exhausted = true;
        }
    }

    private static String qi(String name) {
        return "\"" + name.replace("\"", "\"\"") + "\"";
    }
}
