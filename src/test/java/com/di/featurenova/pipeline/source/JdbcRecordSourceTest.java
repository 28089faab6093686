package com.di.featurenova.pipeline.source;

import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("JdbcRecordSource Tests")
class JdbcRecordSourceTest {

    private JdbcDataSource dataSource;

    @BeforeEach
    void setUp() {
        dataSource = new JdbcDataSource();
        dataSource.setURL("jdbc:h2:mem:" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
        JdbcTemplate jdbc = new JdbcTemplate(dataSource);
        jdbc.execute("CREATE TABLE \"features\" (\"id\" INT PRIMARY KEY, \"score\" DOUBLE, \"label\" VARCHAR(10))");
        for (int i = 1; i <= 7; i++) {
            jdbc.update("INSERT INTO \"features\" VALUES (?, ?, ?)", i * 10, i * 0.5, i % 2 == 0 ? "even" : "odd");
        }
    }

    @Test
    @DisplayName("Should page through the table by key in bounded batches")
    void testKeysetPaging() {
        JdbcRecordSource source = new JdbcRecordSource(dataSource, null, "features", "id", true);
        List<Integer> sizes = new ArrayList<>();
        List<Object> ids = new ArrayList<>();
        try (RecordCursor cursor = source.openCursor(3, Duration.ofSeconds(5))) {
            List<SourceRecord> batch;
            while (!(batch = cursor.nextBatch()).isEmpty()) {
                sizes.add(batch.size());
                batch.forEach(r -> ids.add(((Number) r.get("id")).intValue()));
            }
        }
        assertEquals(List.of(3, 3, 1), sizes);
        assertEquals(List.of(10, 20, 30, 40, 50, 60, 70), ids);
    }

    @Test
    @DisplayName("Should drop the key column unless asked to keep it")
    void testExcludeKeyColumn() {
        JdbcRecordSource source = new JdbcRecordSource(dataSource, null, "features", "id", false);
        try (RecordCursor cursor = source.openCursor(100, Duration.ofSeconds(5))) {
            SourceRecord first = cursor.nextBatch().get(0);
            assertFalse(first.has("id"));
            assertEquals(List.of("score", "label"), new ArrayList<>(first.columns()));
            assertEquals("odd", first.get("label"));
        }
    }

    @Test
    @DisplayName("Should wrap query failures")
    void testMissingTable() {
        JdbcRecordSource source = new JdbcRecordSource(dataSource, null, "absent", "id", false);
        try (RecordCursor cursor = source.openCursor(10, Duration.ofSeconds(5))) {
            assertThrows(RecordSourceException.class, cursor::nextBatch);
        }
    }

    @Test
    @DisplayName("Should reject non-positive batch settings")
    void testInvalidCursorSettings() {
        JdbcRecordSource source = new JdbcRecordSource(dataSource, null, "features", "id", false);
        assertThrows(IllegalArgumentException.class, () -> source.openCursor(0, Duration.ofSeconds(5)));
        assertThrows(IllegalArgumentException.class, () -> source.openCursor(10, Duration.ZERO));
    }
}
