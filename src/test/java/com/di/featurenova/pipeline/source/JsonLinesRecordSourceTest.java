package com.di.featurenova.pipeline.source;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("JsonLinesRecordSource Tests")
class JsonLinesRecordSourceTest {

    @TempDir
    Path dir;

    @Test
    @DisplayName("Should read bounded batches until an empty batch")
    void testBatches() throws Exception {
        Path file = dir.resolve("data.jsonl");
        Files.writeString(file, """
                {"a": 1, "b": "x"}
                {"a": 2.5, "b": null, "c": true}

                {"a": 3, "nested": {"k": 1}}
                """);
        try (JsonLinesRecordSource source = new JsonLinesRecordSource(file);
             RecordCursor cursor = source.openCursor(2, Duration.ofSeconds(1))) {
            List<SourceRecord> first = cursor.nextBatch();
            List<SourceRecord> second = cursor.nextBatch();
            List<SourceRecord> third = cursor.nextBatch();

            assertEquals(2, first.size());
            assertEquals(1, second.size());
            assertTrue(third.isEmpty());
            assertEquals(1, ((Number) first.get(0).get("a")).intValue());
            assertNull(first.get(1).get("b"));
            assertEquals(Boolean.TRUE, first.get(1).get("c"));
            assertEquals("{\"k\":1}", second.get(0).get("nested"));
        }
    }

    @Test
    @DisplayName("Should name the line of a malformed record")
    void testMalformedLine() throws Exception {
        Path file = dir.resolve("bad.jsonl");
        Files.writeString(file, "{\"a\": 1}\n{not json\n");
        try (JsonLinesRecordSource source = new JsonLinesRecordSource(file);
             RecordCursor cursor = source.openCursor(10, Duration.ofSeconds(1))) {
            RecordSourceException ex = assertThrows(RecordSourceException.class, cursor::nextBatch);
            assertTrue(ex.getMessage().contains(":2"));
        }
    }

    @Test
    @DisplayName("Should fail to open a missing file")
    void testMissingFile() {
        JsonLinesRecordSource source = new JsonLinesRecordSource(dir.resolve("absent.jsonl"));
        assertThrows(RecordSourceException.class, () -> source.openCursor(10, Duration.ofSeconds(1)));
    }
}
