package com.di.featurenova.pipeline.source;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads one JSON object per line from a local file (an export of the
 * document store). Blank lines are skipped.
 *
 * <p>Reads are local, so the batch timeout is not enforced.
 */
@Slf4j
public class JsonLinesRecordSource implements RecordSource {

    private static final ObjectMapper JSON = new ObjectMapper();

    private final Path file;

    public JsonLinesRecordSource(Path file) {
        this.file = file;
    }

    @Override
    public String describe() {
        return "jsonl:" + file;
    }

    @Override
    public RecordCursor openCursor(int batchSize, Duration batchTimeout) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be > 0, got " + batchSize);
        }
        try {
            return new Cursor(Files.newBufferedReader(file, StandardCharsets.UTF_8), batchSize);
        } catch (IOException e) {
            throw new RecordSourceException("Cannot open " + file, e);
        }
    }

    @Override
    public void close() {
        // cursors own their readers
    }

    private final class Cursor implements RecordCursor {

        private final BufferedReader reader;
        private final int            batchSize;
        private long                 lineNumber;
        private boolean              exhausted;

        private Cursor(BufferedReader reader, int batchSize) {
            this.reader    = reader;
            this.batchSize = batchSize;
        }

        @Override
        public List<SourceRecord> nextBatch() {
            List<SourceRecord> batch = new ArrayList<>(Math.min(batchSize, 1024));
            if (exhausted) {
                return batch;
            }
            try {
                while (batch.size() < batchSize) {
                    String line = reader.readLine();
                    if (line == null) {
                        exhausted = true;
                        break;
                    }
                    lineNumber++;
                    if (line.isBlank()) {
                        continue;
                    }
                    batch.add(parse(line));
                }
            } catch (IOException e) {
                throw new RecordSourceException("Read failed at " + file + ":" + lineNumber, e);
            }
            return batch;
        }

        private SourceRecord parse(String line) {
            JsonNode node;
            try {
                node = JSON.readTree(line);
            } catch (JsonProcessingException e) {
                throw new RecordSourceException("Malformed JSON at " + file + ":" + lineNumber, e);
            }
            if (node == null || !node.isObject()) {
                throw new RecordSourceException("Expected a JSON object at " + file + ":" + lineNumber);
            }
            Map<String, Object> values = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> f = fields.next();
                values.put(f.getKey(), scalar(f.getValue()));
            }
            return SourceRecord.of(values);
        }

        @Override
        public void close() {
            try {
                reader.close();
            } catch (IOException e) {
                log.warn("[SOURCE] Failed to close {}: {}", file, e.getMessage());
            }
        }
    }

    private static Object scalar(JsonNode v) {
        if (v == null || v.isNull() || v.isMissingNode()) {
            return null;
        }
        if (v.isNumber()) {
            return v.numberValue();
        }
        if (v.isBoolean()) {
            return v.booleanValue();
        }
        if (v.isTextual()) {
            return v.textValue();
        }
        return v.toString();
    }
}
