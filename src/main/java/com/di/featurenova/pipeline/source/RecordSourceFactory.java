package com.di.featurenova.pipeline.source;

import com.di.featurenova.config.SourceProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Opens the configured {@link RecordSource}. Each call returns a fresh source
 * that the caller must close.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RecordSourceFactory {

    private final SourceProperties properties;

    public RecordSource open() {
        return switch (properties.getType()) {
            case JDBC -> {
                var snapshot = properties.toJdbcSnapshot();
                log.info("[SOURCE] Opening JDBC source {}", snapshot);
                yield JdbcRecordSource.pooled(snapshot);
            }
            case JSONL -> {
                String path = properties.getJsonl().getPath();
                if (path == null || path.isBlank()) {
                    throw new IllegalStateException("featurenova.source.jsonl.path is not configured");
                }
                Path file = Paths.get(path.trim());
                if (!Files.isReadable(file)) {
                    throw new RecordSourceException("JSONL source file is not readable: " + file);
                }
                log.info("[SOURCE] Opening JSONL source {}", file);
                yield new JsonLinesRecordSource(file);
            }
        };
    }
}
