package com.di.featurenova.pipeline.transform;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Canonical JSON persistence of {@link FittedPreprocessor}: sorted keys,
 * fixed indentation, no timestamps. Fitting twice on the same data yields
 * byte-identical files.
 */
public final class PreprocessorStore {

    private static final ObjectMapper MAPPER = JsonMapper.builder()
            .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .enable(SerializationFeature.INDENT_OUTPUT)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .build();

    private PreprocessorStore() {
    }

    public static String serialize(FittedPreprocessor preprocessor) {
        try {
            return MAPPER.writeValueAsString(preprocessor) + "\n";
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize preprocessor", e);
        }
    }

    /** Writes a new file; an existing file is an error. */
    public static void save(FittedPreprocessor preprocessor, Path file) throws IOException {
        Files.createDirectories(file.getParent());
        Files.writeString(file, serialize(preprocessor), StandardCharsets.UTF_8,
                StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
    }

    public static FittedPreprocessor load(Path file) throws IOException {
        return MAPPER.readValue(file.toFile(), FittedPreprocessor.class);
    }

    public static FittedPreprocessor deserialize(String json) throws JsonProcessingException {
        return MAPPER.readValue(json, FittedPreprocessor.class);
    }
}
