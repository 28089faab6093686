package com.di.featurenova.pipeline.schema;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Loads a {@link SchemaSpec} from a YAML schema file.
 *
 * <pre>
 * columns:                 # plain names ...
 *   - age
 *   - income
 * columns:                 # ... or single-entry name: type maps
 *   - age: int64
 *   - income: float64
 * numerical_columns: [age, income]   # optional
 * target_column: label
 * </pre>
 *
 * Loaded once per run; the result is immutable.
 */
@Slf4j
public class SchemaSpecLoader {

    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    public SchemaSpec load(Path schemaFile) {
        try (InputStream in = Files.newInputStream(schemaFile)) {
            return load(in, schemaFile.toString());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read schema file " + schemaFile, e);
        }
    }

    public SchemaSpec load(InputStream in, String sourceName) {
        JsonNode root;
        try {
            root = YAML.readTree(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to parse schema " + sourceName, e);
        }
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("Schema " + sourceName + " is empty or not a mapping");
        }
        Set<String> columns = names(root.get("columns"), "columns", sourceName);
        Set<String> numerical = root.hasNonNull("numerical_columns")
                ? names(root.get("numerical_columns"), "numerical_columns", sourceName)
                : Set.of();
        JsonNode target = root.get("target_column");
        if (target == null || !target.isTextual() || target.asText().isBlank()) {
            throw new IllegalArgumentException("Schema " + sourceName + " has no target_column");
        }
        SchemaSpec spec = new SchemaSpec(columns, target.asText().trim(), numerical);
        log.info("[SCHEMA] Loaded {}: {} required columns, target='{}', numerical={}",
                sourceName, spec.requiredColumns().size(), spec.targetColumn(), spec.numericalColumns());
        return spec;
    }

    private static Set<String> names(JsonNode node, String field, String sourceName) {
        if (node == null || !node.isArray() || node.isEmpty()) {
            throw new IllegalArgumentException("Schema " + sourceName + " field '" + field + "' must be a non-empty list");
        }
        Set<String> out = new LinkedHashSet<>();
        for (JsonNode item : node) {
            String name;
            if (item.isTextual()) {
                name = item.asText();
            } else if (item.isObject() && item.size() == 1) {
                Iterator<Map.Entry<String, JsonNode>> it = item.fields();
                name = it.next().getKey();
            } else {
                throw new IllegalArgumentException(
                        "Schema " + sourceName + " field '" + field + "' has an unsupported entry: " + item);
            }
            if (name.isBlank()) {
                throw new IllegalArgumentException("Schema " + sourceName + " field '" + field + "' has a blank name");
            }
            if (!out.add(name.trim())) {
                log.warn("[SCHEMA] Duplicate column '{}' in {} of {}", name, field, sourceName);
            }
        }
        return out;
    }
}
