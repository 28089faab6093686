package com.di.featurenova.pipeline.error;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Required columns are missing from at least one partition. Fatal: the
 * validation stage writes no validated copies when this is raised.
 */
public class SchemaValidationException extends PipelineException {

    private final Map<String, List<String>> missingColumns;

    /**
     * @param missingColumns partition name ({@code train} / {@code test}) to the
     *                       required columns it lacks; partitions with nothing
     *                       missing may be omitted
     */
    public SchemaValidationException(Map<String, List<String>> missingColumns) {
        super("validation", describe(missingColumns), Map.of("missingColumns", copy(missingColumns)), null);
        this.missingColumns = copy(missingColumns);
    }

    public Map<String, List<String>> getMissingColumns() {
        return missingColumns;
    }

    private static Map<String, List<String>> copy(Map<String, List<String>> in) {
        Map<String, List<String>> out = new LinkedHashMap<>();
        in.forEach((k, v) -> out.put(k, List.copyOf(v)));
        return Collections.unmodifiableMap(out);
    }

    private static String describe(Map<String, List<String>> missing) {
        return "Schema validation failed: " + missing.entrySet().stream()
                .map(e -> e.getKey() + " partition missing " + e.getValue())
                .collect(Collectors.joining("; "));
    }
}
