package com.di.featurenova.pipeline.source;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * One record read from a {@link RecordSource}: column name to scalar, in
 * insertion order. Values are {@link Number}, {@link String}, {@link Boolean}
 * or {@code null}; anything else is kept as its string form.
 */
public final class SourceRecord {

    private final Map<String, Object> values;

    private SourceRecord(Map<String, Object> values) {
        this.values = Collections.unmodifiableMap(values);
    }

    public static SourceRecord of(Map<String, ?> raw) {
        Map<String, Object> out = new LinkedHashMap<>();
        raw.forEach((k, v) -> out.put(k, scalar(v)));
        return new SourceRecord(out);
    }

    public Set<String> columns() {
        return values.keySet();
    }

    public Object get(String column) {
        return values.get(column);
    }

    public boolean has(String column) {
        return values.containsKey(column);
    }

    public Map<String, Object> asMap() {
        return values;
    }

    private static Object scalar(Object v) {
        if (v == null || v instanceof Number || v instanceof String || v instanceof Boolean) {
            return v;
        }
        return v.toString();
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
