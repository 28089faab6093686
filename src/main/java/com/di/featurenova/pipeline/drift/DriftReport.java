package com.di.featurenova.pipeline.drift;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-column drift results in train column order. Advisory: a drifted column
 * never fails a run.
 */
public record DriftReport(double alpha, List<ColumnDrift> columns) {

    public DriftReport {
        columns = List.copyOf(columns);
    }

    public boolean driftDetected() {
        return columns.stream().anyMatch(ColumnDrift::drifted);
    }

    public List<String> driftedColumns() {
        return columns.stream().filter(ColumnDrift::drifted).map(ColumnDrift::column).toList();
    }

    public ColumnDrift column(String name) {
        return columns.stream()
                .filter(c -> c.column().equals(name))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("No drift entry for column '" + name + "'"));
    }

    /**
     * Document form written to {@code report.yaml}:
     * <pre>
     * test: kolmogorov_smirnov
     * alpha: 0.05
     * drift_detected: false
     * columns:
     *   age: {applicable: true, drift_status: false, statistic: 0.08, p_value: 0.91, train_size: 80, test_size: 20}
     *   city: {applicable: false, drift_status: false, reason: "..."}
     * </pre>
     */
    public Map<String, Object> toDocument() {
        Map<String, Object> doc = new LinkedHashMap<>();
        doc.put("test", "kolmogorov_smirnov");
        doc.put("alpha", alpha);
        doc.put("drift_detected", driftDetected());
        Map<String, Object> cols = new LinkedHashMap<>();
        for (ColumnDrift c : columns) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("applicable", c.applicable());
            entry.put("drift_status", c.drifted());
            if (c.applicable()) {
                entry.put("statistic", c.statistic());
                entry.put("p_value", c.pValue());
            } else {
                entry.put("reason", c.reason());
            }
            entry.put("train_size", c.trainSize());
            entry.put("test_size", c.testSize());
            cols.put(c.column(), entry);
        }
        doc.put("columns", cols);
        return doc;
    }

    /** Inverse of {@link #toDocument()}. */
    @SuppressWarnings("unchecked")
    public static DriftReport fromDocument(Map<String, Object> doc) {
        double alpha = ((Number) doc.get("alpha")).doubleValue();
        List<ColumnDrift> out = new ArrayList<>();
        Map<String, Object> cols = (Map<String, Object>) doc.getOrDefault("columns", Map.of());
        cols.forEach((name, raw) -> {
            Map<String, Object> e = (Map<String, Object>) raw;
            boolean applicable = Boolean.TRUE.equals(e.get("applicable"));
            out.add(new ColumnDrift(name, applicable, Boolean.TRUE.equals(e.get("drift_status")),
                    e.get("statistic") == null ? null : ((Number) e.get("statistic")).doubleValue(),
                    e.get("p_value") == null ? null : ((Number) e.get("p_value")).doubleValue(),
                    ((Number) e.getOrDefault("train_size", 0)).intValue(),
                    ((Number) e.getOrDefault("test_size", 0)).intValue(),
                    (String) e.get("reason")));
        });
        return new DriftReport(alpha, out);
    }
}
