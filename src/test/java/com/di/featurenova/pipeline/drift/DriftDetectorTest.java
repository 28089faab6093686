package com.di.featurenova.pipeline.drift;

import com.di.featurenova.pipeline.error.DriftComputationException;
import com.di.featurenova.pipeline.source.SourceRecord;
import com.di.featurenova.pipeline.table.FeatureTable;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static com.di.featurenova.pipeline.source.ListRecordSource.record;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("DriftDetector Tests")
class DriftDetectorTest {

    private final DriftDetector detector = new DriftDetector(0.05);

    private static FeatureTable numbers(int count, int step, int offset) {
        List<SourceRecord> records = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            records.add(record("x", offset + i * step, "color", i % 2 == 0 ? "red" : "blue"));
        }
        return FeatureTable.fromRecords(records);
    }

    // =========================================================================
    // Tested columns
    // =========================================================================

    @Test
    @DisplayName("Should not flag drift for samples from the same distribution")
    void testDetect_SameDistribution() {
        DriftReport report = detector.detect(numbers(100, 1, 0), numbers(20, 5, 0));

        ColumnDrift x = report.column("x");
        assertTrue(x.applicable());
        assertFalse(x.drifted());
        assertTrue(x.pValue() > 0.05);
        assertEquals(100, x.trainSize());
        assertEquals(20, x.testSize());
        assertFalse(report.driftDetected());
        assertTrue(report.driftedColumns().isEmpty());
    }

    @Test
    @DisplayName("Should flag drift for disjoint distributions")
    void testDetect_ShiftedDistribution() {
        DriftReport report = detector.detect(numbers(100, 1, 0), numbers(20, 1, 500));

        ColumnDrift x = report.column("x");
        assertTrue(x.drifted());
        assertEquals(1.0, x.statistic(), 1e-12);
        assertTrue(x.pValue() < 0.05);
        assertTrue(report.driftDetected());
        assertEquals(List.of("x"), report.driftedColumns());
    }

    // =========================================================================
    // Not applicable columns
    // =========================================================================

    @Test
    @DisplayName("Should mark categorical columns not applicable")
    void testDetect_CategoricalColumn() {
        DriftReport report = detector.detect(numbers(10, 1, 0), numbers(10, 1, 0));

        ColumnDrift color = report.column("color");
        assertFalse(color.applicable());
        assertFalse(color.drifted());
        assertNull(color.pValue());
        assertEquals("non-numeric column", color.reason());
        assertEquals(List.of("x", "color"), report.columns().stream().map(ColumnDrift::column).toList());
    }

    @Test
    @DisplayName("Should mark a column with fewer than two observed values not applicable")
    void testDetect_TooFewValues() {
        FeatureTable train = FeatureTable.fromRecords(List.of(record("x", 1), record("x", 2), record("x", 3)));
        FeatureTable test  = FeatureTable.fromRecords(List.of(record("x", 1), record("x", null)));

        ColumnDrift x = detector.detect(train, test).column("x");
        assertFalse(x.applicable());
        assertTrue(x.reason().contains("at least 2"));
        assertEquals(1, x.testSize());
    }

    @Test
    @DisplayName("Should raise DriftComputationException from the single-column test")
    void testColumnTest_Throws() {
        DriftComputationException ex = assertThrows(DriftComputationException.class,
                () -> detector.test("x", new double[] {1.0}, new double[] {1.0, 2.0}));
        assertEquals("x", ex.getColumn());
        assertEquals("validation", ex.getStage());
    }

    @Test
    @DisplayName("Should skip columns absent from the test partition")
    void testDetect_TrainOnlyColumn() {
        FeatureTable train = FeatureTable.fromRecords(List.of(record("x", 1, "y", 1), record("x", 2, "y", 2)));
        FeatureTable test  = FeatureTable.fromRecords(List.of(record("x", 1), record("x", 2)));

        DriftReport report = detector.detect(train, test);
        assertEquals(1, report.columns().size());
        assertThrows(IllegalArgumentException.class, () -> report.column("y"));
    }

    // =========================================================================
    // Document form
    // =========================================================================

    @Test
    @DisplayName("Should rebuild an equal report from its document form")
    @SuppressWarnings("unchecked")
    void testDocument() {
        DriftReport report = detector.detect(numbers(40, 1, 0), numbers(10, 1, 35));
        Map<String, Object> doc = report.toDocument();

        assertEquals("kolmogorov_smirnov", doc.get("test"));
        assertEquals(report.driftDetected(), doc.get("drift_detected"));
        Map<String, Object> color = (Map<String, Object>) ((Map<String, Object>) doc.get("columns")).get("color");
        assertFalse(color.containsKey("p_value"));
        assertEquals(report, DriftReport.fromDocument(doc));
    }

    @ParameterizedTest
    @ValueSource(doubles = {0.0, 1.0, -0.5})
    @DisplayName("Should reject alpha outside (0, 1)")
    void testInvalidAlpha(double alpha) {
        assertThrows(IllegalArgumentException.class, () -> new DriftDetector(alpha));
    }
}
