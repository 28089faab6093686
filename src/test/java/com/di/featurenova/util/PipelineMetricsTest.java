package com.di.featurenova.util;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("PipelineMetrics Tests")
class PipelineMetricsTest {

    private final PipelineMetrics metrics = PipelineMetrics.standalone();
    private final MeterRegistry   registry = metrics.registry();

    @Test
    @DisplayName("Should time stages by stage and status")
    void testRecordStage() {
        metrics.recordStage("validation", 120, true);
        metrics.recordStage("validation", 80, true);
        metrics.recordStage("validation", 5, false);

        Timer ok = registry.get("featurenova.stage.duration").tag("stage", "validation").tag("status", "success").timer();
        assertEquals(2, ok.count());
        assertEquals(200.0, ok.totalTime(TimeUnit.MILLISECONDS), 0.001);
        assertEquals(1.0, registry.get("featurenova.stage.failures").tag("stage", "validation").counter().count());
    }

    @Test
    @DisplayName("Should not count failures for successful stages")
    void testRecordStage_NoFailureCounter() {
        metrics.recordStage("ingestion", 10, true);

        assertNull(registry.find("featurenova.stage.failures").counter());
    }

    @Test
    @DisplayName("Should record ingestion, drift and width figures")
    void testRecordFigures() {
        metrics.recordBatch();
        metrics.recordBatch();
        metrics.recordIngestedRows(11_055);
        metrics.recordDriftedColumns(3);
        metrics.recordFeatureWidth(31);

        assertEquals(2.0, registry.get("featurenova.ingestion.batches").counter().count());
        assertEquals(11_055.0, registry.get("featurenova.ingestion.rows").summary().totalAmount());
        assertEquals(3.0, registry.get("featurenova.validation.drifted.columns").counter().count());
        assertEquals(31.0, registry.get("featurenova.transformation.width").summary().max());
    }
}
