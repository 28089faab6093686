package com.di.featurenova.util;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.TimeUnit;

/**
 * Micrometer metrics for the three pipeline stages: durations, row counts,
 * drifted columns and failures.
 */
@Slf4j
public class PipelineMetrics {

    private final MeterRegistry meterRegistry;

    private final DistributionSummary rowsIngested;
    private final Counter             batchesRead;
    private final Counter             driftedColumns;
    private final DistributionSummary featureWidth;

    public PipelineMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.rowsIngested = DistributionSummary.builder("featurenova.ingestion.rows")
                .description("Rows read from the record source per run")
                .baseUnit("rows")
                .register(meterRegistry);

        this.batchesRead = Counter.builder("featurenova.ingestion.batches")
                .description("Record source batches read")
                .register(meterRegistry);

        this.driftedColumns = Counter.builder("featurenova.validation.drifted.columns")
                .description("Columns whose drift test rejected equality")
                .register(meterRegistry);

        this.featureWidth = DistributionSummary.builder("featurenova.transformation.width")
                .description("Width of the transformed feature arrays including the target")
                .register(meterRegistry);
    }

    /** Metrics into a private registry, for callers outside the Spring context. */
    public static PipelineMetrics standalone() {
        return new PipelineMetrics(new SimpleMeterRegistry());
    }

    public MeterRegistry registry() {
        return meterRegistry;
    }

    public void recordStage(String stage, long durationMs, boolean success) {
        Timer.builder("featurenova.stage.duration")
                .description("Wall time of a pipeline stage")
                .tag("stage", stage)
                .tag("status", success ? "success" : "error")
                .register(meterRegistry)
                .record(durationMs, TimeUnit.MILLISECONDS);
        if (!success) {
            Counter.builder("featurenova.stage.failures")
                    .description("Failed pipeline stages")
                    .tag("stage", stage)
                    .register(meterRegistry)
                    .increment();
        }
        log.debug("Recorded stage: stage={}, durationMs={}, success={}", stage, durationMs, success);
    }

    public void recordBatch() {
        batchesRead.increment();
    }

    public void recordIngestedRows(long rows) {
        rowsIngested.record(rows);
    }

    public void recordDriftedColumns(int count) {
        driftedColumns.increment(count);
    }

    public void recordFeatureWidth(int width) {
        featureWidth.record(width);
    }
}
