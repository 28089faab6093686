package com.di.featurenova.pipeline.stage;

import com.di.featurenova.config.IngestionConfig;
import com.di.featurenova.pipeline.artifact.ArtifactLayout;
import com.di.featurenova.pipeline.artifact.StageMetadata;
import com.di.featurenova.pipeline.error.IngestionException;
import com.di.featurenova.pipeline.schema.SchemaSpec;
import com.di.featurenova.pipeline.source.RecordCursor;
import com.di.featurenova.pipeline.source.RecordSource;
import com.di.featurenova.pipeline.source.RecordSourceException;
import com.di.featurenova.pipeline.source.SourceRecord;
import com.di.featurenova.pipeline.split.SplitResult;
import com.di.featurenova.pipeline.split.StratifiedSplitter;
import com.di.featurenova.pipeline.table.FeatureTable;
import com.di.featurenova.pipeline.table.FeatureTableCsv;
import com.di.featurenova.util.PipelineMetrics;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Stage 1: reads the record source in bounded batches, persists the unsplit
 * feature store and a stratified train/test split.
 *
 * <p>Reads are bounded to one batch at a time, but the whole feature table is
 * held in memory for the split; sources must fit in memory.
 */
@Slf4j
public class IngestionEngine {

    private final IngestionConfig config;
    private final PipelineMetrics metrics;

    public IngestionEngine(IngestionConfig config, PipelineMetrics metrics) {
        this.config  = config;
        this.metrics = metrics;
    }

    /**
     * Does not close {@code source}; the caller that opened it does.
     *
     * @throws IngestionException on a failed or empty read, a missing or
     *         incomplete target column, an unstratifiable target, or an
     *         output file that cannot be written
     */
    public IngestionArtifact ingest(RecordSource source, SchemaSpec schema, ArtifactLayout layout) {
        long start = System.currentTimeMillis();
        boolean success = false;
        try {
            IngestionArtifact artifact = doIngest(source, schema, layout);
            success = true;
            return artifact;
        } finally {
            metrics.recordStage("ingestion", System.currentTimeMillis() - start, success);
        }
    }

    /** Stage entry point: ingests and returns the metadata for validation. */
    public StageMetadata run(RecordSource source, SchemaSpec schema, ArtifactLayout layout) {
        return ingest(source, schema, layout).toMetadata();
    }

    private IngestionArtifact doIngest(RecordSource source, SchemaSpec schema, ArtifactLayout layout) {
        log.info("[INGEST] source={} runDir={} batchSize={} batchTimeout={}",
                source.describe(), layout.runDirectory(), config.batchSize(), config.batchTimeout());
        layout.createRunTree();

        List<SourceRecord> records = read(source);
        long rows = records.size();
        if (records.isEmpty()) {
            throw new IngestionException("Record source " + source.describe() + " returned no records", 0);
        }

        FeatureTable table = FeatureTable.fromRecords(records);
        String target = schema.targetColumn();
        if (!table.hasColumn(target)) {
            throw new IngestionException("Target column '" + target + "' is absent from the source (columns "
                    + table.columns() + ")", rows);
        }
        long missingTargets = table.column(target).stream().filter(v -> v == null).count();
        if (missingTargets > 0) {
            throw new IngestionException("Target column '" + target + "' has " + missingTargets
                    + " missing value(s)", rows);
        }

        SplitResult split;
        try {
            split = new StratifiedSplitter(config.testFraction(), config.randomSeed()).split(table, target);
        } catch (IllegalArgumentException e) {
            throw new IngestionException("Cannot split on target '" + target + "': " + e.getMessage(), rows, e);
        }

        try {
            FeatureTableCsv.write(table, layout.featureStoreFile());
            FeatureTableCsv.write(split.train(), layout.ingestedTrainFile());
            FeatureTableCsv.write(split.test(), layout.ingestedTestFile());
            FeatureTableCsv.writeKinds(table, layout.featureStoreFile());
            FeatureTableCsv.writeKinds(table, layout.ingestedTrainFile());
        } catch (IOException e) {
            throw new IngestionException("Cannot write ingestion artifacts under " + layout.runDirectory()
                    + ": " + e.getMessage(), rows, e);
        }

        metrics.recordIngestedRows(rows);
        log.info("[INGEST] complete: rows={} columns={} train={} test={}",
                rows, table.columns().size(), split.train().rowCount(), split.test().rowCount());
        return new IngestionArtifact(layout, layout.featureStoreFile(), layout.ingestedTrainFile(),
                layout.ingestedTestFile(), rows, split.train().rowCount(), split.test().rowCount(),
                split.trainClassCounts(), split.testClassCounts());
    }

    private List<SourceRecord> read(RecordSource source) {
        List<SourceRecord> records = new ArrayList<>();
        long batches = 0;
        try (RecordCursor cursor = source.openCursor(config.batchSize(), config.batchTimeout())) {
            while (true) {
                List<SourceRecord> batch = cursor.nextBatch();
                if (batch.isEmpty()) {
                    break;
                }
                batches++;
                metrics.recordBatch();
                records.addAll(batch);
                log.debug("[INGEST] batch={} rows={} total={}", batches, batch.size(), records.size());
            }
        } catch (RecordSourceException | UncheckedIOException e) {
            throw new IngestionException("Reading " + source.describe() + " failed after " + records.size()
                    + " rows: " + e.getMessage(), records.size(), e);
        }
        log.info("[INGEST] read {} rows in {} batches", records.size(), batches);
        return records;
    }
}
