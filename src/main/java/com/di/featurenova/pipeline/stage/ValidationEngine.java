package com.di.featurenova.pipeline.stage;

import com.di.featurenova.config.ValidationConfig;
import com.di.featurenova.pipeline.artifact.ArtifactLayout;
import com.di.featurenova.pipeline.artifact.StageMetadata;
import com.di.featurenova.pipeline.drift.DriftDetector;
import com.di.featurenova.pipeline.drift.DriftReport;
import com.di.featurenova.pipeline.error.SchemaValidationException;
import com.di.featurenova.pipeline.schema.SchemaSpec;
import com.di.featurenova.pipeline.table.FeatureTable;
import com.di.featurenova.pipeline.table.FeatureTableCsv;
import com.di.featurenova.util.PipelineMetrics;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.di.featurenova.pipeline.artifact.StageMetadataKeys.TEST_PATH;
import static com.di.featurenova.pipeline.artifact.StageMetadataKeys.TRAIN_PATH;

/**
 * Stage 2: schema check (fatal), drift check (advisory), then byte-identical
 * validated copies of both partitions.
 */
@Slf4j
public class ValidationEngine {

    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory());

    private final ValidationConfig config;
    private final PipelineMetrics  metrics;

    public ValidationEngine(ValidationConfig config, PipelineMetrics metrics) {
        this.config  = config;
        this.metrics = metrics;
    }

    /**
     * @throws SchemaValidationException when a partition lacks a required
     *         column; nothing is written in that case
     */
    public ValidationArtifact validate(Path trainFile, Path testFile, SchemaSpec schema, ArtifactLayout layout) {
        long start = System.currentTimeMillis();
        boolean success = false;
        try {
            ValidationArtifact artifact = doValidate(trainFile, testFile, schema, layout);
            success = true;
            return artifact;
        } finally {
            metrics.recordStage("validation", System.currentTimeMillis() - start, success);
        }
    }

    /** Stage entry point: consumes ingestion metadata, returns metadata for transformation. */
    public StageMetadata run(StageMetadata ingestion, SchemaSpec schema) {
        return validate(ingestion.path(TRAIN_PATH), ingestion.path(TEST_PATH), schema, ingestion.layout())
                .toMetadata();
    }

    private ValidationArtifact doValidate(Path trainFile, Path testFile, SchemaSpec schema, ArtifactLayout layout) {
        log.info("[VALIDATE] train={} test={} required={}", trainFile, testFile, schema.requiredColumns());
        try {
            checkSchema(trainFile, testFile, schema);

            FeatureTable train = FeatureTableCsv.read(trainFile);
            FeatureTable test  = FeatureTableCsv.read(testFile, train.kinds());
            DriftReport report = new DriftDetector(config.driftAlpha()).detect(train, test);
            if (report.driftDetected()) {
                metrics.recordDriftedColumns(report.driftedColumns().size());
                log.warn("[VALIDATE] drift detected in {} (alpha={}); continuing", report.driftedColumns(),
                        config.driftAlpha());
            }

            Path reportFile = layout.driftReportFile();
            writeReport(report, reportFile);
            Files.createDirectories(layout.validatedTrainFile().getParent());
            Files.copy(trainFile, layout.validatedTrainFile());
            Files.copy(testFile, layout.validatedTestFile());
            Path kinds = FeatureTableCsv.kindsFile(trainFile);
            if (Files.exists(kinds)) {
                Files.copy(kinds, FeatureTableCsv.kindsFile(layout.validatedTrainFile()));
            }

            log.info("[VALIDATE] complete: status=true driftDetected={} report={}",
                    report.driftDetected(), reportFile);
            return new ValidationArtifact(layout, layout.validatedTrainFile(), layout.validatedTestFile(),
                    reportFile, true, report);
        } catch (IOException e) {
            throw new UncheckedIOException("Validation I/O failed: " + e.getMessage(), e);
        }
    }

    private static void checkSchema(Path trainFile, Path testFile, SchemaSpec schema) throws IOException {
        Map<String, List<String>> missing = new LinkedHashMap<>();
        List<String> trainMissing = schema.missingFrom(FeatureTableCsv.readHeader(trainFile));
        List<String> testMissing  = schema.missingFrom(FeatureTableCsv.readHeader(testFile));
        if (!trainMissing.isEmpty()) {
            missing.put("train", trainMissing);
        }
        if (!testMissing.isEmpty()) {
            missing.put("test", testMissing);
        }
        if (!missing.isEmpty()) {
            log.error("[VALIDATE] schema check failed: missing {}", missing);
            throw new SchemaValidationException(missing);
        }
    }

    private static void writeReport(DriftReport report, Path file) throws IOException {
        Files.createDirectories(file.getParent());
        try (Writer out = Files.newBufferedWriter(file, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE)) {
            YAML.writeValue(out, report.toDocument());
        }
    }

    /** Reads a report written by this stage. */
    @SuppressWarnings("unchecked")
    public static DriftReport readReport(Path file) throws IOException {
        return DriftReport.fromDocument(YAML.readValue(file.toFile(), Map.class));
    }
}
