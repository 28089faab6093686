package com.di.featurenova.pipeline;

import com.di.featurenova.config.PipelineProperties;
import com.di.featurenova.pipeline.artifact.ArtifactLayout;
import com.di.featurenova.pipeline.artifact.StageMetadata;
import com.di.featurenova.pipeline.drift.DriftReport;
import com.di.featurenova.pipeline.error.ErrorCategory;
import com.di.featurenova.pipeline.error.PipelineException;
import com.di.featurenova.pipeline.schema.SchemaSpec;
import com.di.featurenova.pipeline.schema.SchemaSpecLoader;
import com.di.featurenova.pipeline.source.RecordSource;
import com.di.featurenova.pipeline.source.RecordSourceFactory;
import com.di.featurenova.pipeline.stage.IngestionEngine;
import com.di.featurenova.pipeline.stage.TransformationEngine;
import com.di.featurenova.pipeline.stage.ValidationEngine;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.NoSuchElementException;

import static com.di.featurenova.pipeline.artifact.StageMetadataKeys.DRIFT_DETECTED;
import static com.di.featurenova.pipeline.artifact.StageMetadataKeys.STAGE_INGESTION;
import static com.di.featurenova.pipeline.artifact.StageMetadataKeys.STAGE_TRANSFORMATION;
import static com.di.featurenova.pipeline.artifact.StageMetadataKeys.STAGE_VALIDATION;

/**
 * Runs ingestion, validation and transformation strictly in sequence for one
 * run directory. Each stage only sees its predecessor's {@link StageMetadata}.
 *
 * <p>No retries: a failed stage fails the run and the partial files stay on
 * disk for diagnosis. Retry and cleanup policies belong to the scheduler.
 */
@Slf4j
@Service
public class PipelineOrchestrator {

    static final String MDC_RUN_ID = "runId";
    static final String MDC_STAGE  = "stage";

    /** Same-second run ids get a numeric suffix; give up after this many. */
    private static final int MAX_RUN_ID_ATTEMPTS = 100;

    private final PipelineProperties   properties;
    private final RecordSourceFactory  sourceFactory;
    private final IngestionEngine      ingestionEngine;
    private final ValidationEngine     validationEngine;
    private final TransformationEngine transformationEngine;
    private final SchemaSpecLoader     schemaLoader;
    private final ResourceLoader       resourceLoader;
    private final Clock                clock;

    public PipelineOrchestrator(PipelineProperties   properties,
                                RecordSourceFactory  sourceFactory,
                                IngestionEngine      ingestionEngine,
                                ValidationEngine     validationEngine,
                                TransformationEngine transformationEngine,
                                SchemaSpecLoader     schemaLoader,
                                ResourceLoader       resourceLoader,
                                Clock                clock) {
        this.properties           = properties;
        this.sourceFactory        = sourceFactory;
        this.ingestionEngine      = ingestionEngine;
        this.validationEngine     = validationEngine;
        this.transformationEngine = transformationEngine;
        this.schemaLoader         = schemaLoader;
        this.resourceLoader       = resourceLoader;
        this.clock                = clock;
    }

    /* ==================================================================== */
    /* Full run                                                              */
    /* ==================================================================== */

    /**
     * Runs all three stages synchronously. Never throws: failures are
     * reported in the response with their {@link ErrorCategory}.
     */
    public PipelineRunResponse execute() {
        long start = clock.millis();
        Map<String, StageMetadata> stages = new LinkedHashMap<>();
        ArtifactLayout layout = null;
        String stage = "setup";
        try {
            SchemaSpec schema = loadSchema();
            layout = allocateRun();
            MDC.put(MDC_RUN_ID, layout.runId());
            log.info("[ORCHESTRATOR] runId={} runDir={} target={}", layout.runId(), layout.runDirectory(),
                    schema.targetColumn());

            stage = STAGE_INGESTION;
            MDC.put(MDC_STAGE, stage);
            StageMetadata ingestion;
            try (RecordSource source = sourceFactory.open()) {
                ingestion = ingestionEngine.run(source, schema, layout);
            }
            stages.put(stage, ingestion);

            stage = STAGE_VALIDATION;
            MDC.put(MDC_STAGE, stage);
            StageMetadata validation = validationEngine.run(ingestion, schema);
            stages.put(stage, validation);

            stage = STAGE_TRANSFORMATION;
            MDC.put(MDC_STAGE, stage);
            StageMetadata transformation = transformationEngine.run(validation, schema);
            stages.put(stage, transformation);

            long durationMs = clock.millis() - start;
            log.info("[ORCHESTRATOR] runId={} SUCCEEDED in {}ms", layout.runId(), durationMs);
            return PipelineRunResponse.builder()
                    .runId(layout.runId())
                    .status(PipelineRunResponse.SUCCEEDED)
                    .runDirectory(layout.runDirectory().toAbsolutePath().toString())
                    .driftDetected(validation.flag(DRIFT_DETECTED))
                    .stages(stages)
                    .durationMs(durationMs)
                    .message("All stages completed")
                    .build();
        } catch (Exception ex) {
            ErrorCategory category = ErrorCategory.categorize(ex);
            String failedStage = ex instanceof PipelineException pe ? pe.getStage() : stage;
            log.error("[ORCHESTRATOR] runId={} FAILED in stage={} [{}]: {}",
                    layout == null ? "-" : layout.runId(), failedStage, category, ex.getMessage(), ex);
            return PipelineRunResponse.builder()
                    .runId(layout == null ? null : layout.runId())
                    .status(PipelineRunResponse.FAILED)
                    .runDirectory(layout == null ? null : layout.runDirectory().toAbsolutePath().toString())
                    .failedStage(failedStage)
                    .errorCategory(category.name())
                    .driftDetected(stages.containsKey(STAGE_VALIDATION)
                            ? stages.get(STAGE_VALIDATION).flag(DRIFT_DETECTED) : null)
                    .stages(stages)
                    .durationMs(clock.millis() - start)
                    .message(ex.getMessage())
                    .build();
        } finally {
            MDC.remove(MDC_STAGE);
            MDC.remove(MDC_RUN_ID);
        }
    }

    /* ==================================================================== */
    /* Single stages                                                         */
    /* ==================================================================== */

    /** Starts a new run and ingests the configured source. */
    public StageMetadata runIngestion() {
        SchemaSpec schema = loadSchema();
        ArtifactLayout layout = allocateRun();
        return withMdc(layout.runId(), STAGE_INGESTION, () -> {
            try (RecordSource source = sourceFactory.open()) {
                return ingestionEngine.run(source, schema, layout);
            }
        });
    }

    public StageMetadata runValidation(StageMetadata ingestion) {
        ArtifactLayout layout = requireManagedRun(ingestion, STAGE_INGESTION);
        SchemaSpec schema = loadSchema();
        return withMdc(layout.runId(), STAGE_VALIDATION, () -> validationEngine.run(ingestion, schema));
    }

    public StageMetadata runTransformation(StageMetadata validation) {
        ArtifactLayout layout = requireManagedRun(validation, STAGE_VALIDATION);
        SchemaSpec schema = loadSchema();
        return withMdc(layout.runId(), STAGE_TRANSFORMATION, () -> transformationEngine.run(validation, schema));
    }

    /** Drift report document of a completed validation. */
    public Map<String, Object> readDriftReport(String runId) {
        ArtifactLayout layout = ArtifactLayout.of(artifactRoot(), runId);
        Path report = layout.driftReportFile();
        if (!Files.isRegularFile(report)) {
            throw new NoSuchElementException("No drift report for run '" + runId + "'");
        }
        try {
            DriftReport parsed = ValidationEngine.readReport(report);
            return parsed.toDocument();
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read drift report " + report, e);
        }
    }

    /* ==================================================================== */
    /* Helpers                                                               */
    /* ==================================================================== */

    SchemaSpec loadSchema() {
        String location = properties.getSchemaFile();
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            throw new IllegalStateException("Schema file not found: " + location);
        }
        try (InputStream in = resource.getInputStream()) {
            return schemaLoader.load(in, location);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read schema file " + location, e);
        }
    }

    /** Creates a fresh run directory named after the current time. */
    ArtifactLayout allocateRun() {
        Path root = artifactRoot();
        String baseId = ArtifactLayout.runIdFor(LocalDateTime.now(clock));
        try {
            Files.createDirectories(root);
            for (int attempt = 0; attempt < MAX_RUN_ID_ATTEMPTS; attempt++) {
                String runId = attempt == 0 ? baseId : baseId + "_" + attempt;
                ArtifactLayout layout = ArtifactLayout.of(root, runId, properties.getFeatureStoreFileName());
                try {
                    Files.createDirectory(layout.runDirectory());
                    return layout.createRunTree();
                } catch (FileAlreadyExistsException e) {
                    log.debug("[ORCHESTRATOR] run directory {} exists, trying next suffix", layout.runDirectory());
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create run directory under " + root, e);
        }
        throw new IllegalStateException("No free run directory for " + baseId + " under " + root);
    }

    private Path artifactRoot() {
        return Paths.get(properties.getArtifactDir()).toAbsolutePath().normalize();
    }

    /** Metadata posted by a caller must come from the expected stage and stay under the artifact root. */
    private ArtifactLayout requireManagedRun(StageMetadata metadata, String expectedStage) {
        if (metadata == null) {
            throw new IllegalArgumentException("Stage metadata is required");
        }
        if (!expectedStage.equals(metadata.getStage())) {
            throw new IllegalArgumentException("Expected metadata from stage '" + expectedStage
                    + "' but got '" + metadata.getStage() + "'");
        }
        ArtifactLayout layout = metadata.layout();
        if (!layout.baseDirectory().equals(artifactRoot())) {
            throw new IllegalArgumentException("Run directory " + metadata.getRunDirectory()
                    + " is not under the artifact root " + artifactRoot());
        }
        return layout;
    }

    private static <T> T withMdc(String runId, String stage, StageCall<T> call) {
        MDC.put(MDC_RUN_ID, runId);
        MDC.put(MDC_STAGE, stage);
        try {
            return call.run();
        } finally {
            MDC.remove(MDC_STAGE);
            MDC.remove(MDC_RUN_ID);
        }
    }

    @FunctionalInterface
    private interface StageCall<T> {
        T run();
    }
}
