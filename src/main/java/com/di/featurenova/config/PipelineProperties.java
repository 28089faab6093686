package com.di.featurenova.config;

import com.di.featurenova.pipeline.artifact.ArtifactLayout;
import com.di.featurenova.pipeline.transform.ImputerStrategy;
import com.di.featurenova.pipeline.transform.PreprocessorSpec;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Single binding for pipeline configuration. Converted into immutable
 * per-stage records before any stage runs.
 *
 * <pre>
 * featurenova:
 *   pipeline:
 *     artifact-dir: artifact
 *     schema-file: classpath:schema.yaml
 *     feature-store-file-name: feature_store.csv
 *     run-on-startup: false
 *     ingestion:
 *       batch-size: 5000
 *       batch-timeout: 120s
 *       test-fraction: 0.2
 *       random-seed: 42
 *     validation:
 *       drift-alpha: 0.05
 *     transformation:
 *       imputer: KNN
 *       neighbors: 3
 *       scale: true
 *       map-negative-label-to-zero: true
 *       skew-threshold: 1.0
 * </pre>
 */
@Data
@Validated
@ConfigurationProperties(prefix = "featurenova.pipeline")
public class PipelineProperties {

    /** Root under which every run gets its own timestamped directory. */
    @NotBlank
    private String artifactDir = "artifact";

    /** Spring resource location of the schema YAML. */
    @NotBlank
    private String schemaFile = "classpath:schema.yaml";

    @NotBlank
    private String featureStoreFileName = ArtifactLayout.DEFAULT_FEATURE_STORE_FILE;

    /** Run the whole pipeline once when the application starts. */
    private boolean runOnStartup = false;

    @Valid
    private Ingestion ingestion = new Ingestion();

    @Valid
    private Validation validation = new Validation();

    @Valid
    private Transformation transformation = new Transformation();

    @Data
    public static class Ingestion {
        @Min(1)
        private int batchSize = 5_000;
        @NotNull
        private Duration batchTimeout = Duration.ofSeconds(120);
        @DecimalMin(value = "0.0", inclusive = false)
        @DecimalMax(value = "1.0", inclusive = false)
        private double testFraction = 0.2;
        private long randomSeed = 42L;
    }

    @Data
    public static class Validation {
        @DecimalMin(value = "0.0", inclusive = false)
        @DecimalMax(value = "1.0", inclusive = false)
        private double driftAlpha = 0.05;
    }

    @Data
    public static class Transformation {
        @NotNull
        private ImputerStrategy imputer = ImputerStrategy.KNN;
        @Min(1)
        private int neighbors = 3;
        private boolean scale = true;
        private boolean mapNegativeLabelToZero = true;
        /** Numeric columns with |skewness| above this get a Yeo-Johnson transform. */
        @DecimalMin(value = "0.0", inclusive = false)
        private double skewThreshold = PreprocessorSpec.DEFAULT_SKEW_THRESHOLD;
    }

    public IngestionConfig toIngestionConfig() {
        return new IngestionConfig(ingestion.batchSize, ingestion.batchTimeout,
                ingestion.testFraction, ingestion.randomSeed);
    }

    public ValidationConfig toValidationConfig() {
        return new ValidationConfig(validation.driftAlpha);
    }

    public TransformationConfig toTransformationConfig() {
        return new TransformationConfig(transformation.imputer, transformation.neighbors,
                transformation.scale, transformation.mapNegativeLabelToZero, transformation.skewThreshold);
    }
}
