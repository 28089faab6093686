package com.di.featurenova.pipeline.stage;

import com.di.featurenova.config.TransformationConfig;
import com.di.featurenova.pipeline.artifact.ArtifactLayout;
import com.di.featurenova.pipeline.artifact.StageMetadata;
import com.di.featurenova.pipeline.error.TransformationException;
import com.di.featurenova.pipeline.schema.SchemaSpec;
import com.di.featurenova.pipeline.table.FeatureTable;
import com.di.featurenova.pipeline.table.FeatureTableCsv;
import com.di.featurenova.pipeline.transform.FeatureMatrix;
import com.di.featurenova.pipeline.transform.FittedPreprocessor;
import com.di.featurenova.pipeline.transform.NpyArrays;
import com.di.featurenova.pipeline.transform.PreprocessorStore;
import com.di.featurenova.pipeline.transform.TrainingFeatures;
import com.di.featurenova.util.PipelineMetrics;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.Collection;
import java.util.Set;

import static com.di.featurenova.pipeline.artifact.StageMetadataKeys.VALIDATED_TEST_PATH;
import static com.di.featurenova.pipeline.artifact.StageMetadataKeys.VALIDATED_TRAIN_PATH;

/**
 * Stage 3: fits the preprocessor on the validated training partition only,
 * applies it to both partitions and persists the arrays and the fitted
 * preprocessor. The encoded target is the last column of each array.
 */
@Slf4j
public class TransformationEngine {

    private final TransformationConfig config;
    private final PipelineMetrics      metrics;

    public TransformationEngine(TransformationConfig config, PipelineMetrics metrics) {
        this.config  = config;
        this.metrics = metrics;
    }

    public TransformationArtifact transform(Path trainFile, Path testFile, String targetColumn, ArtifactLayout layout) {
        return transform(trainFile, testFile, targetColumn, Set.of(), layout);
    }

    /** Declared numerical columns must be numeric in both partitions. */
    public TransformationArtifact transform(Path trainFile, Path testFile, SchemaSpec schema, ArtifactLayout layout) {
        return transform(trainFile, testFile, schema.targetColumn(), schema.numericalColumns(), layout);
    }

    /** Stage entry point: consumes validation metadata, returns the final metadata. */
    public StageMetadata run(StageMetadata validation, SchemaSpec schema) {
        return transform(validation.path(VALIDATED_TRAIN_PATH), validation.path(VALIDATED_TEST_PATH),
                schema, validation.layout()).toMetadata();
    }

    private TransformationArtifact transform(Path trainFile, Path testFile, String targetColumn,
                                             Collection<String> numericalColumns, ArtifactLayout layout) {
        long start = System.currentTimeMillis();
        boolean success = false;
        try {
            TransformationArtifact artifact = doTransform(trainFile, testFile, targetColumn, numericalColumns, layout);
            success = true;
            return artifact;
        } finally {
            metrics.recordStage("transformation", System.currentTimeMillis() - start, success);
        }
    }

    private TransformationArtifact doTransform(Path trainFile, Path testFile, String targetColumn,
                                               Collection<String> numericalColumns, ArtifactLayout layout) {
        log.info("[TRANSFORM] train={} test={} target={} imputer={} k={} scale={} skewThreshold={}", trainFile,
                testFile, targetColumn, config.imputer(), config.neighbors(), config.scale(), config.skewThreshold());
        try {
            FeatureTable train = FeatureTableCsv.read(trainFile);
            FeatureTable test  = FeatureTableCsv.read(testFile, train.kinds());

            TrainingFeatures training = TrainingFeatures.fromTrainingPartition(train, targetColumn, numericalColumns);
            FittedPreprocessor preprocessor = config.toPreprocessorSpec().fit(training);

            FeatureMatrix trainOut = preprocessor.transformWithTarget(train, "train");
            FeatureMatrix testOut  = preprocessor.transformWithTarget(test, "test");
            requireComplete(trainOut, "train");
            requireComplete(testOut, "test");

            NpyArrays.write(trainOut, layout.transformedTrainFile());
            NpyArrays.write(testOut, layout.transformedTestFile());
            PreprocessorStore.save(preprocessor, layout.preprocessorFile());

            metrics.recordFeatureWidth(trainOut.width());
            log.info("[TRANSFORM] complete: train={}x{} test={}x{} preprocessor={}", trainOut.rowCount(),
                    trainOut.width(), testOut.rowCount(), testOut.width(), layout.preprocessorFile());
            return new TransformationArtifact(layout, layout.transformedTrainFile(), layout.transformedTestFile(),
                    layout.preprocessorFile(), trainOut.rowCount(), testOut.rowCount(), trainOut.columns());
        } catch (IOException e) {
            throw new UncheckedIOException("Transformation I/O failed: " + e.getMessage(), e);
        }
    }

    private static void requireComplete(FeatureMatrix matrix, String partition) {
        for (int r = 0; r < matrix.rowCount(); r++) {
            for (int c = 0; c < matrix.width(); c++) {
                if (!Double.isFinite(matrix.value(r, c))) {
                    String column = matrix.columns().get(c);
                    throw new TransformationException(column, "Transformed " + partition + " value of '" + column
                            + "' at row " + r + " is not finite");
                }
            }
        }
    }
}
