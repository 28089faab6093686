package com.di.featurenova.pipeline.stage;

import com.di.featurenova.pipeline.artifact.ArtifactLayout;
import com.di.featurenova.pipeline.artifact.StageMetadata;

import java.nio.file.Path;
import java.util.Map;

import static com.di.featurenova.pipeline.artifact.StageMetadataKeys.*;

/** Files written by the ingestion stage. */
public record IngestionArtifact(ArtifactLayout layout, Path featureStoreFile, Path trainFile, Path testFile,
                                long rowCount, int trainRows, int testRows,
                                Map<String, Integer> trainClassCounts, Map<String, Integer> testClassCounts) {

    public StageMetadata toMetadata() {
        return StageMetadata.builder()
                .stage(STAGE_INGESTION)
                .runDirectory(layout.runDirectory().toAbsolutePath().toString())
                .path(FEATURE_STORE_PATH, layout.relativize(featureStoreFile))
                .path(TRAIN_PATH, layout.relativize(trainFile))
                .path(TEST_PATH, layout.relativize(testFile))
                .attribute(ROW_COUNT, Long.toString(rowCount))
                .attribute(TRAIN_ROWS, Integer.toString(trainRows))
                .attribute(TEST_ROWS, Integer.toString(testRows))
                .build();
    }
}
