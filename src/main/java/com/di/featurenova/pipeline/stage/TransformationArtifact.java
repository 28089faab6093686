package com.di.featurenova.pipeline.stage;

import com.di.featurenova.pipeline.artifact.ArtifactLayout;
import com.di.featurenova.pipeline.artifact.StageMetadata;

import java.nio.file.Path;
import java.util.List;

import static com.di.featurenova.pipeline.artifact.StageMetadataKeys.*;

/**
 * Arrays and preprocessor written by the transformation stage. Each array row
 * is the feature vector followed by the encoded target in the last column.
 */
public record TransformationArtifact(ArtifactLayout layout, Path trainArrayFile, Path testArrayFile,
                                     Path preprocessorFile, int trainRows, int testRows, List<String> columns) {

    public StageMetadata toMetadata() {
        return StageMetadata.builder()
                .stage(STAGE_TRANSFORMATION)
                .runDirectory(layout.runDirectory().toAbsolutePath().toString())
                .path(TRANSFORMED_TRAIN_PATH, layout.relativize(trainArrayFile))
                .path(TRANSFORMED_TEST_PATH, layout.relativize(testArrayFile))
                .path(PREPROCESSOR_PATH, layout.relativize(preprocessorFile))
                .attribute(TRAIN_ROWS, Integer.toString(trainRows))
                .attribute(TEST_ROWS, Integer.toString(testRows))
                .attribute(FEATURE_WIDTH, Integer.toString(columns.size()))
                .build();
    }
}
