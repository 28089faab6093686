package com.di.featurenova.pipeline.stage;

import com.di.featurenova.pipeline.artifact.ArtifactLayout;
import com.di.featurenova.pipeline.artifact.StageMetadata;
import com.di.featurenova.pipeline.drift.DriftReport;

import java.nio.file.Path;

import static com.di.featurenova.pipeline.artifact.StageMetadataKeys.*;

/** Outcome of a passed validation: validated copies and the drift report. */
public record ValidationArtifact(ArtifactLayout layout, Path validatedTrainFile, Path validatedTestFile,
                                 Path driftReportFile, boolean validationStatus, DriftReport driftReport) {

    public StageMetadata toMetadata() {
        return StageMetadata.builder()
                .stage(STAGE_VALIDATION)
                .runDirectory(layout.runDirectory().toAbsolutePath().toString())
                .path(VALIDATED_TRAIN_PATH, layout.relativize(validatedTrainFile))
                .path(VALIDATED_TEST_PATH, layout.relativize(validatedTestFile))
                .path(DRIFT_REPORT_PATH, layout.relativize(driftReportFile))
                .flag(VALIDATION_STATUS, validationStatus)
                .flag(DRIFT_DETECTED, driftReport.driftDetected())
                .build();
    }
}
