package com.di.featurenova.config;

import com.di.featurenova.pipeline.transform.ImputerStrategy;
import com.di.featurenova.pipeline.transform.PreprocessorSpec;

/** Immutable settings of the transformation stage. */
public record TransformationConfig(ImputerStrategy imputer, int neighbors, boolean scale,
                                   boolean mapNegativeLabelToZero, double skewThreshold) {

    public static final TransformationConfig DEFAULTS =
            new TransformationConfig(ImputerStrategy.KNN, 3, true, true, PreprocessorSpec.DEFAULT_SKEW_THRESHOLD);

    public TransformationConfig(ImputerStrategy imputer, int neighbors, boolean scale, boolean mapNegativeLabelToZero) {
        this(imputer, neighbors, scale, mapNegativeLabelToZero, PreprocessorSpec.DEFAULT_SKEW_THRESHOLD);
    }

    public PreprocessorSpec toPreprocessorSpec() {
        return new PreprocessorSpec(imputer, neighbors, scale, mapNegativeLabelToZero, skewThreshold);
    }
}
