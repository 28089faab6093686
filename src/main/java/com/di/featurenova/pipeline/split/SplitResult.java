package com.di.featurenova.pipeline.split;

import com.di.featurenova.pipeline.table.FeatureTable;

import java.util.Map;

/**
 * Train and test partitions with their per-class row counts, keyed by the
 * class label's text form in label order.
 */
public record SplitResult(FeatureTable train, FeatureTable test,
                          Map<String, Integer> trainClassCounts, Map<String, Integer> testClassCounts) {

    public SplitResult {
        trainClassCounts = Map.copyOf(trainClassCounts);
        testClassCounts  = Map.copyOf(testClassCounts);
    }
}
