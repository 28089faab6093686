package com.di.featurenova.pipeline.drift;

/**
 * Drift test outcome for one column. When {@code applicable} is false,
 * {@code statistic} and {@code pValue} are {@code null} and {@code reason}
 * says why the test was not run.
 */
public record ColumnDrift(String column, boolean applicable, boolean drifted,
                          Double statistic, Double pValue, int trainSize, int testSize, String reason) {

    public static ColumnDrift tested(String column, double statistic, double pValue, double alpha,
                                     int trainSize, int testSize) {
        return new ColumnDrift(column, true, pValue < alpha, statistic, pValue, trainSize, testSize, null);
    }

    public static ColumnDrift notApplicable(String column, String reason, int trainSize, int testSize) {
        return new ColumnDrift(column, false, false, null, null, trainSize, testSize, reason);
    }
}
