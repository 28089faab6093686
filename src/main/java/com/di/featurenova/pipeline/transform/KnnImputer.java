package com.di.featurenova.pipeline.transform;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * Fitted k-nearest-neighbours imputer over the numeric feature columns.
 *
 * <p>Distance between two rows is the NaN-euclidean distance: the euclidean
 * distance over coordinates present in both rows, scaled by
 * {@code sqrt(width / presentCount)}. A missing value is replaced by the
 * unweighted mean of that column over the {@code neighbors} nearest training
 * rows that observe it (ties broken by training row order). Rows with no
 * shared coordinate are not donors; with no donor at all the training column
 * mean is used.
 *
 * @param neighbors    k
 * @param donors       training rows, {@code null} where missing
 * @param columnMeans  training column means over observed values
 */
public record KnnImputer(@JsonProperty("neighbors") int neighbors,
                         @JsonProperty("donors") Double[][] donors,
                         @JsonProperty("column_means") double[] columnMeans) {

    public KnnImputer {
        if (neighbors < 1) {
            throw new IllegalArgumentException("neighbors must be >= 1, got " + neighbors);
        }
    }

    static KnnImputer fit(int neighbors, double[][] train, double[] columnMeans) {
        Double[][] donors = new Double[train.length][];
        for (int r = 0; r < train.length; r++) {
            donors[r] = new Double[train[r].length];
            for (int c = 0; c < train[r].length; c++) {
                donors[r][c] = Double.isNaN(train[r][c]) ? null : train[r][c];
            }
        }
        return new KnnImputer(neighbors, donors, columnMeans.clone());
    }

    /** Imputes in place. */
    void impute(double[][] rows) {
        double[][] fit = donorMatrix();
        for (double[] row : rows) {
            double[] original = row.clone();
            for (int c = 0; c < row.length; c++) {
                if (Double.isNaN(original[c])) {
                    row[c] = imputeCell(original, c, fit);
                }
            }
        }
    }

    private double imputeCell(double[] receiver, int column, double[][] fit) {
        List<double[]> candidates = new ArrayList<>();
        for (int d = 0; d < fit.length; d++) {
            double[] donor = fit[d];
            if (Double.isNaN(donor[column])) {
                continue;
            }
            double dist = nanEuclidean(receiver, donor);
            if (!Double.isNaN(dist)) {
                candidates.add(new double[] {dist, d, donor[column]});
            }
        }
        if (candidates.isEmpty()) {
            return columnMeans[column];
        }
        candidates.sort((a, b) -> a[0] != b[0] ? Double.compare(a[0], b[0]) : Double.compare(a[1], b[1]));
        int k = Math.min(neighbors, candidates.size());
        double sum = 0.0;
        for (int i = 0; i < k; i++) {
            sum += candidates.get(i)[2];
        }
        return sum / k;
    }

    static double nanEuclidean(double[] a, double[] b) {
        int present = 0;
        double sq = 0.0;
        for (int i = 0; i < a.length; i++) {
            if (Double.isNaN(a[i]) || Double.isNaN(b[i])) {
                continue;
            }
            double diff = a[i] - b[i];
            sq += diff * diff;
            present++;
        }
        if (present == 0) {
            return Double.NaN;
        }
        return Math.sqrt(sq * a.length / present);
    }

    private double[][] donorMatrix() {
        double[][] out = new double[donors.length][];
        for (int r = 0; r < donors.length; r++) {
            out[r] = new double[donors[r].length];
            for (int c = 0; c < donors[r].length; c++) {
                out[r][c] = donors[r][c] == null ? Double.NaN : donors[r][c];
            }
        }
        return out;
    }
}
