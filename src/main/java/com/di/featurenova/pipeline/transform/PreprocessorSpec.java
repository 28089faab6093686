package com.di.featurenova.pipeline.transform;

import com.di.featurenova.pipeline.error.TransformationException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.stat.descriptive.moment.Skewness;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Unfitted preprocessing pipeline: configuration only. The only way to
 * obtain a {@link FittedPreprocessor} is {@link #fit(TrainingFeatures)}.
 *
 * <p>Numeric columns: impute, then optionally standard-scale. A numeric
 * column whose training sample skewness exceeds {@code skewThreshold} in
 * absolute value is mean-imputed and Yeo-Johnson transformed instead of going
 * through the imputer. Categorical columns: most-frequent impute, then
 * one-hot encode.
 *
 * @param skewThreshold {@link Double#POSITIVE_INFINITY} turns the power
 *                      transform off
 */
@Slf4j
public record PreprocessorSpec(ImputerStrategy strategy, int neighbors, boolean scale,
                               boolean mapNegativeLabelToZero, double skewThreshold) {

    public static final double DEFAULT_SKEW_THRESHOLD = 1.0;

    public PreprocessorSpec {
        if (strategy == null) {
            throw new IllegalArgumentException("strategy is required");
        }
        if (neighbors < 1) {
            throw new IllegalArgumentException("neighbors must be >= 1, got " + neighbors);
        }
        if (!(skewThreshold > 0.0)) {
            throw new IllegalArgumentException("skewThreshold must be > 0, got " + skewThreshold);
        }
    }

    public PreprocessorSpec(ImputerStrategy strategy, int neighbors, boolean scale, boolean mapNegativeLabelToZero) {
        this(strategy, neighbors, scale, mapNegativeLabelToZero, DEFAULT_SKEW_THRESHOLD);
    }

    public FittedPreprocessor fit(TrainingFeatures training) {
        List<String> numeric = training.numericColumns();
        double[][] x = TableColumns.numeric(training.table(), numeric, "training");

        double[] means = new double[numeric.size()];
        for (int c = 0; c < numeric.size(); c++) {
            double sum = 0.0;
            int observed = 0;
            for (double[] row : x) {
                if (!Double.isNaN(row[c])) {
                    sum += row[c];
                    observed++;
                }
            }
            if (observed == 0) {
                throw new TransformationException(numeric.get(c), "Numeric column '" + numeric.get(c)
                        + "' has no observed value in training; the imputer cannot be fitted");
            }
            means[c] = sum / observed;
        }

        Set<String> skewed = new HashSet<>();
        for (int c = 0; c < numeric.size(); c++) {
            // sample skewness over observed values; NaN below 3 values
            double skew = new Skewness().evaluate(observed(x, c));
            if (!Double.isNaN(skew) && Math.abs(skew) > skewThreshold) {
                skewed.add(numeric.get(c));
            }
        }
        int[] knnColumns = FittedPreprocessor.knnColumnIndexes(numeric, skewed);

        KnnImputer knn = strategy == ImputerStrategy.KNN
                ? KnnImputer.fit(neighbors, columns(x, knnColumns), select(means, knnColumns))
                : null;
        double[][] imputed = new double[x.length][];
        for (int r = 0; r < x.length; r++) {
            imputed[r] = x[r].clone();
        }
        FittedPreprocessor.imputeNumeric(imputed, knn, means, knnColumns);

        Map<String, Double> lambdas = new TreeMap<>();
        for (int c = 0; c < numeric.size(); c++) {
            if (skewed.contains(numeric.get(c))) {
                lambdas.put(numeric.get(c), YeoJohnson.fitLambda(column(imputed, c)));
            }
        }
        FittedPreprocessor.powerTransform(imputed, numeric, lambdas);

        double[] centers = new double[numeric.size()];
        double[] scales  = new double[numeric.size()];
        for (int c = 0; c < numeric.size(); c++) {
            centers[c] = 0.0;
            scales[c]  = 1.0;
            if (scale && imputed.length > 0) {
                double sum = 0.0;
                for (double[] row : imputed) {
                    sum += row[c];
                }
                double mean = sum / imputed.length;
                double sq = 0.0;
                for (double[] row : imputed) {
                    sq += (row[c] - mean) * (row[c] - mean);
                }
                double std = Math.sqrt(sq / imputed.length);
                centers[c] = mean;
                scales[c]  = std == 0.0 ? 1.0 : std;
            }
        }

        List<CategoricalEncoding> categorical = new ArrayList<>();
        for (String column : training.categoricalColumns()) {
            categorical.add(fitCategorical(training, column));
        }

        TargetEncoder target = TargetEncoder.fit(training.table(), training.targetColumn(), mapNegativeLabelToZero);

        FittedPreprocessor fitted = new FittedPreprocessor(FittedPreprocessor.FORMAT, strategy, numeric,
                means, knn, lambdas, scale, centers, scales, categorical, target);
        log.info("[TRANSFORM] Fitted {} imputer on {} training rows: {} numeric, {} categorical -> width {}",
                strategy, training.rowCount(), numeric.size(), categorical.size(), fitted.outputColumns().size());
        if (!lambdas.isEmpty()) {
            log.info("[TRANSFORM] Yeo-Johnson on skewed columns (|skew| > {}): {}", skewThreshold, lambdas);
        }
        return fitted;
    }

    private static double[] observed(double[][] x, int c) {
        return Arrays.stream(x).mapToDouble(row -> row[c]).filter(v -> !Double.isNaN(v)).toArray();
    }

    private static double[] column(double[][] x, int c) {
        return Arrays.stream(x).mapToDouble(row -> row[c]).toArray();
    }

    private static double[][] columns(double[][] x, int[] cols) {
        double[][] out = new double[x.length][];
        for (int r = 0; r < x.length; r++) {
            out[r] = select(x[r], cols);
        }
        return out;
    }

    private static double[] select(double[] values, int[] cols) {
        double[] out = new double[cols.length];
        for (int j = 0; j < cols.length; j++) {
            out[j] = values[cols[j]];
        }
        return out;
    }

    private static CategoricalEncoding fitCategorical(TrainingFeatures training, String column) {
        Map<String, Integer> counts = new TreeMap<>();
        for (String v : TableColumns.text(training.table(), column, "training")) {
            if (v != null) {
                counts.merge(v, 1, Integer::sum);
            }
        }
        if (counts.isEmpty()) {
            throw new TransformationException(column, "Categorical column '" + column
                    + "' has no observed value in training");
        }
        // TreeMap order: ties resolve to the smallest category
        String mode = null;
        int best = -1;
        for (Map.Entry<String, Integer> e : counts.entrySet()) {
            if (e.getValue() > best) {
                best = e.getValue();
                mode = e.getKey();
            }
        }
        return new CategoricalEncoding(column, mode, new ArrayList<>(counts.keySet()));
    }
}
