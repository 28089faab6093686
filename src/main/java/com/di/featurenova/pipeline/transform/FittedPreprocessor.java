package com.di.featurenova.pipeline.transform;

import com.di.featurenova.pipeline.source.SourceRecord;
import com.di.featurenova.pipeline.table.ColumnKind;
import com.di.featurenova.pipeline.table.FeatureTable;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.IntStream;

/**
 * Learned preprocessing parameters. Maps rows of any partition, or new
 * records at inference time, to fixed-width numeric vectors without
 * refitting.
 *
 * <p>Numeric columns listed in {@code power_lambdas} are mean-imputed and
 * Yeo-Johnson transformed; the others go through the configured imputer.
 * Scaling applies to every numeric column afterwards.
 *
 * <p>Output column order: numeric columns in training order, then the one-hot
 * block of each categorical column.
 */
public record FittedPreprocessor(@JsonProperty("format") String format,
                                 @JsonProperty("imputer") ImputerStrategy imputer,
                                 @JsonProperty("numeric_columns") List<String> numericColumns,
                                 @JsonProperty("numeric_means") double[] numericMeans,
                                 @JsonProperty("knn") KnnImputer knn,
                                 @JsonProperty("power_lambdas") Map<String, Double> powerLambdas,
                                 @JsonProperty("scale") boolean scale,
                                 @JsonProperty("scale_centers") double[] scaleCenters,
                                 @JsonProperty("scale_factors") double[] scaleFactors,
                                 @JsonProperty("categorical") List<CategoricalEncoding> categorical,
                                 @JsonProperty("target") TargetEncoder target) {

    public static final String FORMAT = "featurenova-preprocessor/2";

    public FittedPreprocessor {
        if (!FORMAT.equals(format)) {
            throw new IllegalArgumentException("Unsupported preprocessor format '" + format + "'");
        }
        numericColumns = List.copyOf(numericColumns);
        categorical    = categorical == null ? List.of() : List.copyOf(categorical);
        powerLambdas   = powerLambdas == null ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(powerLambdas));
        if (!numericColumns.containsAll(powerLambdas.keySet())) {
            throw new IllegalArgumentException("Power-transformed columns " + powerLambdas.keySet()
                    + " are not all numeric columns " + numericColumns);
        }
        if (numericMeans.length != numericColumns.size()
                || scaleCenters.length != numericColumns.size()
                || scaleFactors.length != numericColumns.size()) {
            throw new IllegalArgumentException("Numeric parameter arrays do not match " + numericColumns.size() + " columns");
        }
        if (imputer == ImputerStrategy.KNN && knn == null) {
            throw new IllegalArgumentException("KNN imputer parameters are missing");
        }
    }

    public List<String> outputColumns() {
        List<String> cols = new ArrayList<>(numericColumns);
        categorical.forEach(c -> cols.addAll(c.outputColumns()));
        return cols;
    }

    public String targetColumn() {
        return target.column();
    }

    /** Kinds the fitted columns had in training, for reading new data the same way. */
    public Map<String, ColumnKind> columnKinds() {
        Map<String, ColumnKind> kinds = new LinkedHashMap<>();
        numericColumns.forEach(c -> kinds.put(c, ColumnKind.NUMERIC));
        categorical.forEach(c -> kinds.put(c.column(), ColumnKind.CATEGORICAL));
        return kinds;
    }

    /** Feature vectors for every row of {@code table}; the target column is ignored. */
    public FeatureMatrix transform(FeatureTable table, String partition) {
        double[][] numeric = TableColumns.numeric(table, numericColumns, partition);
        imputeNumeric(numeric, knn, numericMeans, knnColumnIndexes(numericColumns, powerLambdas.keySet()));
        powerTransform(numeric, numericColumns, powerLambdas);

        List<String> columns = outputColumns();
        double[][] out = new double[table.rowCount()][columns.size()];
        for (int r = 0; r < out.length; r++) {
            for (int c = 0; c < numericColumns.size(); c++) {
                out[r][c] = (numeric[r][c] - scaleCenters[c]) / scaleFactors[c];
            }
        }
        int offset = numericColumns.size();
        for (CategoricalEncoding enc : categorical) {
            String[] values = TableColumns.text(table, enc.column(), partition);
            for (int r = 0; r < out.length; r++) {
                enc.encode(values[r], out[r], offset);
            }
            offset += enc.categories().size();
        }
        return new FeatureMatrix(columns, out);
    }

    /** Inference entry point for records that never went through a partition file. */
    public FeatureMatrix transformRecords(List<SourceRecord> records) {
        return transform(FeatureTable.fromRecords(records, columnKinds()), "inference");
    }

    /** Features followed by the encoded target as the last column. */
    public FeatureMatrix transformWithTarget(FeatureTable table, String partition) {
        return transform(table, partition).withLastColumn(target.column(), target.encode(table, partition));
    }

    /** Indexes of the numeric columns the KNN imputer covers. */
    static int[] knnColumnIndexes(List<String> numericColumns, Set<String> powerColumns) {
        return IntStream.range(0, numericColumns.size())
                .filter(c -> !powerColumns.contains(numericColumns.get(c)))
                .toArray();
    }

    static void imputeNumeric(double[][] rows, KnnImputer knn, double[] means, int[] knnColumns) {
        if (knn != null) {
            double[][] sub = new double[rows.length][knnColumns.length];
            for (int r = 0; r < rows.length; r++) {
                for (int j = 0; j < knnColumns.length; j++) {
                    sub[r][j] = rows[r][knnColumns[j]];
                }
            }
            knn.impute(sub);
            for (int r = 0; r < rows.length; r++) {
                for (int j = 0; j < knnColumns.length; j++) {
                    rows[r][knnColumns[j]] = sub[r][j];
                }
            }
        }
        // MEAN strategy, power-transformed columns, and any cell the KNN pass left empty
        for (double[] row : rows) {
            for (int c = 0; c < row.length; c++) {
                if (Double.isNaN(row[c])) {
                    row[c] = means[c];
                }
            }
        }
    }

    static void powerTransform(double[][] rows, List<String> numericColumns, Map<String, Double> powerLambdas) {
        for (int c = 0; c < numericColumns.size(); c++) {
            Double lambda = powerLambdas.get(numericColumns.get(c));
            if (lambda == null) {
                continue;
            }
            for (double[] row : rows) {
                row[c] = YeoJohnson.apply(row[c], lambda);
            }
        }
    }
}
