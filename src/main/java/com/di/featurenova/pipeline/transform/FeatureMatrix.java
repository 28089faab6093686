package com.di.featurenova.pipeline.transform;

import java.util.ArrayList;
import java.util.List;

/**
 * Dense row-major numeric matrix with named columns. Missing values are
 * {@link Double#NaN}.
 */
public record FeatureMatrix(List<String> columns, double[][] rows) {

    public FeatureMatrix {
        columns = List.copyOf(columns);
        for (int r = 0; r < rows.length; r++) {
            if (rows[r].length != columns.size()) {
                throw new IllegalArgumentException("Row " + r + " has " + rows[r].length
                        + " values but matrix has " + columns.size() + " columns");
            }
        }
    }

    public int rowCount() {
        return rows.length;
    }

    public int width() {
        return columns.size();
    }

    public double value(int row, int column) {
        return rows[row][column];
    }

    public long missingCount() {
        long n = 0;
        for (double[] row : rows) {
            for (double v : row) {
                if (Double.isNaN(v)) {
                    n++;
                }
            }
        }
        return n;
    }

    /** New matrix with {@code values} appended as the last column. */
    public FeatureMatrix withLastColumn(String name, double[] values) {
        if (values.length != rows.length) {
            throw new IllegalArgumentException("Column '" + name + "' has " + values.length
                    + " values but matrix has " + rows.length + " rows");
        }
        List<String> cols = new ArrayList<>(columns);
        cols.add(name);
        double[][] out = new double[rows.length][];
        for (int r = 0; r < rows.length; r++) {
            out[r] = new double[columns.size() + 1];
            System.arraycopy(rows[r], 0, out[r], 0, columns.size());
            out[r][columns.size()] = values[r];
        }
        return new FeatureMatrix(cols, out);
    }
}
