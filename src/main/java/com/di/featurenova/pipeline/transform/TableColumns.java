package com.di.featurenova.pipeline.transform;

import com.di.featurenova.pipeline.error.TransformationException;
import com.di.featurenova.pipeline.table.CellValues;
import com.di.featurenova.pipeline.table.FeatureTable;

import java.util.List;

/** Extraction of fitted feature columns from a table of any partition. */
final class TableColumns {

    private TableColumns() {
    }

    /** Row-major numeric values, NaN where missing. */
    static double[][] numeric(FeatureTable table, List<String> columns, String partition) {
        int[] idx = indexes(table, columns, partition);
        double[][] out = new double[table.rowCount()][columns.size()];
        for (int r = 0; r < table.rowCount(); r++) {
            for (int j = 0; j < idx.length; j++) {
                Object v = table.value(r, idx[j]);
                if (CellValues.isMissing(v)) {
                    out[r][j] = Double.NaN;
                    continue;
                }
                Double d = CellValues.toDouble(v);
                if (d == null) {
                    String column = columns.get(j);
                    throw new TransformationException(column, "Numeric column '" + column
                            + "' has non-coercible value '" + v + "' at " + partition + " row " + r);
                }
                out[r][j] = d;
            }
        }
        return out;
    }

    /** Text values of one column, {@code null} where missing. */
    static String[] text(FeatureTable table, String column, String partition) {
        int c = indexes(table, List.of(column), partition)[0];
        String[] out = new String[table.rowCount()];
        for (int r = 0; r < out.length; r++) {
            out[r] = CellValues.toText(table.value(r, c));
        }
        return out;
    }

    private static int[] indexes(FeatureTable table, List<String> columns, String partition) {
        int[] idx = new int[columns.size()];
        for (int j = 0; j < idx.length; j++) {
            String column = columns.get(j);
            if (!table.hasColumn(column)) {
                throw new TransformationException(column, "Feature column '" + column
                        + "' is absent from the " + partition + " partition");
            }
            idx[j] = table.columnIndex(column);
        }
        return idx;
    }
}
