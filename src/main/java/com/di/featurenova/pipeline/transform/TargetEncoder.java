package com.di.featurenova.pipeline.transform;

import com.di.featurenova.pipeline.error.TransformationException;
import com.di.featurenova.pipeline.table.CellValues;
import com.di.featurenova.pipeline.table.ColumnKind;
import com.di.featurenova.pipeline.table.FeatureTable;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.TreeSet;

/**
 * Numeric encoding of the target column. Numeric targets pass through, with
 * {@code -1} mapped to {@code 0} when enabled; text targets are label
 * encoded against the sorted training labels.
 */
public record TargetEncoder(@JsonProperty("column") String column,
                            @JsonProperty("numeric") boolean numeric,
                            @JsonProperty("map_negative_one_to_zero") boolean mapNegativeOneToZero,
                            @JsonProperty("classes") List<String> classes) {

    public TargetEncoder {
        classes = classes == null ? List.of() : List.copyOf(classes);
    }

    static TargetEncoder fit(FeatureTable train, String column, boolean mapNegativeOneToZero) {
        if (train.kind(column) == ColumnKind.NUMERIC) {
            return new TargetEncoder(column, true, mapNegativeOneToZero, List.of());
        }
        TreeSet<String> labels = new TreeSet<>();
        for (Object v : train.column(column)) {
            if (v != null) {
                labels.add(CellValues.toText(v));
            }
        }
        return new TargetEncoder(column, false, mapNegativeOneToZero, List.copyOf(labels));
    }

    double[] encode(FeatureTable table, String partition) {
        if (!table.hasColumn(column)) {
            throw new TransformationException(column, "Target column '" + column
                    + "' is absent from the " + partition + " partition");
        }
        int c = table.columnIndex(column);
        double[] out = new double[table.rowCount()];
        for (int r = 0; r < out.length; r++) {
            Object v = table.value(r, c);
            if (CellValues.isMissing(v)) {
                throw new TransformationException(column, "Target is missing at " + partition + " row " + r);
            }
            out[r] = numeric ? encodeNumeric(v, partition, r) : encodeLabel(v, partition, r);
        }
        return out;
    }

    private double encodeNumeric(Object v, String partition, int row) {
        Double d = CellValues.toDouble(v);
        if (d == null) {
            throw new TransformationException(column, "Target value '" + v + "' at " + partition + " row "
                    + row + " is not numeric");
        }
        return mapNegativeOneToZero && d == -1.0 ? 0.0 : d;
    }

    private double encodeLabel(Object v, String partition, int row) {
        int idx = classes.indexOf(CellValues.toText(v));
        if (idx < 0) {
            throw new TransformationException(column, "Target label '" + v + "' at " + partition + " row "
                    + row + " was not seen in training");
        }
        return idx;
    }
}
