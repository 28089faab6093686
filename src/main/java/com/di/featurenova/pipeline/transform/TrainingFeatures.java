package com.di.featurenova.pipeline.transform;

import com.di.featurenova.pipeline.error.TransformationException;
import com.di.featurenova.pipeline.table.CellValues;
import com.di.featurenova.pipeline.table.ColumnKind;
import com.di.featurenova.pipeline.table.FeatureTable;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Set;

/**
 * The training partition, split into numeric features, categorical features
 * and the target. {@link PreprocessorSpec#fit} accepts only this type, so
 * fitted parameters can only come from training rows.
 */
public final class TrainingFeatures {

    private final FeatureTable table;
    private final String       targetColumn;
    private final List<String> numericColumns;
    private final List<String> categoricalColumns;

    private TrainingFeatures(FeatureTable table, String targetColumn,
                             List<String> numericColumns, List<String> categoricalColumns) {
        this.table              = table;
        this.targetColumn       = targetColumn;
        this.numericColumns     = List.copyOf(numericColumns);
        this.categoricalColumns = List.copyOf(categoricalColumns);
    }

    /**
     * @param declaredNumeric columns that must be numeric whatever their
     *                        inferred kind; may be empty
     * @throws TransformationException if the target is absent, no feature
     *         column remains, or a declared numeric column holds a
     *         non-coercible value
     */
    public static TrainingFeatures fromTrainingPartition(FeatureTable train, String targetColumn,
                                                         Collection<String> declaredNumeric) {
        if (!train.hasColumn(targetColumn)) {
            throw new TransformationException(targetColumn, "Target column '" + targetColumn
                    + "' is absent from the training partition");
        }
        Set<String> declared = Set.copyOf(declaredNumeric);
        List<String> numeric = new ArrayList<>();
        List<String> categorical = new ArrayList<>();
        for (String column : train.columns()) {
            if (column.equals(targetColumn)) {
                continue;
            }
            if (train.kind(column) == ColumnKind.NUMERIC) {
                numeric.add(column);
            } else if (declared.contains(column)) {
                throw nonCoercible(train, column, "training");
            } else {
                categorical.add(column);
            }
        }
        if (numeric.isEmpty() && categorical.isEmpty()) {
            throw new TransformationException(null, "No feature columns besides target '" + targetColumn + "'");
        }
        return new TrainingFeatures(train, targetColumn, numeric, categorical);
    }

    static TransformationException nonCoercible(FeatureTable table, String column, String partition) {
        int c = table.columnIndex(column);
        for (int r = 0; r < table.rowCount(); r++) {
            Object v = table.value(r, c);
            if (!CellValues.isMissing(v) && CellValues.toDouble(v) == null) {
                return new TransformationException(column, "Numeric column '" + column + "' has non-coercible value '"
                        + v + "' at " + partition + " row " + r);
            }
        }
        return new TransformationException(column, "Numeric column '" + column + "' is not numeric in " + partition);
    }

    public FeatureTable table() {
        return table;
    }

    public String targetColumn() {
        return targetColumn;
    }

    public List<String> numericColumns() {
        return numericColumns;
    }

    public List<String> categoricalColumns() {
        return categoricalColumns;
    }

    public int rowCount() {
        return table.rowCount();
    }
}
