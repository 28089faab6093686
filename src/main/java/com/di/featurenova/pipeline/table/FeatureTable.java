package com.di.featurenova.pipeline.table;

import com.di.featurenova.pipeline.source.SourceRecord;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * In-memory table with a fixed ordered column set and a resolved
 * {@link ColumnKind} per column.
 *
 * <p>Numeric cells are stored as {@link Double}, categorical cells as
 * {@link String}; missing cells are {@code null}. Rows are immutable once the
 * table is built.
 */
public final class FeatureTable {

    private final List<String>            columns;
    private final Map<String, Integer>    index;
    private final Map<String, ColumnKind> kinds;
    private final List<Object[]>          rows;

    private FeatureTable(List<String> columns, Map<String, ColumnKind> kinds, List<Object[]> rows) {
        this.columns = List.copyOf(columns);
        Map<String, Integer> idx = new LinkedHashMap<>();
        for (int i = 0; i < columns.size(); i++) {
            idx.put(columns.get(i), i);
        }
        this.index = Collections.unmodifiableMap(idx);
        this.kinds = Collections.unmodifiableMap(new LinkedHashMap<>(kinds));
        this.rows  = Collections.unmodifiableList(rows);
    }

    /**
     * Builds a table from heterogeneous records: the column set is the union
     * of record keys in first-seen order, absent keys are missing cells.
     */
    public static FeatureTable fromRecords(Collection<SourceRecord> records) {
        return fromRecords(records, Map.of());
    }

    /** As {@link #fromRecords(Collection)}, with column kinds pinned as in {@link #fromRawRows(List, List, Map)}. */
    public static FeatureTable fromRecords(Collection<SourceRecord> records, Map<String, ColumnKind> pinnedKinds) {
        Set<String> columns = new LinkedHashSet<>();
        for (SourceRecord r : records) {
            columns.addAll(r.columns());
        }
        List<String> cols = new ArrayList<>(columns);
        List<Object[]> raw = new ArrayList<>(records.size());
        for (SourceRecord r : records) {
            Object[] row = new Object[cols.size()];
            for (int c = 0; c < cols.size(); c++) {
                row[c] = r.get(cols.get(c));
            }
            raw.add(row);
        }
        return resolve(cols, raw, pinnedKinds);
    }

    /** Builds a table from raw cells (e.g. CSV text), inferring column kinds. */
    public static FeatureTable fromRawRows(List<String> columns, List<? extends Object[]> rawRows) {
        return fromRawRows(columns, rawRows, Map.of());
    }

    /**
     * Builds a table from raw cells with the kinds resolved when the data was
     * first ingested. Columns absent from {@code pinnedKinds} are inferred.
     */
    public static FeatureTable fromRawRows(List<String> columns, List<? extends Object[]> rawRows,
                                           Map<String, ColumnKind> pinnedKinds) {
        List<Object[]> raw = new ArrayList<>(rawRows.size());
        for (Object[] r : rawRows) {
            if (r.length > columns.size()) {
                throw new IllegalArgumentException(
                        "Row has " + r.length + " cells but table has " + columns.size() + " columns");
            }
            Object[] row = new Object[columns.size()];
            System.arraycopy(r, 0, row, 0, r.length);
            raw.add(row);
        }
        return resolve(new ArrayList<>(columns), raw, pinnedKinds);
    }

    /**
     * A pinned CATEGORICAL column keeps its cells as text even when every
     * value looks numeric. A pinned NUMERIC column holding a non-coercible
     * value resolves to CATEGORICAL, so numeric consumers report the value
     * instead of reading it as missing.
     */
    private static FeatureTable resolve(List<String> cols, List<Object[]> raw, Map<String, ColumnKind> pinnedKinds) {
        if (new LinkedHashSet<>(cols).size() != cols.size()) {
            throw new IllegalArgumentException("Duplicate column names: " + cols);
        }
        Map<String, ColumnKind> kinds = new LinkedHashMap<>();
        for (int c = 0; c < cols.size(); c++) {
            ColumnKind pinned = pinnedKinds.get(cols.get(c));
            kinds.put(cols.get(c), pinned == ColumnKind.CATEGORICAL ? ColumnKind.CATEGORICAL : inferKind(raw, c));
        }
        List<Object[]> rows = new ArrayList<>(raw.size());
        for (Object[] r : raw) {
            Object[] row = new Object[cols.size()];
            for (int c = 0; c < cols.size(); c++) {
                row[c] = kinds.get(cols.get(c)) == ColumnKind.NUMERIC
                        ? CellValues.toDouble(r[c])
                        : CellValues.toText(r[c]);
            }
            rows.add(row);
        }
        return new FeatureTable(cols, kinds, rows);
    }

    /** All-missing columns resolve to NUMERIC. */
    private static ColumnKind inferKind(List<Object[]> raw, int c) {
        for (Object[] r : raw) {
            Object v = r[c];
            if (!CellValues.isMissing(v) && CellValues.toDouble(v) == null) {
                return ColumnKind.CATEGORICAL;
            }
        }
        return ColumnKind.NUMERIC;
    }

    public List<String> columns() {
        return columns;
    }

    public boolean hasColumn(String column) {
        return index.containsKey(column);
    }

    public int columnIndex(String column) {
        Integer i = index.get(column);
        if (i == null) {
            throw new IllegalArgumentException("Unknown column '" + column + "' (have " + columns + ")");
        }
        return i;
    }

    public ColumnKind kind(String column) {
        columnIndex(column);
        return kinds.get(column);
    }

    public Map<String, ColumnKind> kinds() {
        return kinds;
    }

    public int rowCount() {
        return rows.size();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    public Object value(int row, String column) {
        return rows.get(row)[columnIndex(column)];
    }

    public Object value(int row, int column) {
        return rows.get(row)[column];
    }

    /** Copy of one row's cells in column order. */
    public Object[] row(int row) {
        return rows.get(row).clone();
    }

    /** Column values in row order; missing cells are {@code null}. */
    public List<Object> column(String column) {
        int c = columnIndex(column);
        List<Object> out = new ArrayList<>(rows.size());
        for (Object[] r : rows) {
            out.add(r[c]);
        }
        return out;
    }

    /** Non-missing values of a NUMERIC column. */
    public double[] observedNumeric(String column) {
        if (kind(column) != ColumnKind.NUMERIC) {
            throw new IllegalArgumentException("Column '" + column + "' is not numeric");
        }
        int c = columnIndex(column);
        return rows.stream()
                .map(r -> r[c])
                .filter(v -> v != null)
                .mapToDouble(v -> (Double) v)
                .toArray();
    }

    /** Rows at {@code rowIndexes} in the given order, same columns and kinds. */
    public FeatureTable select(int[] rowIndexes) {
        List<Object[]> out = new ArrayList<>(rowIndexes.length);
        for (int i : rowIndexes) {
            out.add(rows.get(i));
        }
        return new FeatureTable(columns, kinds, out);
    }

    /** Text form of every row, as written to CSV. */
    public List<String[]> toTextRows() {
        List<String[]> out = new ArrayList<>(rows.size());
        for (Object[] r : rows) {
            String[] text = new String[r.length];
            for (int c = 0; c < r.length; c++) {
                text[c] = r[c] == null ? "" : CellValues.toText(r[c]);
            }
            out.add(text);
        }
        return out;
    }

    @Override
    public String toString() {
        return "FeatureTable[" + rows.size() + " rows x " + columns.size() + " columns " + kinds + "]";
    }
}
