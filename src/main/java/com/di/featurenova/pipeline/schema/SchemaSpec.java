package com.di.featurenova.pipeline.schema;

import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Declared schema of a run: required columns (order-insensitive), the target
 * column and the columns that must hold numeric values.
 *
 * <p>Invariants: the target is required; every numerical column is required.
 */
public record SchemaSpec(Set<String> requiredColumns, String targetColumn, Set<String> numericalColumns) {

    public SchemaSpec {
        if (requiredColumns == null || requiredColumns.isEmpty()) {
            throw new IllegalArgumentException("Schema must declare at least one required column");
        }
        if (targetColumn == null || targetColumn.isBlank()) {
            throw new IllegalArgumentException("Schema must declare a target column");
        }
        if (!requiredColumns.contains(targetColumn)) {
            throw new IllegalArgumentException(
                    "Target column '" + targetColumn + "' is not among required columns " + requiredColumns);
        }
        numericalColumns = numericalColumns == null ? Set.of() : numericalColumns;
        Set<String> undeclared = new LinkedHashSet<>(numericalColumns);
        undeclared.removeAll(requiredColumns);
        if (!undeclared.isEmpty()) {
            throw new IllegalArgumentException("Numerical columns " + undeclared + " are not required columns");
        }
        requiredColumns  = Collections.unmodifiableSet(new LinkedHashSet<>(requiredColumns));
        numericalColumns = Collections.unmodifiableSet(new LinkedHashSet<>(numericalColumns));
    }

    public static SchemaSpec of(Collection<String> requiredColumns, String targetColumn) {
        return new SchemaSpec(new LinkedHashSet<>(requiredColumns), targetColumn, Set.of());
    }

    public static SchemaSpec of(Collection<String> requiredColumns, String targetColumn,
                                Collection<String> numericalColumns) {
        return new SchemaSpec(new LinkedHashSet<>(requiredColumns), targetColumn, new LinkedHashSet<>(numericalColumns));
    }

    /** Required columns absent from {@code actualColumns}, in declaration order. */
    public List<String> missingFrom(Collection<String> actualColumns) {
        Set<String> actual = new HashSet<>(actualColumns);
        return requiredColumns.stream()
                .filter(c -> !actual.contains(c))
                .collect(Collectors.toList());
    }

    public boolean isSatisfiedBy(Collection<String> actualColumns) {
        return missingFrom(actualColumns).isEmpty();
    }
}
