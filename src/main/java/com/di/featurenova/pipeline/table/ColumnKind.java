package com.di.featurenova.pipeline.table;

/** Resolved once per column at the ingestion boundary. */
public enum ColumnKind {
    NUMERIC,
    CATEGORICAL
}
