package com.di.featurenova.pipeline.error;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fatal ingestion failure: unreachable or failing source, empty result,
 * missing or unusable target column, or an output file that cannot be written.
 */
public class IngestionException extends PipelineException {

    private final long rowsRead;

    public IngestionException(String message, long rowsRead) {
        this(message, rowsRead, null);
    }

    public IngestionException(String message, long rowsRead, Throwable cause) {
        super("ingestion", message, context(rowsRead, cause), cause);
        this.rowsRead = rowsRead;
    }

    /** Rows successfully read from the source before the failure. */
    public long getRowsRead() {
        return rowsRead;
    }

    private static Map<String, Object> context(long rowsRead, Throwable cause) {
        Map<String, Object> ctx = new LinkedHashMap<>();
        ctx.put("rowsRead", rowsRead);
        if (cause != null) {
            ctx.put("cause", cause.getClass().getSimpleName() + ": " + cause.getMessage());
        }
        return ctx;
    }
}
