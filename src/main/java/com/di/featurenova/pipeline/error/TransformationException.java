package com.di.featurenova.pipeline.error;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fatal transformation failure: non-coercible numeric data, an imputer that
 * cannot be fitted, or an unusable target column. Names the offending column.
 */
public class TransformationException extends PipelineException {

    private final String column;

    public TransformationException(String column, String message) {
        this(column, message, null);
    }

    public TransformationException(String column, String message, Throwable cause) {
        super("transformation", message, context(column), cause);
        this.column = column;
    }

    /** Offending column, or {@code null} when the failure is not column specific. */
    public String getColumn() {
        return column;
    }

    private static Map<String, Object> context(String column) {
        Map<String, Object> ctx = new LinkedHashMap<>();
        if (column != null) {
            ctx.put("column", column);
        }
        return ctx;
    }
}
