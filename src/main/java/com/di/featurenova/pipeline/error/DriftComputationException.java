package com.di.featurenova.pipeline.error;

import java.util.Map;

/**
 * The drift test for a single column could not be computed.
 *
 * <p>Non-fatal: the drift detector absorbs it and records the column as
 * not applicable in the report.
 */
public class DriftComputationException extends PipelineException {

    private final String column;

    public DriftComputationException(String column, String message, Throwable cause) {
        super("validation", "Drift test failed for column '" + column + "': " + message,
              Map.of("column", column), cause);
        this.column = column;
    }

    public String getColumn() {
        return column;
    }
}
