package com.di.featurenova.pipeline.error;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Base type of every failure raised by a pipeline stage.
 *
 * <p>Carries the stage that failed and a small diagnostic context (column
 * name, rows read, missing columns...) so a failed run can be diagnosed from
 * the log line or the REST error body without re-running it.
 */
public class PipelineException extends RuntimeException {

    private final String              stage;
    private final Map<String, Object> context;

    protected PipelineException(String stage, String message,
                                Map<String, Object> context, Throwable cause) {
        super(message, cause);
        this.stage   = stage;
        this.context = context == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(context));
    }

    /** {@code ingestion}, {@code validation} or {@code transformation}. */
    public String getStage() {
        return stage;
    }

    public Map<String, Object> getContext() {
        return context;
    }
}
