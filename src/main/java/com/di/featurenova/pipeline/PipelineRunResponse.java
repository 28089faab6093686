package com.di.featurenova.pipeline;

import com.di.featurenova.pipeline.artifact.StageMetadata;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of a full pipeline run.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PipelineRunResponse {

    public static final String SUCCEEDED = "SUCCEEDED";
    public static final String FAILED    = "FAILED";

    /** Run directory name under the artifact root; null if the run never started. */
    private String runId;

    /** {@link #SUCCEEDED} or {@link #FAILED}. */
    private String status;

    private String runDirectory;

    /** Stage that raised the failure. */
    private String failedStage;

    /** {@code ErrorCategory} name of the failure. */
    private String errorCategory;

    /** Advisory drift flag from validation; null if validation did not finish. */
    private Boolean driftDetected;

    /** Metadata returned by each completed stage, in execution order. */
    @Builder.Default
    private Map<String, StageMetadata> stages = new LinkedHashMap<>();

    private long durationMs;

    /** Human-readable summary or error detail. */
    private String message;

    public boolean succeeded() {
        return SUCCEEDED.equals(status);
    }
}
