package com.di.featurenova.pipeline;

import com.di.featurenova.pipeline.artifact.StageMetadata;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * REST surface of the pipeline. Each stage is exposed as a callable that
 * takes the previous stage's metadata and returns its own.
 *
 * <p><strong>Base path:</strong> {@code /api/pipeline}
 *
 * <table border="1">
 * <tr><th>Method</th><th>Path</th><th>Description</th></tr>
 * <tr><td>POST</td><td>/api/pipeline/runs</td>
 *     <td>Run all three stages against the configured source (synchronous)</td></tr>
 * <tr><td>POST</td><td>/api/pipeline/stages/ingestion</td>
 *     <td>Start a run and ingest; returns ingestion metadata</td></tr>
 * <tr><td>POST</td><td>/api/pipeline/stages/validation</td>
 *     <td>Body: ingestion metadata; returns validation metadata</td></tr>
 * <tr><td>POST</td><td>/api/pipeline/stages/transformation</td>
 *     <td>Body: validation metadata; returns transformation metadata</td></tr>
 * <tr><td>GET</td><td>/api/pipeline/runs/{runId}/drift-report</td>
 *     <td>Drift report of a validated run</td></tr>
 * </table>
 *
 * <p>Stage errors are mapped to HTTP statuses by
 * {@link com.di.featurenova.exception.GlobalExceptionHandler}.
 */
@RestController
@RequestMapping("/api/pipeline")
@Slf4j
@RequiredArgsConstructor
public class PipelineController {

    private final PipelineOrchestrator orchestrator;

    /**
     * Returns {@code 201 Created} when every stage succeeded, otherwise
     * {@code 500} with the failed stage and error category.
     */
    @PostMapping("/runs")
    public ResponseEntity<PipelineRunResponse> run() {
        log.info("[CONTROLLER] POST /api/pipeline/runs");
        PipelineRunResponse response = orchestrator.execute();
        HttpStatus status = response.succeeded() ? HttpStatus.CREATED : HttpStatus.INTERNAL_SERVER_ERROR;
        return ResponseEntity.status(status).body(response);
    }

    @PostMapping("/stages/ingestion")
    public ResponseEntity<StageMetadata> ingest() {
        log.info("[CONTROLLER] POST /api/pipeline/stages/ingestion");
        return ResponseEntity.status(HttpStatus.CREATED).body(orchestrator.runIngestion());
    }

    @PostMapping("/stages/validation")
    public StageMetadata validate(@RequestBody StageMetadata ingestion) {
        log.info("[CONTROLLER] POST /api/pipeline/stages/validation runDir={}", ingestion.getRunDirectory());
        return orchestrator.runValidation(ingestion);
    }

    @PostMapping("/stages/transformation")
    public StageMetadata transform(@RequestBody StageMetadata validation) {
        log.info("[CONTROLLER] POST /api/pipeline/stages/transformation runDir={}", validation.getRunDirectory());
        return orchestrator.runTransformation(validation);
    }

    @GetMapping("/runs/{runId}/drift-report")
    public Map<String, Object> driftReport(@PathVariable String runId) {
        return orchestrator.readDriftReport(runId);
    }
}
