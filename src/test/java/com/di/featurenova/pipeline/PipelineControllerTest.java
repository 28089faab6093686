package com.di.featurenova.pipeline;

import com.di.featurenova.config.PipelineProperties;
import com.di.featurenova.config.SourceProperties;
import com.di.featurenova.pipeline.artifact.StageMetadata;
import com.di.featurenova.pipeline.schema.SchemaSpecLoader;
import com.di.featurenova.pipeline.source.RecordSourceFactory;
import com.di.featurenova.pipeline.stage.IngestionEngine;
import com.di.featurenova.pipeline.stage.TransformationEngine;
import com.di.featurenova.pipeline.stage.ValidationEngine;
import com.di.featurenova.util.PipelineMetrics;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.core.io.DefaultResourceLoader;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Map;

import static com.di.featurenova.pipeline.artifact.StageMetadataKeys.*;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("PipelineController Tests")
class PipelineControllerTest {

    @TempDir
    Path tempDir;

    private SourceProperties   sourceProperties;
    private PipelineController controller;

    @BeforeEach
    void setUp() throws IOException {
        StringBuilder jsonl = new StringBuilder();
        for (int i = 0; i < 40; i++) {
            jsonl.append("{\"A\":").append(i).append(",\"B\":").append(i % 6)
                 .append(",\"color\":\"").append(i % 2 == 0 ? "red" : "blue").append('"')
                 .append(",\"target\":").append(i % 4 == 0 ? -1 : 1).append("}\n");
        }
        Path source = tempDir.resolve("source.jsonl");
        Files.writeString(source, jsonl.toString());

        PipelineProperties properties = new PipelineProperties();
        properties.setArtifactDir(tempDir.resolve("artifact").toString());
        properties.setSchemaFile("classpath:test-schema.yaml");
        sourceProperties = new SourceProperties();
        sourceProperties.getJsonl().setPath(source.toString());

        PipelineMetrics metrics = PipelineMetrics.standalone();
        controller = new PipelineController(new PipelineOrchestrator(properties,
                new RecordSourceFactory(sourceProperties),
                new IngestionEngine(properties.toIngestionConfig(), metrics),
                new ValidationEngine(properties.toValidationConfig(), metrics),
                new TransformationEngine(properties.toTransformationConfig(), metrics),
                new SchemaSpecLoader(),
                new DefaultResourceLoader(),
                Clock.systemDefaultZone()));
    }

    @Test
    @DisplayName("Should answer 201 for a successful run")
    void testRun_Created() {
        ResponseEntity<PipelineRunResponse> response = controller.run();

        assertEquals(HttpStatus.CREATED, response.getStatusCode());
        assertEquals(PipelineRunResponse.SUCCEEDED, response.getBody().getStatus());
        Map<String, Object> report = controller.driftReport(response.getBody().getRunId());
        assertTrue(report.containsKey("columns"));
    }

    @Test
    @DisplayName("Should answer 500 with the failed stage for a failed run")
    void testRun_Failed() {
        sourceProperties.getJsonl().setPath(tempDir.resolve("missing.jsonl").toString());

        ResponseEntity<PipelineRunResponse> response = controller.run();

        assertEquals(HttpStatus.INTERNAL_SERVER_ERROR, response.getStatusCode());
        assertEquals(STAGE_INGESTION, response.getBody().getFailedStage());
    }

    @Test
    @DisplayName("Should chain stages through metadata that survives JSON")
    void testStages_JsonHandOff() throws IOException {
        ObjectMapper mapper = new ObjectMapper();

        ResponseEntity<StageMetadata> ingestion = controller.ingest();
        assertEquals(HttpStatus.CREATED, ingestion.getStatusCode());

        String ingestionJson = mapper.writeValueAsString(ingestion.getBody());
        StageMetadata validation = controller.validate(mapper.readValue(ingestionJson, StageMetadata.class));
        assertTrue(validation.flag(VALIDATION_STATUS));

        String validationJson = mapper.writeValueAsString(validation);
        StageMetadata transformation = controller.transform(mapper.readValue(validationJson, StageMetadata.class));
        assertEquals(STAGE_TRANSFORMATION, transformation.getStage());
        assertTrue(Files.isRegularFile(transformation.path(TRANSFORMED_TRAIN_PATH)));
    }
}
