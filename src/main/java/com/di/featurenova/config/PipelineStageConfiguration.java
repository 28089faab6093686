package com.di.featurenova.config;

import com.di.featurenova.pipeline.schema.SchemaSpecLoader;
import com.di.featurenova.pipeline.stage.IngestionEngine;
import com.di.featurenova.pipeline.stage.TransformationEngine;
import com.di.featurenova.pipeline.stage.ValidationEngine;
import com.di.featurenova.util.PipelineMetrics;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Builds the stage engines from the bound properties. Each engine receives
 * its own immutable config record.
 */
@Slf4j
@Configuration
public class PipelineStageConfiguration {

    @Bean
    public PipelineMetrics pipelineMetrics(MeterRegistry meterRegistry) {
        return new PipelineMetrics(meterRegistry);
    }

    @Bean
    public IngestionEngine ingestionEngine(PipelineProperties properties, PipelineMetrics metrics) {
        IngestionConfig config = properties.toIngestionConfig();
        log.info("[CONFIG] {}", config);
        return new IngestionEngine(config, metrics);
    }

    @Bean
    public ValidationEngine validationEngine(PipelineProperties properties, PipelineMetrics metrics) {
        ValidationConfig config = properties.toValidationConfig();
        log.info("[CONFIG] {}", config);
        return new ValidationEngine(config, metrics);
    }

    @Bean
    public TransformationEngine transformationEngine(PipelineProperties properties, PipelineMetrics metrics) {
        TransformationConfig config = properties.toTransformationConfig();
        log.info("[CONFIG] {}", config);
        return new TransformationEngine(config, metrics);
    }

    @Bean
    public SchemaSpecLoader schemaSpecLoader() {
        return new SchemaSpecLoader();
    }

    @Bean
    public Clock pipelineClock() {
        return Clock.systemDefaultZone();
    }
}
