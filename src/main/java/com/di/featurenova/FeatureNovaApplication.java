package com.di.featurenova;

import com.di.featurenova.config.PipelineProperties;
import com.di.featurenova.pipeline.PipelineOrchestrator;
import com.di.featurenova.pipeline.PipelineRunResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.autoconfigure.jdbc.DataSourceTransactionManagerAutoConfiguration;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.ConfigurableApplicationContext;

/**
 * The record source opens its own per-run connection pool, so no application
 * DataSource is auto-configured.
 */
@Slf4j
@SpringBootApplication(exclude = {
		DataSourceAutoConfiguration.class,
		DataSourceTransactionManagerAutoConfiguration.class
})
@ConfigurationPropertiesScan
public class FeatureNovaApplication {

	public static void main(String[] args) {
		ConfigurableApplicationContext ctx = SpringApplication.run(FeatureNovaApplication.class, args);
		PipelineProperties pipelineProps = ctx.getBean(PipelineProperties.class);
		// Batch mode for schedulers: one run at startup, non-zero exit on failure
		if (pipelineProps.isRunOnStartup()) {
			PipelineRunResponse response = ctx.getBean(PipelineOrchestrator.class).execute();
			if (!response.succeeded()) {
				log.error("[STARTUP] run {} failed in stage {}: {}",
						response.getRunId(), response.getFailedStage(), response.getMessage());
				System.exit(SpringApplication.exit(ctx, () -> 1));
			}
		}
	}
}
