package com.di.flightwarehouse;

import com.di.flightwarehouse.config.PipelineProperties;
import com.di.flightwarehouse.pipeline.FlightPipelineOrchestrator;
import com.di.flightwarehouse.pipeline.PipelineRunReport;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.ConfigurableApplicationContext;

@SpringBootApplication
@ConfigurationPropertiesScan
public class FlightWarehouseApplication {

	public static void main(String[] args) {
		ConfigurableApplicationContext ctx = SpringApplication.run(FlightWarehouseApplication.class, args);
		PipelineProperties pipelineProps = ctx.getBean(PipelineProperties.class);
		// Batch mode: run the DAG once at startup. Otherwise the scheduler drives it through /api/pipeline.
		if (pipelineProps.isRunOnStartup()) {
			PipelineRunReport report = ctx.getBean(FlightPipelineOrchestrator.class).runAll();
			if (pipelineProps.isExitAfterStartupRun()) {
				int exitCode = SpringApplication.exit(ctx, () -> report.isSucceeded() ? 0 : 1);
				System.exit(exitCode);
			}
		}
	}
}
