package com.di.flightwarehouse.config;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Ingestion pipeline settings (from application.yml, prefix {@code flightwarehouse.pipeline}).
 * <p>
 * Storage layout defaults to the {@code flight-data} bucket with fact CSVs under {@code raw/}
 * and the airports reference file at {@code raw/airports.dat}.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "flightwarehouse.pipeline")
public class PipelineProperties {

    /** Bucket holding the raw fact and reference files. */
    @NotBlank
    private String bucket = "flight-data";

    /** Object key prefix under which fact CSV files are discovered. */
    @NotBlank
    private String rawPrefix = "raw/";

    /** Object key of the OpenFlights airports reference file. */
    @NotBlank
    private String airportsKey = "raw/airports.dat";

    /** Local directory pushed to the bucket by the upload stage. */
    private String localRawDir = "data/raw";

    /** When false the upload stage is a no-op (files are already in the bucket). */
    private boolean uploadEnabled = true;

    /** Rows per fact-loader chunk. Bounds memory and the size of each batched write. */
    @Min(1)
    private int chunkSize = 50_000;

    /** Quality gate fails when the latest file's rejection rate reaches this percentage. */
    @DecimalMin("0.0")
    @DecimalMax("100.0")
    private double rejectionThresholdPct = 5.0;

    /** Lowest plausible delay in minutes (early departures/arrivals). */
    private int minDelayMinutes = -150;

    /** Highest plausible delay in minutes. */
    private int maxDelayMinutes = 5000;

    /** Retries per stage after the first attempt. Quality gate failures are never retried. */
    @Min(0)
    private int maxRetries = 2;

    /** Fixed wait between stage attempts. */
    private Duration retryBackoff = Duration.ofMinutes(2);

    /** Threads for the stages that run side by side (carriers and dates). */
    @Min(1)
    private int parallelism = 2;

    /** Run the full DAG once when the application starts. */
    private boolean runOnStartup = false;

    /** Exit the JVM with 0/1 after the startup run (batch container mode). */
    private boolean exitAfterStartupRun = false;
}
