package com.di.flightwarehouse.util;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Metrics for the ingestion pipeline: fact rows loaded/rejected, files completed,
 * stage durations and failures, and quality check outcomes.
 */
@Slf4j
@Component
public class PipelineMetrics {

    private final MeterRegistry meterRegistry;

    private final Counter rowsLoadedCounter;
    private final Counter rowsRejectedCounter;
    private final Counter filesLoadedCounter;
    private final Counter weatherObservationsCounter;

    public PipelineMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.rowsLoadedCounter = Counter.builder("flightwarehouse.flights.rows")
                .description("Fact rows accepted by the flight loader")
                .tag("outcome", "loaded")
                .register(meterRegistry);

        this.rowsRejectedCounter = Counter.builder("flightwarehouse.flights.rows")
                .description("Fact rows rejected by referential validation")
                .tag("outcome", "rejected")
                .register(meterRegistry);

        this.filesLoadedCounter = Counter.builder("flightwarehouse.flights.files")
                .description("Fact files completed")
                .register(meterRegistry);

        this.weatherObservationsCounter = Counter.builder("flightwarehouse.weather.observations")
                .description("Weather observations inserted")
                .register(meterRegistry);
    }

    // ============================================================================
    // Fact loading
    // ============================================================================

    public void recordChunk(int loaded, int rejected) {
        rowsLoadedCounter.increment(loaded);
        rowsRejectedCounter.increment(rejected);
    }

    public void recordFileCompleted() {
        filesLoadedCounter.increment();
    }

    public void recordWeatherLoaded(int inserted) {
        weatherObservationsCounter.increment(inserted);
    }

    // ============================================================================
    // Stages
    // ============================================================================

    /**
     * Records how long a stage took and whether it ended successfully.
     *
     * @param stage      stage task name
     * @param succeeded  final outcome after retries
     * @param durationMs wall time including retries
     */
    public void recordStage(String stage, boolean succeeded, long durationMs) {
        Timer.builder("flightwarehouse.stage.duration")
                .description("Wall time per pipeline stage")
                .tag("stage", stage)
                .tag("status", succeeded ? "success" : "failure")
                .register(meterRegistry)
                .record(durationMs, TimeUnit.MILLISECONDS);
        if (!succeeded) {
            Counter.builder("flightwarehouse.stage.failures")
                    .description("Stages that failed after exhausting retries")
                    .tag("stage", stage)
                    .register(meterRegistry)
                    .increment();
        }
        log.debug("Recorded stage: stage={}, succeeded={}, durationMs={}", stage, succeeded, durationMs);
    }

    public void recordStageRetry(String stage) {
        Counter.builder("flightwarehouse.stage.retries")
                .tag("stage", stage)
                .register(meterRegistry)
                .increment();
    }

    // ============================================================================
    // Quality gate
    // ============================================================================

    public void recordQualityCheck(String check, boolean passed) {
        Counter.builder("flightwarehouse.quality.checks")
                .description("Quality check outcomes")
                .tag("check", check)
                .tag("result", passed ? "pass" : "fail")
                .register(meterRegistry)
                .increment();
    }
}
