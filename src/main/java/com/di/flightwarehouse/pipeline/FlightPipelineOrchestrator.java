package com.di.flightwarehouse.pipeline;

import com.di.flightwarehouse.dimension.AirportLoader;
import com.di.flightwarehouse.dimension.CarrierExtractor;
import com.di.flightwarehouse.dimension.DateDimGenerator;
import com.di.flightwarehouse.exception.PipelineAlreadyRunningException;
import com.di.flightwarehouse.fact.FlightLoadService;
import com.di.flightwarehouse.ledger.PendingFileResolver;
import com.di.flightwarehouse.quality.QualityGate;
import com.di.flightwarehouse.storage.RawFileUploader;
import com.di.flightwarehouse.util.MdcPropagation;
import com.di.flightwarehouse.util.PipelineMetrics;
import com.di.flightwarehouse.weather.WeatherLoader;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs the ingestion DAG.
 *
 * <pre>
 *   upload_raw_files -> load_airports -> [extract_carriers, generate_date_dim] -> load_flights
 *                    -> load_weather -> quality_checks
 * </pre>
 *
 * <p>Each stage runs under the {@link RetryPolicy}. When a stage gives up, everything downstream
 * is skipped and the run is {@code FAILED}. One run at a time per process; a second trigger while a
 * run is active is refused. Nothing here coordinates separate processes.</p>
 */
@Slf4j
@Service
public class FlightPipelineOrchestrator {

    private final RawFileUploader rawFileUploader;
    private final AirportLoader airportLoader;
    private final PendingFileResolver pendingFileResolver;
    private final CarrierExtractor carrierExtractor;
    private final DateDimGenerator dateDimGenerator;
    private final FlightLoadService flightLoadService;
    private final WeatherLoader weatherLoader;
    private final QualityGate qualityGate;
    private final RetryPolicy retryPolicy;
    private final ExecutorService stageExecutor;
    private final PipelineMetrics metrics;

    private final AtomicReference<String> activeRun = new AtomicReference<>();

    public FlightPipelineOrchestrator(RawFileUploader rawFileUploader,
                                      AirportLoader airportLoader,
                                      PendingFileResolver pendingFileResolver,
                                      CarrierExtractor carrierExtractor,
                                      DateDimGenerator dateDimGenerator,
                                      FlightLoadService flightLoadService,
                                      WeatherLoader weatherLoader,
                                      QualityGate qualityGate,
                                      RetryPolicy retryPolicy,
                                      @Qualifier("stageExecutor") ExecutorService stageExecutor,
                                      PipelineMetrics metrics) {
        this.rawFileUploader = rawFileUploader;
        this.airportLoader = airportLoader;
        this.pendingFileResolver = pendingFileResolver;
        this.carrierExtractor = carrierExtractor;
        this.dateDimGenerator = dateDimGenerator;
        this.flightLoadService = flightLoadService;
        this.weatherLoader = weatherLoader;
        this.qualityGate = qualityGate;
        this.retryPolicy = retryPolicy;
        this.stageExecutor = stageExecutor;
        this.metrics = metrics;
    }

    /* ------------------------------------------------------------------ */
    /* Full run                                                             */
    /* ------------------------------------------------------------------ */

    public PipelineRunReport runAll() {
        String runId = newRunId();
        acquire(runId);
        MDC.put(MdcPropagation.RUN_ID, runId);
        Instant startedAt = Instant.now();
        try {
            log.info("[ORCHESTRATOR] runId={} starting", runId);
            List<StageExecution> stages = buildGraph().execute(retryPolicy, stageExecutor);
            stages.forEach(this::record);

            boolean succeeded = stages.stream().allMatch(StageExecution::isSucceeded);
            PipelineRunReport report = PipelineRunReport.builder()
                    .runId(runId)
                    .status(succeeded ? PipelineRunReport.SUCCEEDED : PipelineRunReport.FAILED)
                    .startedAt(startedAt)
                    .finishedAt(Instant.now())
                    .stages(stages)
                    .build();
            if (succeeded) {
                log.info("[ORCHESTRATOR] runId={} SUCCEEDED", runId);
            } else {
                stages.stream().filter(s -> s.getStatus() == StageStatus.FAILED).findFirst().ifPresent(s ->
                        log.error("[ORCHESTRATOR] runId={} FAILED at {} [{}]: {}",
                                runId, s.getStage(), s.getErrorCategory(), s.getErrorMessage()));
            }
            return report;
        } finally {
            MDC.remove(MdcPropagation.RUN_ID);
            activeRun.set(null);
        }
    }

    /* ------------------------------------------------------------------ */
    /* Single stage (external scheduler)                                   */
    /* ------------------------------------------------------------------ */

    /**
     * Runs one stage, with retries, without its upstream stages.
     *
     * @throws RuntimeException the stage's final error when it fails
     */
    public StageExecution runStage(PipelineStage stage) {
        String runId = newRunId();
        acquire(runId);
        MDC.put(MdcPropagation.RUN_ID, runId);
        try {
            log.info("[ORCHESTRATOR] runId={} single stage {}", runId, stage.taskId());
            StageExecution execution = StageGraph.builder()
                    .stage(stage.taskId(), taskFor(stage))
                    .build()
                    .execute(retryPolicy, Runnable::run)
                    .get(0);
            record(execution);
            if (!execution.isSucceeded()) {
                Throwable failure = execution.getFailure();
                throw failure instanceof RuntimeException re ? re : new IllegalStateException(failure.getMessage(), failure);
            }
            return execution;
        } finally {
            MDC.remove(MdcPropagation.RUN_ID);
            activeRun.set(null);
        }
    }

    /* ------------------------------------------------------------------ */

    StageGraph buildGraph() {
        StageGraph.Builder builder = StageGraph.builder();
        for (PipelineStage stage : PipelineStage.values()) {
            builder.stage(stage.taskId(), taskFor(stage),
                    stage.upstream().stream().map(PipelineStage::taskId).toArray(String[]::new));
        }
        return builder.build();
    }

    private Callable<?> taskFor(PipelineStage stage) {
        switch (stage) {
            case UPLOAD:
                return rawFileUploader::uploadRawFiles;
            case AIRPORTS:
                return airportLoader::load;
            case CARRIERS:
                return () -> carrierExtractor.extract(pendingFileResolver.pendingFactFiles());
            case DATES:
                return () -> dateDimGenerator.generate(pendingFileResolver.pendingFactFiles());
            case FLIGHTS:
                return flightLoadService::loadPendingFiles;
            case WEATHER:
                return weatherLoader::load;
            case QUALITY:
                return qualityGate::enforce;
            default:
                throw new IllegalArgumentException("No task for stage " + stage);
        }
    }

    private void record(StageExecution execution) {
        if (execution.getStatus() == StageStatus.SKIPPED) {
            return;
        }
        metrics.recordStage(execution.getStage(), execution.isSucceeded(), execution.getDurationMs());
        for (int i = 1; i < execution.getAttempts(); i++) {
            metrics.recordStageRetry(execution.getStage());
        }
    }

    private void acquire(String runId) {
        if (!activeRun.compareAndSet(null, runId)) {
            throw new PipelineAlreadyRunningException(activeRun.get());
        }
    }

    private static String newRunId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }

    public boolean isRunning() {
        return activeRun.get() != null;
    }
}
