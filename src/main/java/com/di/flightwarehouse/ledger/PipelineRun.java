package com.di.flightwarehouse.ledger;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * One row of {@code pipeline_runs}: the ledger entry for a (file, source) pair.
 * <p>
 * A file is skipped by later runs only once its row reaches {@link #STATUS_COMPLETED}.
 * Completed rows satisfy {@code rowsLoaded + rowsRejected == rowsProcessed}.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class PipelineRun {

    public static final String SOURCE_FLIGHTS = "flights";
    public static final String SOURCE_AIRPORTS = "airports";
    public static final String SOURCE_WEATHER = "weather";

    public static final String STATUS_RUNNING = "running";
    public static final String STATUS_COMPLETED = "completed";
    public static final String STATUS_FAILED = "failed";

    private Long runId;
    private String fileName;
    private String source;
    private long rowsProcessed;
    private long rowsLoaded;
    private long rowsRejected;
    private String status;
    private Instant startedAt;
    private Instant completedAt;
    private String errorMessage;

    public boolean isCompleted() {
        return STATUS_COMPLETED.equals(status);
    }

    /** Rejected share of processed rows, in percent; 0 when nothing was processed. */
    public double rejectionRatePct() {
        long total = rowsLoaded + rowsRejected;
        return total == 0 ? 0.0 : rowsRejected * 100.0 / total;
    }

    public static PipelineRun running(String fileName, String source, Instant startedAt) {
        return PipelineRun.builder()
                .fileName(fileName)
                .source(source)
                .status(STATUS_RUNNING)
                .startedAt(startedAt)
                .build();
    }

    public static PipelineRun completed(String fileName, String source, long loaded, long rejected,
                                        Instant startedAt, Instant completedAt) {
        return PipelineRun.builder()
                .fileName(fileName)
                .source(source)
                .rowsProcessed(loaded + rejected)
                .rowsLoaded(loaded)
                .rowsRejected(rejected)
                .status(STATUS_COMPLETED)
                .startedAt(startedAt)
                .completedAt(completedAt)
                .build();
    }
}
