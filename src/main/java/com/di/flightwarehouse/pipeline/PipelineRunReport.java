package com.di.flightwarehouse.pipeline;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Result of one full DAG run.
 */
@Value
@Builder
public class PipelineRunReport {

    public static final String SUCCEEDED = "SUCCEEDED";
    public static final String FAILED = "FAILED";

    String runId;
    String status;
    Instant startedAt;
    Instant finishedAt;
    /** In topological order. */
    List<StageExecution> stages;

    public boolean isSucceeded() {
        return SUCCEEDED.equals(status);
    }
}
