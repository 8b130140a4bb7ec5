package com.di.flightwarehouse.pipeline;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;

/**
 * What happened to one stage in a run.
 */
@Value
@Builder
public class StageExecution {
    String stage;
    StageStatus status;
    int attempts;
    long durationMs;
    /** Stage-specific result object (load counts, quality report, ...) when succeeded. */
    Object result;
    String errorCategory;
    String errorMessage;
    @JsonIgnore
    Throwable failure;

    public boolean isSucceeded() {
        return status == StageStatus.SUCCEEDED;
    }

    static StageExecution skipped(String stage, String reason) {
        return StageExecution.builder()
                .stage(stage)
                .status(StageStatus.SKIPPED)
                .errorMessage(reason)
                .build();
    }
}
