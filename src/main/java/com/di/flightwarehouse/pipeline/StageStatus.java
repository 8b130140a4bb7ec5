package com.di.flightwarehouse.pipeline;

public enum StageStatus {
    SUCCEEDED,
    FAILED,
    /** Not run because an upstream stage failed. */
    SKIPPED
}
