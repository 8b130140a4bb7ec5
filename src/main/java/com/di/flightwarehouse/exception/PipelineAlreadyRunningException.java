package com.di.flightwarehouse.exception;

/**
 * A trigger arrived while another run is still active in this process.
 */
public class PipelineAlreadyRunningException extends RuntimeException {

    public PipelineAlreadyRunningException(String activeRunId) {
        super("Pipeline run " + activeRunId + " is still active");
    }
}
