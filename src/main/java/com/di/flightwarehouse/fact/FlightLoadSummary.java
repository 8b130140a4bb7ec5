package com.di.flightwarehouse.fact;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Totals of a flight stage over all pending files.
 */
@Value
@Builder
public class FlightLoadSummary {
    int filesProcessed;
    long rowsLoaded;
    long rowsRejected;
    List<FileLoadResult> files;
}
