package com.di.flightwarehouse.fact;

import lombok.Builder;
import lombok.Value;

/**
 * Counts for one fact file. {@code loaded + rejected == processed}; {@code inserted} is the subset of
 * loaded rows that were new to the table (the rest were absorbed by the natural-key conflict target).
 */
@Value
@Builder
public class FileLoadResult {
    String fileName;
    long processed;
    long loaded;
    long rejected;
    long inserted;
    int chunks;
    int datesAdded;
    long durationMs;
}
