package com.di.flightwarehouse.dimension;

import lombok.Builder;
import lombok.Value;

/**
 * Outcome of a dimension stage.
 */
@Value
@Builder
public class DimensionLoadResult {
    String dimension;
    /** Distinct members found in the sources. */
    int discovered;
    /** Members that were not in the table yet. */
    int inserted;
    int filesScanned;
}
