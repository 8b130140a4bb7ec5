package com.di.flightwarehouse.quality;

import lombok.Builder;
import lombok.Value;

/**
 * Outcome of one quality check.
 */
@Value
@Builder
public class QualityCheckResult {
    String name;
    boolean passed;
    /** Observed value and the expectation it was compared with. */
    String detail;
}
