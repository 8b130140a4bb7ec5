package com.di.flightwarehouse.quality;

import lombok.Builder;
import lombok.Value;

/**
 * Headline numbers logged after the quality checks.
 */
@Value
@Builder
public class DatasetSummary {
    long flights;
    long carriers;
    long originAirports;
    long destAirports;
    Double avgArrivalDelay;
    long cancellations;
}
