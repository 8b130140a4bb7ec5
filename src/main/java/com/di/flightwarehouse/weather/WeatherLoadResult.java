package com.di.flightwarehouse.weather;

import lombok.Builder;
import lombok.Value;

/**
 * Outcome of a weather stage.
 */
@Value
@Builder
public class WeatherLoadResult {
    int airports;
    int stationsFailed;
    long fetched;
    /** Observations not yet in the table, handed to the insert. */
    long loaded;
    /** Already present, duplicated within the batch, or dated outside date_dim. */
    long skipped;
}
