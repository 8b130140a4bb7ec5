package com.di.flightwarehouse.quality;

/**
 * Aggregate queries over the warehouse tables used by the quality gate.
 */
public interface WarehouseStatistics {

    long countAirports();

    long countCarriers();

    long countDates();

    long countFlights();

    /** Flights whose origin airport has no row in {@code airports}. */
    long countFlightsWithUnknownOrigin();

    /** Flights whose destination airport has no row in {@code airports}. */
    long countFlightsWithUnknownDestination();

    /** Flights with a non-null departure or arrival delay outside [minMinutes, maxMinutes]. */
    long countFlightsWithDelayOutside(int minMinutes, int maxMinutes);

    long countWeatherObservations();

    /** Distinct weather airports that exist in {@code airports}. */
    long countWeatherAirportsCovered();

    /** Distinct weather dates that exist in {@code date_dim}. */
    long countWeatherDatesCovered();

    DatasetSummary summarize();
}
