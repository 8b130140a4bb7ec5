package com.di.flightwarehouse.weather;

import java.time.LocalDate;
import java.util.List;

/**
 * Supplier of observations for one airport's weather station.
 */
public interface WeatherSource {

    /**
     * Observations for {@code airportCode} between {@code start} and {@code end} inclusive.
     * Implementations throw on transport or format failure.
     */
    List<WeatherObservation> fetch(String airportCode, String stationId, LocalDate start, LocalDate end);
}
