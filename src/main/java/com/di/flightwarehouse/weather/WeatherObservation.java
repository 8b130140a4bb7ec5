package com.di.flightwarehouse.weather;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * One weather observation for an airport. Natural key: (airportCode, observationTime).
 * Temperatures in F, wind in mph, visibility in miles, precipitation and snow depth in inches.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WeatherObservation {

    /** Natural key of an observation. */
    public record Key(String airportCode, LocalDateTime observationTime) {
    }

    private String airportCode;
    private LocalDate observationDate;
    private LocalDateTime observationTime;
    private Double avgTemperature;
    private Double maxTemperature;
    private Double minTemperature;
    private Double avgWindSpeed;
    private Double maxWindSpeed;
    private Double avgVisibility;
    private Double precipitation;
    private Double snowDepth;
    private String conditions;

    public Key key() {
        return new Key(airportCode, observationTime);
    }
}
