package com.di.flightwarehouse.fact;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * One accepted row of the {@code flights} fact table.
 * Natural key: (flightDate, carrierCode, flightNumber, originAirport).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FlightRecord {

    /** Flight number as it takes part in the natural key; a missing number counts as {@code -1}. */
    public static final int MISSING_FLIGHT_NUMBER = -1;

    private LocalDate flightDate;
    private String carrierCode;
    private String tailNumber;
    private Integer flightNumber;

    private String originAirport;
    private String originCity;
    private String originState;
    private String destAirport;
    private String destCity;
    private String destState;

    // hhmm local times as published
    private String scheduledDep;
    private String actualDep;
    private Double depDelay;
    private Double depDelayMinutes;
    private boolean depDelay15;
    private String scheduledArr;
    private String actualArr;
    private Double arrDelay;
    private Double arrDelayMinutes;
    private boolean arrDelay15;

    private boolean cancelled;
    private String cancellationCode;
    private boolean diverted;

    private Double distance;
    private Double airTime;
    private Double scheduledElapsed;
    private Double actualElapsed;

    private Double carrierDelay;
    private Double weatherDelay;
    private Double nasDelay;
    private Double securityDelay;
    private Double lateAircraftDelay;

    /** Natural key as a single string, for deduplication outside the database. */
    public String naturalKey() {
        int number = flightNumber == null ? MISSING_FLIGHT_NUMBER : flightNumber;
        return flightDate + "|" + carrierCode + "|" + number + "|" + originAirport;
    }
}
