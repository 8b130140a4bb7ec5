package com.di.flightwarehouse.support;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds BTS on-time CSV content: header row, quoted city names and the trailing empty column
 * real exports carry.
 */
public class FlightCsv {

    public static final String HEADER = String.join(",",
            "FlightDate", "Reporting_Airline", "DOT_ID_Reporting_Airline", "Tail_Number",
            "Flight_Number_Reporting_Airline", "Origin", "OriginCityName", "OriginState",
            "Dest", "DestCityName", "DestState", "CRSDepTime", "DepTime", "DepDelay", "DepDelayMinutes",
            "DepDel15", "CRSArrTime", "ArrTime", "ArrDelay", "ArrDelayMinutes", "ArrDel15",
            "Cancelled", "CancellationCode", "Diverted", "CRSElapsedTime", "ActualElapsedTime",
            "AirTime", "Distance", "CarrierDelay", "WeatherDelay", "NASDelay", "SecurityDelay",
            "LateAircraftDelay") + ",";

    private final List<String> lines = new ArrayList<>();

    public static FlightCsv create() {
        return new FlightCsv();
    }

    /** A punctual, completed flight. */
    public FlightCsv flight(String date, String carrier, int flightNumber, String origin, String dest) {
        return flight(date, carrier, flightNumber, origin, dest, "5.00");
    }

    public FlightCsv flight(String date, String carrier, int flightNumber, String origin, String dest, String arrDelay) {
        lines.add(String.join(",",
                date, carrier, "19805", "N" + flightNumber + "AA",
                flightNumber + ".00", origin, "\"" + origin + " City, ST\"", "ST",
                dest, "\"" + dest + " City, ST\"", "ST", "0900", "0905", "5.00", "5.00",
                "0.00", "1100", "1105", arrDelay, arrDelay, "0.00",
                "0.00", "", "0.00", "120.00", "120.00",
                "100.00", "500.00", "", "", "", "", "") + ",");
        return this;
    }

    /** Appends a raw, already-formatted line. */
    public FlightCsv line(String raw) {
        lines.add(raw);
        return this;
    }

    public int rows() {
        return lines.size();
    }

    public String build() {
        StringBuilder sb = new StringBuilder(HEADER).append('\n');
        lines.forEach(l -> sb.append(l).append('\n'));
        return sb.toString();
    }
}
