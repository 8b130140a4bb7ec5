package com.di.flightwarehouse.fact;

import com.di.flightwarehouse.dimension.DateDimGenerator;
import com.di.flightwarehouse.storage.FactFileReader;
import org.apache.commons.csv.CSVRecord;

import java.time.LocalDate;
import java.util.Optional;

/**
 * The four trimmed fields of a fact row that reference a dimension.
 * Blank values are kept as empty strings so that reject reasons and snapshots stay printable.
 */
public record FlightKeyFields(String flightDate, String carrier, String origin, String dest) {

    public static final String COL_FLIGHT_DATE = "FlightDate";
    public static final String COL_CARRIER = "Reporting_Airline";
    public static final String COL_ORIGIN = "Origin";
    public static final String COL_DEST = "Dest";

    public static FlightKeyFields from(CSVRecord record) {
        return new FlightKeyFields(
                trimmed(FactFileReader.field(record, COL_FLIGHT_DATE)),
                trimmed(FactFileReader.field(record, COL_CARRIER)),
                trimmed(FactFileReader.field(record, COL_ORIGIN)),
                trimmed(FactFileReader.field(record, COL_DEST)));
    }

    public Optional<LocalDate> date() {
        return DateDimGenerator.parseDate(flightDate);
    }

    /** Compact {@code date,carrier,origin,dest} form stored with a reject. */
    public String snapshot() {
        return flightDate + "," + carrier + "," + origin + "," + dest;
    }

    private static String trimmed(String value) {
        return value == null ? "" : value.trim();
    }
}
