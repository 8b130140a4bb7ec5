package com.di.flightwarehouse.dimension;

import com.di.flightwarehouse.util.TypeCoercion;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;

import java.io.IOException;
import java.io.Reader;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Parses the OpenFlights {@code airports.dat} file: no header, 14 columns
 * (ID, Name, City, Country, IATA, ICAO, Lat, Lon, Altitude, TZ offset, DST, Timezone, Type, Source).
 * <p>
 * Keeps rows with a 3-letter IATA code. When a code repeats, the first row wins.
 */
public final class AirportParser {

    private static final int COL_NAME = 1;
    private static final int COL_CITY = 2;
    private static final int COL_COUNTRY = 3;
    private static final int COL_IATA = 4;
    private static final int COL_LATITUDE = 6;
    private static final int COL_LONGITUDE = 7;
    private static final int COL_ALTITUDE = 8;
    private static final int COL_TIMEZONE = 11;

    private static final CSVFormat FORMAT = CSVFormat.DEFAULT.builder()
            .setIgnoreEmptyLines(true)
            .build();

    /**
     * @param rowsRead every line of the file
     * @param airports kept airports, in file order
     */
    public record Result(int rowsRead, List<Airport> airports) {
        public int rowsSkipped() {
            return rowsRead - airports.size();
        }
    }

    private AirportParser() {
    }

    public static Result parse(Reader reader) throws IOException {
        Map<String, Airport> byCode = new LinkedHashMap<>();
        int rows = 0;
        try (CSVParser parser = FORMAT.parse(reader)) {
            for (CSVRecord record : parser) {
                rows++;
                String code = TypeCoercion.toStr(column(record, COL_IATA));
                if (code == null || code.length() != 3) {
                    continue;
                }
                byCode.putIfAbsent(code, toAirport(code, record));
            }
        }
        return new Result(rows, List.copyOf(byCode.values()));
    }

    private static Airport toAirport(String code, CSVRecord record) {
        return Airport.builder()
                .code(code)
                .name(TypeCoercion.toStr(column(record, COL_NAME)))
                .city(TypeCoercion.toStr(column(record, COL_CITY)))
                .country(TypeCoercion.toStr(column(record, COL_COUNTRY)))
                .latitude(TypeCoercion.toDouble(column(record, COL_LATITUDE)))
                .longitude(TypeCoercion.toDouble(column(record, COL_LONGITUDE)))
                .altitude(TypeCoercion.toInteger(column(record, COL_ALTITUDE)))
                .timezone(TypeCoercion.toStr(column(record, COL_TIMEZONE)))
                .build();
    }

    private static String column(CSVRecord record, int index) {
        return index < record.size() ? record.get(index) : null;
    }
}
