package com.di.flightwarehouse.weather;

import com.di.flightwarehouse.util.TypeCoercion;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;

import java.io.IOException;
import java.io.Reader;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * Parses the IEM ASOS {@code format=onlycomma} response
 * ({@code station,valid,tmpf,dwpf,relh,sknt,vsby,p01i}) into hourly observations.
 * <p>
 * {@code M} (missing) and {@code T} (trace) become null. Wind is converted from knots to mph and
 * rounded to one decimal. Lines without a parseable {@code valid} timestamp are dropped.
 */
public final class IemResponseParser {

    static final double KNOTS_TO_MPH = 1.15078;

    private static final DateTimeFormatter VALID_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm");

    private static final CSVFormat FORMAT = CSVFormat.DEFAULT.builder()
            .setHeader()
            .setSkipHeaderRecord(true)
            .setIgnoreEmptyLines(true)
            .setCommentMarker('#')
            .build();

    private IemResponseParser() {
    }

    public static List<WeatherObservation> parse(String airportCode, Reader reader) throws IOException {
        List<WeatherObservation> observations = new ArrayList<>();
        try (CSVParser parser = FORMAT.parse(reader)) {
            for (CSVRecord record : parser) {
                LocalDateTime valid = parseValid(value(record, "valid"));
                if (valid == null) {
                    continue;
                }
                Double temperature = measurement(record, "tmpf");
                Double precipitation = measurement(record, "p01i");
                Double visibility = measurement(record, "vsby");
                Double windKnots = measurement(record, "sknt");
                observations.add(WeatherObservation.builder()
                        .airportCode(airportCode)
                        .observationDate(valid.toLocalDate())
                        .observationTime(valid)
                        .avgTemperature(temperature)
                        .avgWindSpeed(windKnots == null ? null : Math.round(windKnots * KNOTS_TO_MPH * 10.0) / 10.0)
                        .avgVisibility(visibility)
                        .precipitation(precipitation)
                        .conditions(WeatherConditions.determine(precipitation, temperature, visibility))
                        .build());
            }
        }
        return observations;
    }

    static LocalDateTime parseValid(String raw) {
        String value = TypeCoercion.toStr(raw);
        if (value == null) {
            return null;
        }
        try {
            return LocalDateTime.parse(value, VALID_FORMAT);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private static Double measurement(CSVRecord record, String column) {
        String raw = TypeCoercion.toStr(value(record, column));
        if (raw == null || "M".equals(raw) || "T".equals(raw)) {
            return null;
        }
        return TypeCoercion.toDouble(raw);
    }

    private static String value(CSVRecord record, String column) {
        return record.isMapped(column) && record.isSet(column) ? record.get(column) : null;
    }
}
