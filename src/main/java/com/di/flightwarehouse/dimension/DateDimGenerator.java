package com.di.flightwarehouse.dimension;

import com.di.flightwarehouse.storage.FactFileReader;
import com.di.flightwarehouse.storage.RawFile;
import com.di.flightwarehouse.util.TypeCoercion;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Unions the flight dates of every pending file and inserts the missing ones into the date dimension.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DateDimGenerator {

    public static final String COL_FLIGHT_DATE = "FlightDate";

    private final FactFileReader factFileReader;
    private final DateDimensionService dateDimensionService;

    public DimensionLoadResult generate(List<RawFile> files) {
        SortedSet<LocalDate> dates = new TreeSet<>();
        for (RawFile file : files) {
            dates.addAll(collectDates(file));
        }
        int inserted = dateDimensionService.ensureDatesExist(dates);
        if (!dates.isEmpty()) {
            log.info("[DATES] {} files scanned, range {}..{}, {} distinct, {} new",
                    files.size(), dates.first(), dates.last(), dates.size(), inserted);
        }
        return DimensionLoadResult.builder()
                .dimension("date_dim")
                .discovered(dates.size())
                .inserted(inserted)
                .filesScanned(files.size())
                .build();
    }

    /**
     * Distinct parseable flight dates of one file. Unparseable values are left for the fact
     * loader, which rejects those rows as unknown dates.
     */
    public SortedSet<LocalDate> collectDates(RawFile file) {
        SortedSet<LocalDate> dates = new TreeSet<>();
        int[] unparseable = {0};
        factFileReader.scan(file, List.of(COL_FLIGHT_DATE), record -> {
            Optional<LocalDate> date = parseDate(FactFileReader.field(record, COL_FLIGHT_DATE));
            if (date.isPresent()) {
                dates.add(date.get());
            } else {
                unparseable[0]++;
            }
        });
        if (unparseable[0] > 0) {
            log.warn("[DATES] {}: {} rows with unparseable FlightDate", file.fileName(), unparseable[0]);
        }
        return dates;
    }

    /** ISO {@code yyyy-MM-dd}; empty when blank or unparseable. */
    public static Optional<LocalDate> parseDate(String raw) {
        String value = TypeCoercion.toStr(raw);
        if (value == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(LocalDate.parse(value));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }
}
