package com.di.flightwarehouse.dimension;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.TreeSet;

/**
 * Single entry point for adding dates to {@code date_dim}. Used by the date stage for all pending
 * files at once, and by the fact loader for the dates of the file it is about to validate.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DateDimensionService {

    private final DimensionStore dimensionStore;

    /**
     * Derives and inserts the given dates. Dates already present are left untouched.
     *
     * @return number of new date_dim rows
     */
    public int ensureDatesExist(Collection<LocalDate> dates) {
        if (dates.isEmpty()) {
            return 0;
        }
        List<DateDim> rows = new TreeSet<>(dates).stream()
                .map(DateDimensions::derive)
                .toList();
        int inserted = dimensionStore.insertDates(rows);
        log.info("[DATES] {} dates ensured, {} new", rows.size(), inserted);
        return inserted;
    }
}
