package com.di.flightwarehouse.fact;

import java.time.LocalDate;
import java.util.Collection;
import java.util.HashSet;
import java.util.Set;

/**
 * The dimension keys a file's rows are validated against, captured once per file.
 * <p>
 * Immutable: adding the file's own dates produces a new snapshot via {@link #withDates}.
 */
public record DimensionSnapshot(Set<String> airportCodes, Set<String> carrierCodes, Set<LocalDate> dates) {

    public DimensionSnapshot {
        airportCodes = Set.copyOf(airportCodes);
        carrierCodes = Set.copyOf(carrierCodes);
        dates = Set.copyOf(dates);
    }

    public DimensionSnapshot withDates(Collection<LocalDate> added) {
        if (added.isEmpty()) {
            return this;
        }
        Set<LocalDate> merged = new HashSet<>(dates);
        merged.addAll(added);
        return new DimensionSnapshot(airportCodes, carrierCodes, merged);
    }

    public boolean hasAirport(String code) {
        return code != null && airportCodes.contains(code);
    }

    public boolean hasCarrier(String code) {
        return code != null && carrierCodes.contains(code);
    }

    public boolean hasDate(LocalDate date) {
        return date != null && dates.contains(date);
    }
}
