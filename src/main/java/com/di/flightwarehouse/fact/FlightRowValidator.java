package com.di.flightwarehouse.fact;

import java.util.ArrayList;
import java.util.List;

/**
 * Referential check of one fact row against a {@link DimensionSnapshot}.
 * A row is accepted only when origin, destination, carrier and date are all known.
 */
public final class FlightRowValidator {

    public static final String REASON_SEPARATOR = "; ";

    private FlightRowValidator() {
    }

    /**
     * @return one reason per failed reference, in origin, destination, carrier, date order;
     *         empty when the row is accepted
     */
    public static List<String> validate(FlightKeyFields row, DimensionSnapshot snapshot) {
        List<String> reasons = new ArrayList<>(2);
        if (!snapshot.hasAirport(row.origin())) {
            reasons.add("Unknown origin airport: " + row.origin());
        }
        if (!snapshot.hasAirport(row.dest())) {
            reasons.add("Unknown dest airport: " + row.dest());
        }
        if (!snapshot.hasCarrier(row.carrier())) {
            reasons.add("Unknown carrier: " + row.carrier());
        }
        if (!snapshot.hasDate(row.date().orElse(null))) {
            reasons.add("Unknown date: " + row.flightDate());
        }
        return reasons;
    }
}
