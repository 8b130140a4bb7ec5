package com.di.flightwarehouse.dimension;

import java.time.LocalDate;
import java.util.Collection;
import java.util.Set;

/**
 * Persistence for the airport, carrier and date dimensions.
 * <p>
 * All inserts are create-once: a row whose natural key already exists is left untouched, so the
 * first-seen values win and repeated loads are no-ops. Insert methods return the number of new rows.
 */
public interface DimensionStore {

    int insertAirports(Collection<Airport> airports);

    int insertCarriers(Collection<Carrier> carriers);

    int insertDates(Collection<DateDim> dates);

    Set<String> findAirportCodes();

    Set<String> findCarrierCodes();

    Set<LocalDate> findDates();
}
