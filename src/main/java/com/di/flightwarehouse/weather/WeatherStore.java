package com.di.flightwarehouse.weather;

import java.util.Collection;
import java.util.Set;

/**
 * Persistence for {@code weather_observations}.
 */
public interface WeatherStore {

    Set<WeatherObservation.Key> findExistingKeys();

    /** Inserts with conflict = do-nothing on (airport_code, observation_time); returns new rows. */
    int insertObservations(Collection<WeatherObservation> observations);
}
