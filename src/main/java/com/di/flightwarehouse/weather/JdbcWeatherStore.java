package com.di.flightwarehouse.weather;

import com.di.flightwarehouse.util.JdbcBatches;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Types;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.HashSet;
import java.util.Set;

/**
 * JDBC repository for {@code weather_observations}.
 * Observation times are UTC wall-clock values bound as {@code LocalDateTime}, never through the JVM zone.
 */
@Repository
@RequiredArgsConstructor
public class JdbcWeatherStore implements WeatherStore {

    private final JdbcTemplate jdbc;

    @Override
    public Set<WeatherObservation.Key> findExistingKeys() {
        return new HashSet<>(jdbc.query(
                "SELECT airport_code, observation_time FROM weather_observations",
                (rs, n) -> new WeatherObservation.Key(
                        rs.getString("airport_code"),
                        rs.getObject("observation_time", LocalDateTime.class))));
    }

    @Override
    public int insertObservations(Collection<WeatherObservation> observations) {
        if (observations.isEmpty()) {
            return 0;
        }
        return JdbcBatches.affectedRows(jdbc.batchUpdate("""
            INSERT INTO weather_observations
              (airport_code, observation_date, observation_time,
               avg_temperature, max_temperature, min_temperature,
               avg_wind_speed, max_wind_speed, avg_visibility,
               precipitation, snow_depth, conditions)
            VALUES (?,?,?, ?,?,?, ?,?,?, ?,?,?)
            ON CONFLICT (airport_code, observation_time) DO NOTHING
            """, observations, 5_000, (ps, o) -> {
            ps.setString(1, o.getAirportCode());
            ps.setObject(2, o.getObservationDate());
            ps.setObject(3, o.getObservationTime());
            setDouble(ps, 4, o.getAvgTemperature());
            setDouble(ps, 5, o.getMaxTemperature());
            setDouble(ps, 6, o.getMinTemperature());
            setDouble(ps, 7, o.getAvgWindSpeed());
            setDouble(ps, 8, o.getMaxWindSpeed());
            setDouble(ps, 9, o.getAvgVisibility());
            setDouble(ps, 10, o.getPrecipitation());
            setDouble(ps, 11, o.getSnowDepth());
            ps.setString(12, o.getConditions());
        }));
    }

    private static void setDouble(PreparedStatement ps, int index, Double value) throws SQLException {
        if (value != null) ps.setDouble(index, value); else ps.setNull(index, Types.DOUBLE);
    }
}
