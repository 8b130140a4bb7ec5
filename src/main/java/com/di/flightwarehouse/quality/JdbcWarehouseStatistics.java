package com.di.flightwarehouse.quality;

import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

/**
 * JDBC implementation of {@link WarehouseStatistics}.
 */
@Repository
@RequiredArgsConstructor
public class JdbcWarehouseStatistics implements WarehouseStatistics {

    private final JdbcTemplate jdbc;

    @Override
    public long countAirports() {
        return count("SELECT COUNT(*) FROM airports");
    }

    @Override
    public long countCarriers() {
        return count("SELECT COUNT(*) FROM carriers");
    }

    @Override
    public long countDates() {
        return count("SELECT COUNT(*) FROM date_dim");
    }

    @Override
    public long countFlights() {
        return count("SELECT COUNT(*) FROM flights");
    }

    @Override
    public long countFlightsWithUnknownOrigin() {
        return count("""
            SELECT COUNT(*) FROM flights f
            LEFT JOIN airports a ON f.origin_airport = a.airport_code
            WHERE a.airport_code IS NULL
            """);
    }

    @Override
    public long countFlightsWithUnknownDestination() {
        return count("""
            SELECT COUNT(*) FROM flights f
            LEFT JOIN airports a ON f.dest_airport = a.airport_code
            WHERE a.airport_code IS NULL
            """);
    }

    @Override
    public long countFlightsWithDelayOutside(int minMinutes, int maxMinutes) {
        Long n = jdbc.queryForObject("""
            SELECT COUNT(*) FROM flights
            WHERE (arr_delay IS NOT NULL AND (arr_delay < ? OR arr_delay > ?))
               OR (dep_delay IS NOT NULL AND (dep_delay < ? OR dep_delay > ?))
            """, Long.class, minMinutes, maxMinutes, minMinutes, maxMinutes);
        return n == null ? 0 : n;
    }

    @Override
    public long countWeatherObservations() {
        return count("SELECT COUNT(*) FROM weather_observations");
    }

    @Override
    public long countWeatherAirportsCovered() {
        return count("""
            SELECT COUNT(DISTINCT w.airport_code) FROM weather_observations w
            JOIN airports a ON w.airport_code = a.airport_code
            """);
    }

    @Override
    public long countWeatherDatesCovered() {
        return count("""
            SELECT COUNT(DISTINCT w.observation_date) FROM weather_observations w
            JOIN date_dim d ON w.observation_date = d.date_id
            """);
    }

    @Override
    public DatasetSummary summarize() {
        return jdbc.queryForObject("""
            SELECT COUNT(*)                                  AS flights,
                   COUNT(DISTINCT carrier_code)              AS carriers,
                   COUNT(DISTINCT origin_airport)            AS origins,
                   COUNT(DISTINCT dest_airport)              AS dests,
                   ROUND(AVG(arr_delay)::numeric, 2)         AS avg_arr_delay,
                   COUNT(*) FILTER (WHERE cancelled)         AS cancellations
            FROM flights
            """, (rs, n) -> {
            double avg = rs.getDouble("avg_arr_delay");
            Double avgArrivalDelay = rs.wasNull() ? null : avg;
            return DatasetSummary.builder()
                    .flights(rs.getLong("flights"))
                    .carriers(rs.getLong("carriers"))
                    .originAirports(rs.getLong("origins"))
                    .destAirports(rs.getLong("dests"))
                    .avgArrivalDelay(avgArrivalDelay)
                    .cancellations(rs.getLong("cancellations"))
                    .build();
        });
    }

    private long count(String sql) {
        Long n = jdbc.queryForObject(sql, Long.class);
        return n == null ? 0 : n;
    }
}
