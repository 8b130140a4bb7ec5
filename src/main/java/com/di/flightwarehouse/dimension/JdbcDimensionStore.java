package com.di.flightwarehouse.dimension;

import com.di.flightwarehouse.util.JdbcBatches;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Types;
import java.time.LocalDate;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * JDBC repository for {@code airports}, {@code carriers} and {@code date_dim}.
 */
@Slf4j
@Repository
@RequiredArgsConstructor
public class JdbcDimensionStore implements DimensionStore {

    private final JdbcTemplate jdbc;

    // ------------------------------------------------------------------
    // Write operations
    // ------------------------------------------------------------------

    @Override
    public int insertAirports(Collection<Airport> airports) {
        if (airports.isEmpty()) {
            return 0;
        }
        int[][] counts = jdbc.batchUpdate("""
            INSERT INTO airports
              (airport_code, airport_name, city, state, country,
               latitude, longitude, altitude, timezone)
            VALUES (?,?,?,?,?, ?,?,?,?)
            ON CONFLICT (airport_code) DO NOTHING
            """, List.copyOf(airports), airports.size(), (ps, a) -> {
            ps.setString(1, a.getCode());
            ps.setString(2, a.getName());
            ps.setString(3, a.getCity());
            ps.setString(4, a.getState());
            ps.setString(5, a.getCountry());
            setNullableDouble(ps, 6, a.getLatitude());
            setNullableDouble(ps, 7, a.getLongitude());
            if (a.getAltitude() != null) ps.setInt(8, a.getAltitude()); else ps.setNull(8, Types.INTEGER);
            ps.setString(9, a.getTimezone());
        });
        return JdbcBatches.affectedRows(counts);
    }

    @Override
    public int insertCarriers(Collection<Carrier> carriers) {
        if (carriers.isEmpty()) {
            return 0;
        }
        int[][] counts = jdbc.batchUpdate("""
            INSERT INTO carriers (carrier_code, carrier_name, dot_id)
            VALUES (?,?,?)
            ON CONFLICT (carrier_code) DO NOTHING
            """, List.copyOf(carriers), carriers.size(), (ps, c) -> {
            ps.setString(1, c.getCode());
            ps.setString(2, c.getName());
            if (c.getDotId() != null) ps.setInt(3, c.getDotId()); else ps.setNull(3, Types.INTEGER);
        });
        return JdbcBatches.affectedRows(counts);
    }

    @Override
    public int insertDates(Collection<DateDim> dates) {
        if (dates.isEmpty()) {
            return 0;
        }
        int[][] counts = jdbc.batchUpdate("""
            INSERT INTO date_dim
              (date_id, year, quarter, month, day_of_month, day_of_week,
               day_name, month_name, is_weekend, season)
            VALUES (?,?,?,?,?,?, ?,?,?,?)
            ON CONFLICT (date_id) DO NOTHING
            """, List.copyOf(dates), dates.size(), (ps, d) -> {
            ps.setObject(1, d.getDate());
            ps.setInt(2, d.getYear());
            ps.setInt(3, d.getQuarter());
            ps.setInt(4, d.getMonth());
            ps.setInt(5, d.getDayOfMonth());
            ps.setInt(6, d.getDayOfWeek());
            ps.setString(7, d.getDayName());
            ps.setString(8, d.getMonthName());
            ps.setBoolean(9, d.isWeekend());
            ps.setString(10, d.getSeason());
        });
        return JdbcBatches.affectedRows(counts);
    }

    // ------------------------------------------------------------------
    // Read operations
    // ------------------------------------------------------------------

    @Override
    public Set<String> findAirportCodes() {
        return new HashSet<>(jdbc.queryForList("SELECT airport_code FROM airports", String.class));
    }

    @Override
    public Set<String> findCarrierCodes() {
        return new HashSet<>(jdbc.queryForList("SELECT carrier_code FROM carriers", String.class));
    }

    @Override
    public Set<LocalDate> findDates() {
        return new HashSet<>(jdbc.query("SELECT date_id FROM date_dim",
                (rs, n) -> rs.getObject("date_id", LocalDate.class)));
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static void setNullableDouble(PreparedStatement ps, int index, Double value) throws SQLException {
        if (value != null) {
            ps.setDouble(index, value);
        } else {
            ps.setNull(index, Types.DOUBLE);
        }
    }
}
