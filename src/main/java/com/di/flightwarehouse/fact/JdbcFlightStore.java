package com.di.flightwarehouse.fact;

import com.di.flightwarehouse.util.JdbcBatches;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Types;
import java.util.List;

/**
 * JDBC sink for {@code flights} and {@code rejected_records}.
 */
@Slf4j
@Repository
@RequiredArgsConstructor
public class JdbcFlightStore implements FlightStore {

    private static final String INSERT_FLIGHT = """
        INSERT INTO flights
          (flight_date, carrier_code, tail_number, flight_number,
           origin_airport, origin_city, origin_state,
           dest_airport, dest_city, dest_state,
           scheduled_dep, actual_dep, dep_delay, dep_delay_minutes, dep_delay_15,
           scheduled_arr, actual_arr, arr_delay, arr_delay_minutes, arr_delay_15,
           cancelled, cancellation_code, diverted,
           distance, air_time, scheduled_elapsed, actual_elapsed,
           carrier_delay, weather_delay, nas_delay, security_delay, late_aircraft_delay)
        VALUES (?,?,?,?, ?,?,?, ?,?,?, ?,?,?,?,?, ?,?,?,?,?, ?,?,?, ?,?,?,?, ?,?,?,?,?)
        ON CONFLICT (flight_date, carrier_code, (COALESCE(flight_number, -1)), origin_airport) DO NOTHING
        """;

    private static final String INSERT_REJECT = """
        INSERT INTO rejected_records (source, file_name, row_number, raw_data, rejection_reason)
        VALUES (?,?,?,?,?)
        """;

    private final JdbcTemplate jdbc;

    @Override
    @Transactional
    public int writeChunk(List<FlightRecord> accepted, List<RejectedRecord> rejected) {
        int inserted = 0;
        if (!accepted.isEmpty()) {
            inserted = JdbcBatches.affectedRows(
                    jdbc.batchUpdate(INSERT_FLIGHT, accepted, accepted.size(), JdbcFlightStore::bindFlight));
        }
        if (!rejected.isEmpty()) {
            jdbc.batchUpdate(INSERT_REJECT, rejected, rejected.size(), (ps, r) -> {
                ps.setString(1, r.getSource());
                ps.setString(2, r.getFileName());
                ps.setLong(3, r.getRowNumber());
                ps.setString(4, r.getRawData());
                ps.setString(5, r.getRejectionReason());
            });
        }
        log.debug("[FLIGHTS] chunk written: accepted={} inserted={} rejected={}", accepted.size(), inserted, rejected.size());
        return inserted;
    }

    private static void bindFlight(PreparedStatement ps, FlightRecord f) throws SQLException {
        int i = 1;
        ps.setObject(i++, f.getFlightDate());
        ps.setString(i++, f.getCarrierCode());
        ps.setString(i++, f.getTailNumber());
        setInteger(ps, i++, f.getFlightNumber());
        ps.setString(i++, f.getOriginAirport());
        ps.setString(i++, f.getOriginCity());
        ps.setString(i++, f.getOriginState());
        ps.setString(i++, f.getDestAirport());
        ps.setString(i++, f.getDestCity());
        ps.setString(i++, f.getDestState());
        ps.setString(i++, f.getScheduledDep());
        ps.setString(i++, f.getActualDep());
        setDouble(ps, i++, f.getDepDelay());
        setDouble(ps, i++, f.getDepDelayMinutes());
        ps.setBoolean(i++, f.isDepDelay15());
        ps.setString(i++, f.getScheduledArr());
        ps.setString(i++, f.getActualArr());
        setDouble(ps, i++, f.getArrDelay());
        setDouble(ps, i++, f.getArrDelayMinutes());
        ps.setBoolean(i++, f.isArrDelay15());
        ps.setBoolean(i++, f.isCancelled());
        ps.setString(i++, f.getCancellationCode());
        ps.setBoolean(i++, f.isDiverted());
        setDouble(ps, i++, f.getDistance());
        setDouble(ps, i++, f.getAirTime());
        setDouble(ps, i++, f.getScheduledElapsed());
        setDouble(ps, i++, f.getActualElapsed());
        setDouble(ps, i++, f.getCarrierDelay());
        setDouble(ps, i++, f.getWeatherDelay());
        setDouble(ps, i++, f.getNasDelay());
        setDouble(ps, i++, f.getSecurityDelay());
        setDouble(ps, i, f.getLateAircraftDelay());
    }

    private static void setDouble(PreparedStatement ps, int index, Double value) throws SQLException {
        if (value != null) ps.setDouble(index, value); else ps.setNull(index, Types.DOUBLE);
    }

    private static void setInteger(PreparedStatement ps, int index, Integer value) throws SQLException {
        if (value != null) ps.setInt(index, value); else ps.setNull(index, Types.INTEGER);
    }
}
