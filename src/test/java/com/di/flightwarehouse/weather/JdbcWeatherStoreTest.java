package com.di.flightwarehouse.weather;

import com.di.flightwarehouse.dimension.Airport;
import com.di.flightwarehouse.dimension.DateDimensions;
import com.di.flightwarehouse.dimension.JdbcDimensionStore;
import com.di.flightwarehouse.support.PostgresTestDatabase;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Set;
import java.util.TimeZone;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs the weather sink against PostgreSQL with the production schema.
 */
@DisplayName("JdbcWeatherStore Tests")
class JdbcWeatherStoreTest {

    private final TimeZone originalZone = TimeZone.getDefault();

    private JdbcTemplate jdbc;
    private JdbcWeatherStore store;

    @BeforeEach
    void setUp() {
        jdbc = PostgresTestDatabase.cleanDatabase();
        store = new JdbcWeatherStore(jdbc);
        JdbcDimensionStore dimensions = new JdbcDimensionStore(jdbc);
        dimensions.insertAirports(List.of(
                Airport.builder().code("ORD").name("Chicago O'Hare International Airport").build()));
        dimensions.insertDates(List.of(
                DateDimensions.derive(LocalDate.of(2024, 3, 10)),
                DateDimensions.derive(LocalDate.of(2024, 3, 11))));
    }

    @AfterEach
    void restoreZone() {
        TimeZone.setDefault(originalZone);
    }

    private static WeatherObservation observation(LocalDateTime utc) {
        return WeatherObservation.builder()
                .airportCode("ORD")
                .observationDate(utc.toLocalDate())
                .observationTime(utc)
                .avgTemperature(38.0)
                .avgWindSpeed(11.5)
                .conditions("Clear")
                .build();
    }

    // ============================================================================
    // Key Round-Trip Tests
    // ============================================================================

    @Test
    @DisplayName("Should read back the exact UTC time inside a local daylight-saving gap")
    void testFindExistingKeys_DaylightSavingGap() {
        TimeZone.setDefault(TimeZone.getTimeZone("America/Chicago"));
        WeatherObservation inGap = observation(LocalDateTime.of(2024, 3, 10, 2, 53));

        assertEquals(1, store.insertObservations(List.of(inGap)));

        assertEquals(Set.of(inGap.key()), store.findExistingKeys());
    }

    @Test
    @DisplayName("Should keep the gap observation and the next hour as two rows")
    void testInsertObservations_GapAndNextHour() {
        TimeZone.setDefault(TimeZone.getTimeZone("America/Chicago"));
        WeatherObservation inGap = observation(LocalDateTime.of(2024, 3, 10, 2, 53));
        WeatherObservation nextHour = observation(LocalDateTime.of(2024, 3, 10, 3, 53));

        assertEquals(2, store.insertObservations(List.of(inGap, nextHour)));
        assertEquals(Set.of(inGap.key(), nextHour.key()), store.findExistingKeys());
    }

    // ============================================================================
    // Conflict Target Tests
    // ============================================================================

    @Test
    @DisplayName("Should absorb a re-inserted observation")
    void testInsertObservations_ReinsertIsNoOp() {
        List<WeatherObservation> batch = List.of(
                observation(LocalDateTime.of(2024, 3, 11, 0, 51)),
                observation(LocalDateTime.of(2024, 3, 11, 1, 51)));

        assertEquals(2, store.insertObservations(batch));
        assertEquals(0, store.insertObservations(batch));
        assertEquals(2, jdbc.queryForObject("SELECT COUNT(*) FROM weather_observations", Long.class));
    }

    @Test
    @DisplayName("Should return zero for an empty batch")
    void testInsertObservations_Empty() {
        assertEquals(0, store.insertObservations(List.of()));
        assertTrue(store.findExistingKeys().isEmpty());
    }
}
