package com.di.flightwarehouse.fact;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("DimensionSnapshot Tests")
class DimensionSnapshotTest {

    private static final LocalDate JAN_1 = LocalDate.of(2024, 1, 1);
    private static final LocalDate JAN_2 = LocalDate.of(2024, 1, 2);

    @Test
    @DisplayName("Should not see later changes to the source sets")
    void testCopiesInputs() {
        Set<String> airports = new HashSet<>(Set.of("ATL"));
        DimensionSnapshot snapshot = new DimensionSnapshot(airports, Set.of("AA"), Set.of(JAN_1));
        airports.add("ORD");
        assertFalse(snapshot.hasAirport("ORD"));
    }

    @Test
    @DisplayName("Should return a new snapshot with added dates")
    void testWithDates() {
        DimensionSnapshot snapshot = new DimensionSnapshot(Set.of("ATL"), Set.of("AA"), Set.of(JAN_1));
        DimensionSnapshot extended = snapshot.withDates(List.of(JAN_2));

        assertTrue(extended.hasDate(JAN_1));
        assertTrue(extended.hasDate(JAN_2));
        assertFalse(snapshot.hasDate(JAN_2));
        assertSame(snapshot, snapshot.withDates(List.of()));
    }

    @Test
    @DisplayName("Should answer false for null lookups")
    void testNullLookups() {
        DimensionSnapshot snapshot = new DimensionSnapshot(Set.of(), Set.of(), Set.of());
        assertFalse(snapshot.hasAirport(null));
        assertFalse(snapshot.hasCarrier(null));
        assertFalse(snapshot.hasDate(null));
    }
}
