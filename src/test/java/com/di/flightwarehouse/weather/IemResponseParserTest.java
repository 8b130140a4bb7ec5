package com.di.flightwarehouse.weather;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.StringReader;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test cases for parsing IEM ASOS responses.
 */
@DisplayName("IemResponseParser Tests")
class IemResponseParserTest {

    private static final String HEADER = "station,valid,tmpf,dwpf,relh,sknt,vsby,p01i\n";

    @Test
    @DisplayName("Should parse an hourly observation and convert wind to mph")
    void testParse() throws IOException {
        String body = HEADER + "ATL,2024-01-15 13:52,45.0,30.0,55.2,10.0,10.00,0.00\n";

        List<WeatherObservation> observations = IemResponseParser.parse("ATL", new StringReader(body));

        assertEquals(1, observations.size());
        WeatherObservation o = observations.get(0);
        assertEquals("ATL", o.getAirportCode());
        assertEquals(LocalDate.of(2024, 1, 15), o.getObservationDate());
        assertEquals(LocalDateTime.of(2024, 1, 15, 13, 52), o.getObservationTime());
        assertEquals(45.0, o.getAvgTemperature(), 1e-9);
        assertEquals(11.5, o.getAvgWindSpeed(), 1e-9);
        assertEquals(10.0, o.getAvgVisibility(), 1e-9);
        assertEquals(0.0, o.getPrecipitation(), 1e-9);
        assertEquals(WeatherConditions.CLEAR, o.getConditions());
    }

    @Test
    @DisplayName("Should map missing and trace markers to null")
    void testMissingAndTrace() throws IOException {
        String body = HEADER + "ORD,2024-01-15 14:51,M,M,M,M,0.50,T\n";

        WeatherObservation o = IemResponseParser.parse("ORD", new StringReader(body)).get(0);

        assertNull(o.getAvgTemperature());
        assertNull(o.getAvgWindSpeed());
        assertNull(o.getPrecipitation());
        assertEquals(WeatherConditions.FOG, o.getConditions());
    }

    @Test
    @DisplayName("Should drop lines with an unparseable timestamp and ignore comments")
    void testBadTimestamp() throws IOException {
        String body = "#DEBUG: generated\n" + HEADER
                + "DFW,not a time,50.0,40.0,60.0,5.0,10.00,0.00\n"
                + "DFW,2024-01-15 15:53,50.0,40.0,60.0,5.0,10.00,0.00\n";

        List<WeatherObservation> observations = IemResponseParser.parse("DFW", new StringReader(body));

        assertEquals(1, observations.size());
        assertEquals(LocalDateTime.of(2024, 1, 15, 15, 53), observations.get(0).getObservationTime());
    }

    @Test
    @DisplayName("Should return nothing for a header-only response")
    void testEmpty() throws IOException {
        assertTrue(IemResponseParser.parse("JFK", new StringReader(HEADER)).isEmpty());
    }

    @Test
    @DisplayName("Should parse the IEM timestamp format")
    void testParseValid() {
        assertEquals(LocalDateTime.of(2024, 2, 29, 0, 0), IemResponseParser.parseValid("2024-02-29 00:00"));
        assertNull(IemResponseParser.parseValid("2024-02-29T00:00"));
        assertNull(IemResponseParser.parseValid(null));
    }
}
