package com.di.flightwarehouse.storage;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test cases for raw object classification.
 */
@DisplayName("RawFile Tests")
class RawFileTest {

    private static final String AIRPORTS_KEY = "raw/airports.dat";

    @ParameterizedTest
    @CsvSource({
            "raw/On_Time_2024_1.csv, FACT",
            "raw/ONTIME.CSV, FACT",
            "raw/airports.dat, REFERENCE",
            "raw/other.dat, REFERENCE",
            "raw/airports_extra.csv, UNKNOWN",
            "raw/readme.txt, UNKNOWN"
    })
    @DisplayName("Should classify keys by extension and name")
    void testClassify(String key, SourceType expected) {
        assertEquals(expected, RawFile.classify(key, AIRPORTS_KEY).sourceType());
    }

    @Test
    @DisplayName("Should use the last path segment as file name")
    void testFileName() {
        RawFile file = RawFile.classify("raw/2024/On_Time_2024_1.csv", AIRPORTS_KEY);
        assertEquals("On_Time_2024_1.csv", file.fileName());
        assertTrue(file.isFact());
    }

    @Test
    @DisplayName("Should order files by key")
    void testOrdering() {
        List<String> sorted = Stream.of("raw/b.csv", "raw/a.csv", "raw/c.csv")
                .map(k -> RawFile.classify(k, AIRPORTS_KEY))
                .sorted()
                .map(RawFile::fileName)
                .toList();
        assertEquals(List.of("a.csv", "b.csv", "c.csv"), sorted);
    }
}
