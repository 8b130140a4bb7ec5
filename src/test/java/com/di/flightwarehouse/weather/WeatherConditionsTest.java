package com.di.flightwarehouse.weather;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test cases for the conditions label.
 */
@DisplayName("WeatherConditions Tests")
class WeatherConditionsTest {

    @ParameterizedTest
    @CsvSource({
            "0.05, 28.0, 10.0, Snow",
            "0.50, 60.0, 10.0, Rain",
            "0.05, 60.0, 10.0, Light Rain",
            "0.10, 60.0, 10.0, Light Rain",
            "0.00, 60.0, 1.5, Fog/Low Visibility",
            "0.00, 20.0, 10.0, Cold/Clear",
            "0.00, 20.0, 2.0, Fog/Low Visibility",
            "0.00, 70.0, 10.0, Clear"
    })
    @DisplayName("Should pick the first matching label in precedence order")
    void testDetermine(double precip, double temp, double vis, String expected) {
        assertEquals(expected, WeatherConditions.determine(precip, temp, vis));
    }

    @Test
    @DisplayName("Should treat missing measurements as dry, mild and clear")
    void testDetermine_Missing() {
        assertEquals(WeatherConditions.CLEAR, WeatherConditions.determine(null, null, null));
        assertEquals(WeatherConditions.LIGHT_RAIN, WeatherConditions.determine(0.01, null, null));
    }
}
