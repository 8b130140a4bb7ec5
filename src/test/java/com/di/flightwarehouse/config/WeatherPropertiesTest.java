package com.di.flightwarehouse.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.context.properties.source.MapConfigurationPropertySource;

import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test cases for pipeline and weather configuration binding.
 */
@DisplayName("Pipeline Configuration Tests")
class WeatherPropertiesTest {

    @Test
    @DisplayName("Should map the 30 default airports to K-prefixed ASOS stations")
    void testDefaultStations() {
        WeatherProperties properties = new WeatherProperties();
        assertEquals(30, properties.getStations().size());
        assertEquals("KATL", properties.getStations().get("ATL"));
        assertEquals("KMDW", properties.getStations().get("MDW"));
    }

    @Test
    @DisplayName("Should bind relaxed property names onto the pipeline settings")
    void testBindPipelineProperties() {
        MapConfigurationPropertySource source = new MapConfigurationPropertySource(Map.of(
                "flightwarehouse.pipeline.chunk-size", "1000",
                "flightwarehouse.pipeline.retry-backoff", "30s",
                "flightwarehouse.pipeline.rejection-threshold-pct", "2.5",
                "flightwarehouse.pipeline.upload-enabled", "false"));

        PipelineProperties properties = new Binder(source)
                .bind("flightwarehouse.pipeline", PipelineProperties.class)
                .get();

        assertEquals(1000, properties.getChunkSize());
        assertEquals(Duration.ofSeconds(30), properties.getRetryBackoff());
        assertEquals(2.5, properties.getRejectionThresholdPct());
        assertFalse(properties.isUploadEnabled());
        assertEquals("flight-data", properties.getBucket());
        assertEquals(2, properties.getMaxRetries());
    }

    @Test
    @DisplayName("Should bind weather client timeouts")
    void testBindWeatherTimeouts() {
        MapConfigurationPropertySource source = new MapConfigurationPropertySource(Map.of(
                "flightwarehouse.weather.read-timeout", "90s",
                "flightwarehouse.weather.ledger-file-name", "iem_backfill"));

        WeatherProperties properties = new Binder(source)
                .bind("flightwarehouse.weather", WeatherProperties.class)
                .get();

        assertEquals(Duration.ofSeconds(90), properties.getReadTimeout());
        assertEquals(Duration.ofSeconds(10), properties.getConnectTimeout());
        assertEquals("iem_backfill", properties.getLedgerFileName());
    }
}
