package com.di.flightwarehouse.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Weather ingestion settings (prefix {@code flightwarehouse.weather}).
 * <p>
 * {@link #stations} maps an airport IATA code to the ASOS station queried for it.
 * Defaults cover the 30 busiest US airports; an airport outside this map gets no weather.
 */
@Data
@ConfigurationProperties(prefix = "flightwarehouse.weather")
public class WeatherProperties {

    private static final List<String> DEFAULT_AIRPORTS = List.of(
            "ATL", "DFW", "DEN", "ORD", "LAX", "JFK", "LAS", "MCO", "MIA", "CLT",
            "SEA", "PHX", "EWR", "SFO", "IAH", "BOS", "FLL", "MSP", "LGA", "DTW",
            "PHL", "SLC", "DCA", "SAN", "BWI", "TPA", "AUS", "IAD", "BNA", "MDW");

    /** Airport code -> ASOS station id. */
    private Map<String, String> stations = defaultStations();

    /** Iowa Environmental Mesonet ASOS download endpoint. */
    private String iemBaseUrl = "https://mesonet.agron.iastate.edu/cgi-bin/request/asos.py";

    private Duration connectTimeout = Duration.ofSeconds(10);

    private Duration readTimeout = Duration.ofSeconds(60);

    /** Ledger file name under which weather loads are recorded. */
    private String ledgerFileName = "iem_hourly_weather";

    private static Map<String, String> defaultStations() {
        Map<String, String> stations = new LinkedHashMap<>();
        for (String airport : DEFAULT_AIRPORTS) {
            stations.put(airport, "K" + airport);
        }
        return stations;
    }
}
