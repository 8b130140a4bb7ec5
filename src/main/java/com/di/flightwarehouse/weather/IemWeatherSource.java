package com.di.flightwarehouse.weather;

import com.di.flightwarehouse.config.WeatherProperties;
import com.di.flightwarehouse.exception.StructuralPipelineException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

import java.io.IOException;
import java.io.StringReader;
import java.time.LocalDate;
import java.util.List;

/**
 * {@link WeatherSource} backed by the Iowa Environmental Mesonet ASOS download service.
 */
@Slf4j
@Component
public class IemWeatherSource implements WeatherSource {

    private final RestClient restClient;

    public IemWeatherSource(RestClient.Builder restClientBuilder, WeatherProperties properties) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout((int) properties.getConnectTimeout().toMillis());
        requestFactory.setReadTimeout((int) properties.getReadTimeout().toMillis());
        this.restClient = restClientBuilder
                .baseUrl(properties.getIemBaseUrl())
                .requestFactory(requestFactory)
                .build();
    }

    @Override
    public List<WeatherObservation> fetch(String airportCode, String stationId, LocalDate start, LocalDate end) {
        String body = restClient.get()
                .uri(uri -> uri
                        .queryParam("station", stationId)
                        .queryParam("data", "tmpf", "dwpf", "relh", "sknt", "vsby", "p01i")
                        .queryParam("year1", start.getYear())
                        .queryParam("month1", start.getMonthValue())
                        .queryParam("day1", start.getDayOfMonth())
                        .queryParam("year2", end.getYear())
                        .queryParam("month2", end.getMonthValue())
                        .queryParam("day2", end.getDayOfMonth())
                        .queryParam("tz", "UTC")
                        .queryParam("format", "onlycomma")
                        .queryParam("latlon", "no")
                        .queryParam("elev", "no")
                        .queryParam("missing", "M")
                        .queryParam("trace", "T")
                        .build())
                .retrieve()
                .body(String.class);
        if (body == null || body.isBlank()) {
            return List.of();
        }
        try {
            List<WeatherObservation> observations = IemResponseParser.parse(airportCode, new StringReader(body));
            log.debug("[WEATHER] {} ({}): {} observations", airportCode, stationId, observations.size());
            return observations;
        } catch (IOException e) {
            throw StructuralPipelineException.inFile(stationId, "Malformed IEM response", e);
        }
    }
}
