package com.di.flightwarehouse.weather;

import com.di.flightwarehouse.config.WeatherProperties;
import com.di.flightwarehouse.dimension.DimensionStore;
import com.di.flightwarehouse.exception.ErrorCategory;
import com.di.flightwarehouse.ledger.PipelineRun;
import com.di.flightwarehouse.ledger.PipelineRunStore;
import com.di.flightwarehouse.util.PipelineMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Loads weather for every warehouse airport that has a configured station, over the dates of the
 * date dimension.
 * <p>
 * Observations are keyed by (airport, observation time). The set of existing keys is read up front
 * and every fetched observation already in it is skipped before the insert, which also carries a
 * conflict target. A re-run over an overlapping range therefore only adds the new pairs.
 * A station that cannot be fetched is logged and skipped; the others still load.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class WeatherLoader {

    private final DimensionStore dimensionStore;
    private final WeatherStore weatherStore;
    private final WeatherSource weatherSource;
    private final PipelineRunStore runStore;
    private final WeatherProperties properties;
    private final PipelineMetrics metrics;

    public WeatherLoadResult load() {
        Instant startedAt = Instant.now();
        Set<String> airports = dimensionStore.findAirportCodes();
        SortedMap<String, String> stations = new TreeMap<>();
        for (Map.Entry<String, String> e : properties.getStations().entrySet()) {
            if (airports.contains(e.getKey())) {
                stations.put(e.getKey(), e.getValue());
            }
        }
        SortedSet<LocalDate> dates = new TreeSet<>(dimensionStore.findDates());
        if (stations.isEmpty() || dates.isEmpty()) {
            log.warn("[WEATHER] Nothing to load: {} mapped airports in warehouse, {} dates", stations.size(), dates.size());
            return WeatherLoadResult.builder().airports(stations.size()).build();
        }

        Set<WeatherObservation.Key> seen = weatherStore.findExistingKeys();
        log.info("[WEATHER] {} airports, dates {}..{}, {} observations already stored",
                stations.size(), dates.first(), dates.last(), seen.size());

        long fetched = 0;
        long loaded = 0;
        int failedStations = 0;
        for (Map.Entry<String, String> station : stations.entrySet()) {
            List<WeatherObservation> observations;
            try {
                observations = weatherSource.fetch(station.getKey(), station.getValue(), dates.first(), dates.last());
            } catch (RuntimeException e) {
                failedStations++;
                log.warn("[WEATHER] {} ({}) skipped [{}]: {}",
                        station.getKey(), station.getValue(), ErrorCategory.categorize(e), e.getMessage());
                continue;
            }
            fetched += observations.size();

            List<WeatherObservation> fresh = new ArrayList<>();
            for (WeatherObservation o : observations) {
                if (dates.contains(o.getObservationDate()) && seen.add(o.key())) {
                    fresh.add(o);
                }
            }
            int inserted = weatherStore.insertObservations(fresh);
            loaded += fresh.size();
            metrics.recordWeatherLoaded(inserted);
            log.info("[WEATHER] {}: fetched={} new={}", station.getKey(), observations.size(), fresh.size());
        }

        runStore.upsert(PipelineRun.completed(properties.getLedgerFileName(), PipelineRun.SOURCE_WEATHER,
                loaded, fetched - loaded, startedAt, Instant.now()));

        WeatherLoadResult result = WeatherLoadResult.builder()
                .airports(stations.size())
                .stationsFailed(failedStations)
                .fetched(fetched)
                .loaded(loaded)
                .skipped(fetched - loaded)
                .build();
        log.info("[WEATHER] Done: airports={} failedStations={} fetched={} loaded={} skipped={}",
                result.getAirports(), failedStations, fetched, loaded, result.getSkipped());
        return result;
    }
}
