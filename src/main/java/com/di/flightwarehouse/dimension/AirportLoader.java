package com.di.flightwarehouse.dimension;

import com.di.flightwarehouse.exception.StructuralPipelineException;
import com.di.flightwarehouse.ledger.PipelineRun;
import com.di.flightwarehouse.ledger.PipelineRunStore;
import com.di.flightwarehouse.storage.RawFile;
import com.di.flightwarehouse.storage.RawFileCatalog;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.time.Instant;

/**
 * Loads the airports reference file into the airport dimension.
 * <p>
 * Existing codes are never overwritten. The ledger row for the file records rows read,
 * airports kept, and rows dropped (bad or duplicate codes).
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AirportLoader {

    private final RawFileCatalog catalog;
    private final DimensionStore dimensionStore;
    private final PipelineRunStore runStore;

    public DimensionLoadResult load() {
        RawFile file = catalog.airportsFile();
        Instant startedAt = Instant.now();
        log.info("[AIRPORTS] Loading {}", file.key());

        AirportParser.Result parsed;
        try (Reader reader = catalog.open(file)) {
            parsed = AirportParser.parse(reader);
        } catch (IOException | UncheckedIOException e) {
            throw StructuralPipelineException.inFile(file.fileName(), "Malformed airports file", e);
        }

        int inserted = dimensionStore.insertAirports(parsed.airports());
        runStore.upsert(PipelineRun.completed(file.fileName(), PipelineRun.SOURCE_AIRPORTS,
                parsed.airports().size(), parsed.rowsSkipped(), startedAt, Instant.now()));

        log.info("[AIRPORTS] rows={} kept={} skipped={} new={}",
                parsed.rowsRead(), parsed.airports().size(), parsed.rowsSkipped(), inserted);
        return DimensionLoadResult.builder()
                .dimension("airports")
                .discovered(parsed.airports().size())
                .inserted(inserted)
                .filesScanned(1)
                .build();
    }
}
