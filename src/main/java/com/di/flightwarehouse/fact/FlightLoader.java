package com.di.flightwarehouse.fact;

import com.di.flightwarehouse.config.PipelineProperties;
import com.di.flightwarehouse.dimension.DateDimensionService;
import com.di.flightwarehouse.dimension.DimensionStore;
import com.di.flightwarehouse.exception.ErrorCategory;
import com.di.flightwarehouse.exception.StructuralPipelineException;
import com.di.flightwarehouse.ledger.PipelineRun;
import com.di.flightwarehouse.ledger.PipelineRunStore;
import com.di.flightwarehouse.storage.FactFileReader;
import com.di.flightwarehouse.storage.RawFile;
import com.di.flightwarehouse.util.PipelineMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVRecord;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Loads one fact file into {@code flights}.
 *
 * <pre>
 *   ledger: running
 *        |
 *   snapshot airports/carriers/dates  (once per file)
 *        |
 *   pass 1: collect FlightDate values -> insert missing dates -> snapshot.withDates(...)
 *        |
 *   pass 2: for each chunk of N rows
 *             validate against snapshot -> accepted | rejected
 *             one transaction: insert accepted (ON CONFLICT DO NOTHING) + append rejects
 *        |
 *   ledger: completed (processed / loaded / rejected)
 * </pre>
 *
 * <p>A structural failure leaves the ledger row {@code failed}. Chunks committed before the failure
 * stay committed; the retry re-reads the whole file and the conflict target absorbs them again.
 * Rejects of those chunks are logged a second time.</p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FlightLoader {

    static final List<String> REQUIRED_COLUMNS = List.of(
            FlightKeyFields.COL_FLIGHT_DATE,
            FlightKeyFields.COL_CARRIER,
            FlightKeyFields.COL_ORIGIN,
            FlightKeyFields.COL_DEST);

    private final FactFileReader factFileReader;
    private final DimensionStore dimensionStore;
    private final DateDimensionService dateDimensionService;
    private final FlightStore flightStore;
    private final PipelineRunStore runStore;
    private final PipelineProperties properties;
    private final PipelineMetrics metrics;

    public FileLoadResult loadFile(RawFile file) {
        Instant startedAt = Instant.now();
        runStore.upsert(PipelineRun.running(file.fileName(), PipelineRun.SOURCE_FLIGHTS, startedAt));
        Tally tally = new Tally();
        log.info("[FLIGHTS] Loading {} (chunkSize={})", file.key(), properties.getChunkSize());

        try {
            DimensionSnapshot snapshot = takeSnapshot(file, tally);
            factFileReader.readChunks(file, REQUIRED_COLUMNS, properties.getChunkSize(),
                    (chunkIndex, firstRow, rows) -> processChunk(file, snapshot, chunkIndex, firstRow, rows, tally));
        } catch (RuntimeException e) {
            throw recordFailure(file, startedAt, tally, e);
        }

        Instant completedAt = Instant.now();
        runStore.upsert(PipelineRun.completed(file.fileName(), PipelineRun.SOURCE_FLIGHTS,
                tally.loaded, tally.rejected, startedAt, completedAt));
        metrics.recordFileCompleted();

        FileLoadResult result = FileLoadResult.builder()
                .fileName(file.fileName())
                .processed(tally.loaded + tally.rejected)
                .loaded(tally.loaded)
                .rejected(tally.rejected)
                .inserted(tally.inserted)
                .chunks(tally.chunks)
                .datesAdded(tally.datesAdded)
                .durationMs(Duration.between(startedAt, completedAt).toMillis())
                .build();
        log.info("[FLIGHTS] {} complete: processed={} loaded={} (new={}) rejected={} chunks={} in {} ms",
                file.fileName(), result.getProcessed(), result.getLoaded(), result.getInserted(),
                result.getRejected(), result.getChunks(), result.getDurationMs());
        return result;
    }

    /* ------------------------------------------------------------------ */

    /**
     * Captures the dimension keys and merges the file's own dates into the date dimension
     * before any row is validated.
     */
    private DimensionSnapshot takeSnapshot(RawFile file, Tally tally) {
        DimensionSnapshot snapshot = new DimensionSnapshot(
                dimensionStore.findAirportCodes(),
                dimensionStore.findCarrierCodes(),
                dimensionStore.findDates());

        Set<LocalDate> missing = new TreeSet<>();
        factFileReader.scan(file, REQUIRED_COLUMNS, record ->
                FlightKeyFields.from(record).date()
                        .filter(date -> !snapshot.hasDate(date))
                        .ifPresent(missing::add));
        if (missing.isEmpty()) {
            return snapshot;
        }
        tally.datesAdded = dateDimensionService.ensureDatesExist(missing);
        log.info("[FLIGHTS] {}: {} dates not yet in date_dim, added before validation", file.fileName(), missing.size());
        return snapshot.withDates(missing);
    }

    private void processChunk(RawFile file, DimensionSnapshot snapshot, int chunkIndex, long firstRow,
                              List<CSVRecord> rows, Tally tally) {
        List<FlightRecord> accepted = new ArrayList<>(rows.size());
        List<RejectedRecord> rejected = new ArrayList<>();
        long rowIndex = firstRow;
        for (CSVRecord record : rows) {
            FlightKeyFields key = FlightKeyFields.from(record);
            List<String> reasons = FlightRowValidator.validate(key, snapshot);
            if (reasons.isEmpty()) {
                accepted.add(FlightRowMapper.map(record, key));
            } else {
                rejected.add(RejectedRecord.builder()
                        .source(PipelineRun.SOURCE_FLIGHTS)
                        .fileName(file.fileName())
                        .rowNumber(rowIndex)
                        .rawData(key.snapshot())
                        .rejectionReason(String.join(FlightRowValidator.REASON_SEPARATOR, reasons))
                        .build());
            }
            rowIndex++;
        }

        int inserted;
        try {
            inserted = flightStore.writeChunk(accepted, rejected);
        } catch (DataAccessException | TransactionException e) {
            throw StructuralPipelineException.inChunk(file.fileName(), chunkIndex, firstRow, "Chunk write failed", e);
        }

        tally.loaded += accepted.size();
        tally.rejected += rejected.size();
        tally.inserted += inserted;
        tally.chunks++;
        metrics.recordChunk(accepted.size(), rejected.size());
        log.info("[FLIGHTS] {} chunk {}: rows {}..{} loaded={} rejected={}",
                file.fileName(), chunkIndex, firstRow, rowIndex - 1, accepted.size(), rejected.size());
    }

    /** Marks the ledger row failed and returns the exception to rethrow. */
    private StructuralPipelineException recordFailure(RawFile file, Instant startedAt, Tally tally, RuntimeException e) {
        StructuralPipelineException failure = e instanceof StructuralPipelineException spe
                ? spe
                : StructuralPipelineException.inFile(file.fileName(), "Fact load aborted", e);
        log.error("[FLIGHTS] {} failed after {} chunks [{}]: {}",
                file.fileName(), tally.chunks, ErrorCategory.categorize(e), failure.getMessage());
        try {
            runStore.upsert(PipelineRun.builder()
                    .fileName(file.fileName())
                    .source(PipelineRun.SOURCE_FLIGHTS)
                    .rowsProcessed(tally.loaded + tally.rejected)
                    .rowsLoaded(tally.loaded)
                    .rowsRejected(tally.rejected)
                    .status(PipelineRun.STATUS_FAILED)
                    .startedAt(startedAt)
                    .errorMessage(failure.getMessage())
                    .build());
        } catch (RuntimeException ledgerError) {
            failure.addSuppressed(ledgerError);
        }
        return failure;
    }

    private static final class Tally {
        long loaded;
        long rejected;
        long inserted;
        int chunks;
        int datesAdded;
    }
}
