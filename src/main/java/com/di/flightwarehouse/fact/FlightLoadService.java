package com.di.flightwarehouse.fact;

import com.di.flightwarehouse.ledger.PendingFileResolver;
import com.di.flightwarehouse.storage.RawFile;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Flight stage: loads every pending fact file, one at a time, in key order.
 * The first file that fails aborts the stage; files completed before it stay completed.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FlightLoadService {

    private final PendingFileResolver pendingFileResolver;
    private final FlightLoader flightLoader;

    public FlightLoadSummary loadPendingFiles() {
        List<RawFile> pending = pendingFileResolver.pendingFactFiles();
        if (pending.isEmpty()) {
            log.info("[FLIGHTS] No new files to process");
        }
        List<FileLoadResult> results = new ArrayList<>(pending.size());
        for (RawFile file : pending) {
            results.add(flightLoader.loadFile(file));
        }
        FlightLoadSummary summary = FlightLoadSummary.builder()
                .filesProcessed(results.size())
                .rowsLoaded(results.stream().mapToLong(FileLoadResult::getLoaded).sum())
                .rowsRejected(results.stream().mapToLong(FileLoadResult::getRejected).sum())
                .files(List.copyOf(results))
                .build();
        log.info("[FLIGHTS] Stage done: files={} loaded={} rejected={}",
                summary.getFilesProcessed(), summary.getRowsLoaded(), summary.getRowsRejected());
        return summary;
    }
}
