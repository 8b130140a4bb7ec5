package com.di.flightwarehouse.ledger;

import com.di.flightwarehouse.storage.RawFile;
import com.di.flightwarehouse.storage.RawFileCatalog;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Set;

/**
 * Decides which fact files still need loading: every fact file in the bucket minus those
 * the ledger already records as completed for source {@code flights}.
 * <p>
 * Files with a {@code running} or {@code failed} row stay pending, which is how an interrupted
 * load is picked up again.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PendingFileResolver {

    private final RawFileCatalog catalog;
    private final PipelineRunStore runStore;

    /** Pending fact files, ordered by object key. */
    public List<RawFile> pendingFactFiles() {
        List<RawFile> all = catalog.listFactFiles();
        Set<String> completed = runStore.findCompletedFileNames(PipelineRun.SOURCE_FLIGHTS);
        List<RawFile> pending = all.stream()
                .filter(f -> !completed.contains(f.fileName()))
                .toList();
        log.info("[DISCOVERY] {} fact files found, {} already completed, {} pending",
                all.size(), all.size() - pending.size(), pending.size());
        return pending;
    }
}
