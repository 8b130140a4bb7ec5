package com.di.flightwarehouse.ledger;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Persistence for the {@code pipeline_runs} ledger. Rows are upserted on (file_name, source),
 * never duplicated.
 */
public interface PipelineRunStore {

    void upsert(PipelineRun run);

    Optional<PipelineRun> find(String fileName, String source);

    /** File names whose ledger row for {@code source} is completed. */
    Set<String> findCompletedFileNames(String source);

    /** The completed row for {@code source} with the latest completion time. */
    Optional<PipelineRun> findLatestCompleted(String source);

    /** All rows, optionally restricted to one source, newest first. */
    List<PipelineRun> findAll(String source);
}
