package com.di.flightwarehouse.ledger;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * JDBC repository for the {@code pipeline_runs} table.
 */
@Slf4j
@Repository
@RequiredArgsConstructor
public class JdbcPipelineRunStore implements PipelineRunStore {

    private final JdbcTemplate jdbc;

    // ------------------------------------------------------------------
    // RowMapper
    // ------------------------------------------------------------------

    private static final RowMapper<PipelineRun> ROW_MAPPER = (rs, n) -> PipelineRun.builder()
            .runId(rs.getLong("run_id"))
            .fileName(rs.getString("file_name"))
            .source(rs.getString("source"))
            .rowsProcessed(rs.getLong("rows_processed"))
            .rowsLoaded(rs.getLong("rows_loaded"))
            .rowsRejected(rs.getLong("rows_rejected"))
            .status(rs.getString("status"))
            .startedAt(toInstant(rs.getObject("started_at", LocalDateTime.class)))
            .completedAt(toInstant(rs.getObject("completed_at", LocalDateTime.class)))
            .errorMessage(rs.getString("error_message"))
            .build();

    // ------------------------------------------------------------------
    // Write operations
    // ------------------------------------------------------------------

    @Override
    public void upsert(PipelineRun run) {
        jdbc.update("""
            INSERT INTO pipeline_runs
              (file_name, source, rows_processed, rows_loaded, rows_rejected,
               status, started_at, completed_at, error_message)
            VALUES (?,?,?,?,?, ?,?,?,?)
            ON CONFLICT (file_name, source) DO UPDATE SET
              rows_processed = EXCLUDED.rows_processed,
              rows_loaded    = EXCLUDED.rows_loaded,
              rows_rejected  = EXCLUDED.rows_rejected,
              status         = EXCLUDED.status,
              started_at     = COALESCE(EXCLUDED.started_at, pipeline_runs.started_at),
              completed_at   = EXCLUDED.completed_at,
              error_message  = EXCLUDED.error_message
            """,
            run.getFileName(), run.getSource(),
            run.getRowsProcessed(), run.getRowsLoaded(), run.getRowsRejected(),
            run.getStatus(), toUtc(run.getStartedAt()), toUtc(run.getCompletedAt()),
            run.getErrorMessage());
        log.debug("[LEDGER] {}/{} -> {}", run.getSource(), run.getFileName(), run.getStatus());
    }

    // ------------------------------------------------------------------
    // Read operations
    // ------------------------------------------------------------------

    @Override
    public Optional<PipelineRun> find(String fileName, String source) {
        List<PipelineRun> rows = jdbc.query(
                "SELECT * FROM pipeline_runs WHERE file_name = ? AND source = ?",
                ROW_MAPPER, fileName, source);
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    @Override
    public Set<String> findCompletedFileNames(String source) {
        return new HashSet<>(jdbc.queryForList(
                "SELECT file_name FROM pipeline_runs WHERE source = ? AND status = 'completed'",
                String.class, source));
    }

    @Override
    public Optional<PipelineRun> findLatestCompleted(String source) {
        List<PipelineRun> rows = jdbc.query("""
            SELECT * FROM pipeline_runs
            WHERE source = ? AND status = 'completed'
            ORDER BY completed_at DESC NULLS LAST, run_id DESC
            LIMIT 1
            """, ROW_MAPPER, source);
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    @Override
    public List<PipelineRun> findAll(String source) {
        if (source == null || source.isBlank()) {
            return jdbc.query("SELECT * FROM pipeline_runs ORDER BY started_at DESC NULLS LAST, run_id DESC", ROW_MAPPER);
        }
        return jdbc.query("SELECT * FROM pipeline_runs WHERE source = ? ORDER BY started_at DESC NULLS LAST, run_id DESC",
                ROW_MAPPER, source);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    /** Ledger timestamps are stored as UTC wall-clock time. */
    private static Instant toInstant(LocalDateTime utc) {
        return utc == null ? null : utc.toInstant(ZoneOffset.UTC);
    }

    private static LocalDateTime toUtc(Instant instant) {
        return instant == null ? null : LocalDateTime.ofInstant(instant, ZoneOffset.UTC);
    }
}
