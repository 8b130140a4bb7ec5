package com.di.flightwarehouse.ledger;

import com.di.flightwarehouse.support.PostgresTestDatabase;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs the ledger against PostgreSQL with the production schema.
 */
@DisplayName("JdbcPipelineRunStore Tests")
class JdbcPipelineRunStoreTest {

    private static final Instant T0 = Instant.parse("2024-03-10T07:30:00Z");

    private JdbcPipelineRunStore store;

    @BeforeEach
    void setUp() {
        store = new JdbcPipelineRunStore(PostgresTestDatabase.cleanDatabase());
    }

    // ============================================================================
    // Upsert Tests
    // ============================================================================

    @Test
    @DisplayName("Should move one ledger row from running to completed")
    void testUpsert_RunningThenCompleted() {
        store.upsert(PipelineRun.running("2024_01.csv", PipelineRun.SOURCE_FLIGHTS, T0));
        long runId = store.find("2024_01.csv", PipelineRun.SOURCE_FLIGHTS).orElseThrow().getRunId();

        store.upsert(PipelineRun.completed("2024_01.csv", PipelineRun.SOURCE_FLIGHTS, 95, 5,
                null, T0.plusSeconds(60)));

        PipelineRun run = store.find("2024_01.csv", PipelineRun.SOURCE_FLIGHTS).orElseThrow();
        assertEquals(runId, run.getRunId());
        assertTrue(run.isCompleted());
        assertEquals(100, run.getRowsProcessed());
        assertEquals(95, run.getRowsLoaded());
        assertEquals(5, run.getRowsRejected());
        assertEquals(T0, run.getStartedAt());
        assertEquals(T0.plusSeconds(60), run.getCompletedAt());
        assertEquals(1, store.findAll(PipelineRun.SOURCE_FLIGHTS).size());
    }

    @Test
    @DisplayName("Should keep the same file apart per source")
    void testUpsert_SeparateSources() {
        store.upsert(PipelineRun.running("shared.csv", PipelineRun.SOURCE_FLIGHTS, T0));
        store.upsert(PipelineRun.running("shared.csv", PipelineRun.SOURCE_WEATHER, T0));

        assertEquals(2, store.findAll(null).size());
        assertEquals(1, store.findAll(PipelineRun.SOURCE_WEATHER).size());
    }

    @Test
    @DisplayName("Should record the error message of a failed run")
    void testUpsert_Failed() {
        store.upsert(PipelineRun.running("bad.csv", PipelineRun.SOURCE_FLIGHTS, T0));
        store.upsert(PipelineRun.builder()
                .fileName("bad.csv")
                .source(PipelineRun.SOURCE_FLIGHTS)
                .status(PipelineRun.STATUS_FAILED)
                .errorMessage("Chunk write failed")
                .build());

        PipelineRun run = store.find("bad.csv", PipelineRun.SOURCE_FLIGHTS).orElseThrow();
        assertEquals(PipelineRun.STATUS_FAILED, run.getStatus());
        assertEquals("Chunk write failed", run.getErrorMessage());
        assertEquals(T0, run.getStartedAt());
        assertNull(run.getCompletedAt());
    }

    // ============================================================================
    // Query Tests
    // ============================================================================

    @Test
    @DisplayName("Should list only completed files of a source")
    void testFindCompletedFileNames() {
        store.upsert(PipelineRun.completed("a.csv", PipelineRun.SOURCE_FLIGHTS, 10, 0, T0, T0));
        store.upsert(PipelineRun.running("b.csv", PipelineRun.SOURCE_FLIGHTS, T0));
        store.upsert(PipelineRun.completed("airports.dat", PipelineRun.SOURCE_AIRPORTS, 5, 1, T0, T0));

        assertEquals(Set.of("a.csv"), store.findCompletedFileNames(PipelineRun.SOURCE_FLIGHTS));
    }

    @Test
    @DisplayName("Should pick the most recently completed run, ignoring later failures")
    void testFindLatestCompleted() {
        store.upsert(PipelineRun.completed("2024_02.csv", PipelineRun.SOURCE_FLIGHTS, 90, 10,
                T0, T0.plusSeconds(3600)));
        store.upsert(PipelineRun.completed("2024_01.csv", PipelineRun.SOURCE_FLIGHTS, 99, 1,
                T0, T0.plusSeconds(60)));
        store.upsert(PipelineRun.running("2024_03.csv", PipelineRun.SOURCE_FLIGHTS, T0.plusSeconds(7200)));

        PipelineRun latest = store.findLatestCompleted(PipelineRun.SOURCE_FLIGHTS).orElseThrow();

        assertEquals("2024_02.csv", latest.getFileName());
        assertEquals(10.0, latest.rejectionRatePct(), 1e-9);
    }

    @Test
    @DisplayName("Should find nothing for an empty ledger")
    void testFind_Empty() {
        assertTrue(store.findLatestCompleted(PipelineRun.SOURCE_FLIGHTS).isEmpty());
        assertTrue(store.find("missing.csv", PipelineRun.SOURCE_FLIGHTS).isEmpty());
        assertEquals(List.of(), store.findAll(""));
    }
}
