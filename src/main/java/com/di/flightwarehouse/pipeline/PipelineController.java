package com.di.flightwarehouse.pipeline;

import com.di.flightwarehouse.ledger.PendingFileResolver;
import com.di.flightwarehouse.ledger.PipelineRun;
import com.di.flightwarehouse.ledger.PipelineRunStore;
import com.di.flightwarehouse.storage.RawFile;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Trigger and inspection API used by the external scheduler.
 *
 * <p><strong>Base path:</strong> {@code /api/pipeline}
 *
 * <table border="1">
 * <tr><th>Method</th><th>Path</th><th>Description</th></tr>
 * <tr><td>POST</td><td>/runs</td><td>Run the whole DAG (synchronous)</td></tr>
 * <tr><td>POST</td><td>/stages/{stage}</td><td>Run one stage, e.g. {@code load_flights}</td></tr>
 * <tr><td>GET</td><td>/ledger?source=flights</td><td>Ledger rows, newest first</td></tr>
 * <tr><td>GET</td><td>/files/pending</td><td>Fact files not yet completed</td></tr>
 * </table>
 */
@RestController
@RequestMapping("/api/pipeline")
@Slf4j
@RequiredArgsConstructor
public class PipelineController {

    private final FlightPipelineOrchestrator orchestrator;
    private final PipelineRunStore runStore;
    private final PendingFileResolver pendingFileResolver;

    /* ------------------------------------------------------------------ */
    /* Trigger                                                              */
    /* ------------------------------------------------------------------ */

    /**
     * Returns {@code 201 Created} when every stage succeeded, otherwise {@code 500} with the
     * per-stage report.
     */
    @PostMapping("/runs")
    public ResponseEntity<PipelineRunReport> triggerRun() {
        log.info("[CONTROLLER] POST /api/pipeline/runs");
        PipelineRunReport report = orchestrator.runAll();
        HttpStatus status = report.isSucceeded() ? HttpStatus.CREATED : HttpStatus.INTERNAL_SERVER_ERROR;
        return ResponseEntity.status(status).body(report);
    }

    /** Failures surface through the exception handler (502 structural, 422 quality gate). */
    @PostMapping("/stages/{stage}")
    public ResponseEntity<StageExecution> triggerStage(@PathVariable String stage) {
        log.info("[CONTROLLER] POST /api/pipeline/stages/{}", stage);
        return ResponseEntity.ok(orchestrator.runStage(PipelineStage.fromName(stage)));
    }

    /* ------------------------------------------------------------------ */
    /* Queries                                                              */
    /* ------------------------------------------------------------------ */

    @GetMapping("/ledger")
    public List<PipelineRun> ledger(@RequestParam(required = false) String source) {
        return runStore.findAll(source);
    }

    @GetMapping("/files/pending")
    public List<String> pendingFiles() {
        return pendingFileResolver.pendingFactFiles().stream().map(RawFile::fileName).toList();
    }
}
