package com.di.flightwarehouse.quality;

import com.di.flightwarehouse.config.PipelineProperties;
import com.di.flightwarehouse.exception.QualityGateException;
import com.di.flightwarehouse.ledger.PipelineRun;
import com.di.flightwarehouse.ledger.PipelineRunStore;
import com.di.flightwarehouse.util.PipelineMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Terminal pipeline stage: aggregate invariants over the committed warehouse.
 * <p>
 * Every check runs even after an earlier one fails, so the report is always complete.
 * The gate passes only when all checks pass. A failing gate is a data outcome, not an
 * infrastructure error, and the orchestrator does not retry it.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class QualityGate {

    private final WarehouseStatistics statistics;
    private final PipelineRunStore runStore;
    private final PipelineProperties properties;
    private final PipelineMetrics metrics;

    /** Runs all checks and returns the report without failing. */
    public QualityReport evaluate() {
        List<QualityCheckResult> checks = new ArrayList<>();

        /* ---- dimensions and facts populated ---- */
        checks.add(positive("airports_not_empty", statistics.countAirports()));
        checks.add(positive("carriers_not_empty", statistics.countCarriers()));
        checks.add(positive("date_dim_not_empty", statistics.countDates()));
        checks.add(positive("flights_not_empty", statistics.countFlights()));

        /* ---- referential integrity ---- */
        checks.add(zero("no_orphan_origin_airports", statistics.countFlightsWithUnknownOrigin()));
        checks.add(zero("no_orphan_dest_airports", statistics.countFlightsWithUnknownDestination()));

        /* ---- plausibility ---- */
        checks.add(zero("delays_within_bounds", statistics.countFlightsWithDelayOutside(
                properties.getMinDelayMinutes(), properties.getMaxDelayMinutes())));
        checks.add(rejectionRate(runStore.findLatestCompleted(PipelineRun.SOURCE_FLIGHTS)));

        /* ---- weather ---- */
        checks.add(positive("weather_not_empty", statistics.countWeatherObservations()));
        checks.add(positive("weather_airports_covered", statistics.countWeatherAirportsCovered()));
        checks.add(positive("weather_dates_covered", statistics.countWeatherDatesCovered()));

        QualityReport report = new QualityReport(checks);
        for (QualityCheckResult check : checks) {
            metrics.recordQualityCheck(check.getName(), check.isPassed());
            if (check.isPassed()) {
                log.info("[QUALITY] PASS {} ({})", check.getName(), check.getDetail());
            } else {
                log.warn("[QUALITY] FAIL {} ({})", check.getName(), check.getDetail());
            }
        }
        log.info("[QUALITY] {} passed, {} failed", report.getPassedCount(), report.getFailedCount());
        logSummary();
        return report;
    }

    /**
     * Runs all checks and fails when any of them failed.
     *
     * @throws QualityGateException if at least one check failed
     */
    public QualityReport enforce() {
        QualityReport report = evaluate();
        if (!report.isPassed()) {
            throw new QualityGateException(report);
        }
        return report;
    }

    /**
     * Rejection rate of the most recently completed fact file, which must stay strictly below the
     * threshold. Passes when no fact file has completed yet (flights_not_empty covers that case).
     */
    QualityCheckResult rejectionRate(Optional<PipelineRun> latest) {
        double threshold = properties.getRejectionThresholdPct();
        if (latest.isEmpty()) {
            return QualityCheckResult.builder()
                    .name("rejection_rate_below_threshold")
                    .passed(true)
                    .detail("no completed flight file")
                    .build();
        }
        PipelineRun run = latest.get();
        double rate = run.rejectionRatePct();
        return QualityCheckResult.builder()
                .name("rejection_rate_below_threshold")
                .passed(rate < threshold)
                .detail(String.format(Locale.ROOT, "%s: %.2f%% rejected (%d of %d), threshold %.2f%%",
                        run.getFileName(), rate, run.getRowsRejected(),
                        run.getRowsLoaded() + run.getRowsRejected(), threshold))
                .build();
    }

    private void logSummary() {
        DatasetSummary s = statistics.summarize();
        log.info("[QUALITY] Dataset: flights={} carriers={} origins={} destinations={} avgArrDelay={} cancellations={}",
                s.getFlights(), s.getCarriers(), s.getOriginAirports(), s.getDestAirports(),
                s.getAvgArrivalDelay(), s.getCancellations());
    }

    private static QualityCheckResult positive(String name, long count) {
        return QualityCheckResult.builder().name(name).passed(count > 0).detail("count=" + count + ", expected > 0").build();
    }

    private static QualityCheckResult zero(String name, long count) {
        return QualityCheckResult.builder().name(name).passed(count == 0).detail("count=" + count + ", expected 0").build();
    }
}
