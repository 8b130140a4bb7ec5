package com.di.flightwarehouse.exception;

import com.di.flightwarehouse.quality.QualityReport;
import lombok.Getter;

/**
 * Raised by the quality gate when at least one check fails. Terminal for the run and never retried:
 * re-running the same checks over the same committed data gives the same answer.
 */
@Getter
public class QualityGateException extends RuntimeException {

    private final transient QualityReport report;

    public QualityGateException(QualityReport report) {
        super(report.getFailedCount() + " quality checks failed: " + String.join(", ", report.failedCheckNames()));
        this.report = report;
    }
}
