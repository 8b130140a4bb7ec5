package com.di.flightwarehouse.quality;

import lombok.Value;

import java.util.List;

/**
 * All check results of one quality gate evaluation, in evaluation order.
 */
@Value
public class QualityReport {

    List<QualityCheckResult> checks;

    public QualityReport(List<QualityCheckResult> checks) {
        this.checks = List.copyOf(checks);
    }

    public int getPassedCount() {
        return (int) checks.stream().filter(QualityCheckResult::isPassed).count();
    }

    public int getFailedCount() {
        return checks.size() - getPassedCount();
    }

    public boolean isPassed() {
        return getFailedCount() == 0;
    }

    public List<String> failedCheckNames() {
        return checks.stream().filter(c -> !c.isPassed()).map(QualityCheckResult::getName).toList();
    }
}
