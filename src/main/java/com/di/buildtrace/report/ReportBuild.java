package com.di.buildtrace.report;

import com.di.buildtrace.warehouse.MetricsRecord;

/**
 * Output of {@link ReportBuilder#build}: the warehouse row and the caller-facing report,
 * derived from the same change set.
 */
public record ReportBuild(MetricsRecord metricsRecord, Report report) {
}
