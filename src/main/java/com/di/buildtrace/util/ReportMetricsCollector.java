package com.di.buildtrace.util;

import com.di.buildtrace.warehouse.WarehouseStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Micrometer metrics for report generation, snapshot ingestion and warehouse inserts.
 */
@Slf4j
@Component
public class ReportMetricsCollector {

    // Report Metrics
    private final Counter reportCounter;
    private final Counter reportNotFoundCounter;
    private final Counter reportStoreErrorCounter;
    private final Counter reportErrorCounter;
    private final Timer   reportTimer;
    private final Timer   diffTimer;
    private final DistributionSummary snapshotObjectsDistribution;

    // Warehouse Metrics
    private final Counter warehouseSuccessCounter;
    private final Counter warehouseFailureCounter;
    private final Counter warehouseSkippedCounter;

    // Ingestion Metrics
    private final Counter snapshotsIngestedCounter;

    public ReportMetricsCollector(MeterRegistry meterRegistry) {
        this.reportCounter = Counter.builder("buildtrace.report.total")
                .description("Total number of change reports generated")
                .tag("status", "success")
                .register(meterRegistry);

        this.reportNotFoundCounter = Counter.builder("buildtrace.report.total")
                .description("Reports failed because a snapshot was missing")
                .tag("status", "not_found")
                .register(meterRegistry);

        this.reportStoreErrorCounter = Counter.builder("buildtrace.report.total")
                .description("Reports failed because the snapshot store was unavailable")
                .tag("status", "store_unavailable")
                .register(meterRegistry);

        this.reportErrorCounter = Counter.builder("buildtrace.report.total")
                .description("Reports failed for any other reason")
                .tag("status", "error")
                .register(meterRegistry);

        this.reportTimer = Timer.builder("buildtrace.report.duration")
                .description("End-to-end time to produce a change report")
                .register(meterRegistry);

        this.diffTimer = Timer.builder("buildtrace.diff.duration")
                .description("Time spent diffing two snapshots")
                .register(meterRegistry);

        this.snapshotObjectsDistribution = DistributionSummary.builder("buildtrace.snapshot.objects")
                .description("Number of objects in reported snapshots")
                .register(meterRegistry);

        this.warehouseSuccessCounter = Counter.builder("buildtrace.warehouse.insert.total")
                .description("Metrics rows inserted into the warehouse")
                .tag("outcome", "succeeded")
                .register(meterRegistry);

        this.warehouseFailureCounter = Counter.builder("buildtrace.warehouse.insert.total")
                .description("Metrics rows the warehouse rejected or failed to receive")
                .tag("outcome", "failed")
                .register(meterRegistry);

        this.warehouseSkippedCounter = Counter.builder("buildtrace.warehouse.insert.total")
                .description("Metrics rows not sent because the warehouse is disabled")
                .tag("outcome", "skipped")
                .register(meterRegistry);

        this.snapshotsIngestedCounter = Counter.builder("buildtrace.snapshot.ingested.total")
                .description("Snapshots accepted through the ingestion endpoint")
                .register(meterRegistry);
    }

    public void recordReportSuccess(long durationMs, int currentObjects) {
        reportCounter.increment();
        reportTimer.record(durationMs, TimeUnit.MILLISECONDS);
        snapshotObjectsDistribution.record(currentObjects);
    }

    public void recordReportNotFound() {
        reportNotFoundCounter.increment();
    }

    public void recordReportStoreUnavailable() {
        reportStoreErrorCounter.increment();
    }

    public void recordReportError() {
        reportErrorCounter.increment();
    }

    public void recordDiff(long durationNanos) {
        diffTimer.record(durationNanos, TimeUnit.NANOSECONDS);
    }

    public void recordWarehouse(WarehouseStatus status) {
        if (!status.isAttempted()) {
            warehouseSkippedCounter.increment();
        } else if (status.isSucceeded()) {
            warehouseSuccessCounter.increment();
        } else {
            warehouseFailureCounter.increment();
        }
    }

    public void recordSnapshotsIngested(int count) {
        snapshotsIngestedCounter.increment(count);
        log.debug("[METRICS] {} snapshot(s) ingested", count);
    }
}
