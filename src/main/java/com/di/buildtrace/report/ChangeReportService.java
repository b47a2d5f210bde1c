package com.di.buildtrace.report;

import com.di.buildtrace.diff.ChangeSet;
import com.di.buildtrace.diff.DiffEngine;
import com.di.buildtrace.predecessor.PredecessorResolver;
import com.di.buildtrace.snapshot.Snapshot;
import com.di.buildtrace.snapshot.SnapshotNotFoundException;
import com.di.buildtrace.snapshot.SnapshotStore;
import com.di.buildtrace.snapshot.StoreUnavailableException;
import com.di.buildtrace.util.ReportMetricsCollector;
import com.di.buildtrace.warehouse.WarehouseSink;
import com.di.buildtrace.warehouse.WarehouseStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.util.OptionalLong;

/**
 * Produces the change report for one job.
 *
 * <h3>Steps</h3>
 * <ol>
 *   <li>Fetch the current snapshot.</li>
 *   <li>Resolve the baseline job with the configured {@link PredecessorResolver} and fetch it;
 *       a job without predecessor is compared against an empty snapshot.</li>
 *   <li>Diff, then build the metrics record and the report.</li>
 *   <li>Insert the metrics record into the warehouse (best effort) and stamp the outcome on the report.</li>
 * </ol>
 *
 * <p>Store failures (not found, unavailable) propagate; warehouse failures never do.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ChangeReportService {

    private static final String MDC_JOB_ID = "jobId";

    private final SnapshotStore          store;
    private final PredecessorResolver    predecessorResolver;
    private final DiffEngine             diffEngine;
    private final ReportBuilder          reportBuilder;
    private final WarehouseSink          warehouseSink;
    private final ReportMetricsCollector metrics;

    public Report report(long jobId) {
        if (jobId <= 0) {
            throw new IllegalArgumentException("Job ID must be positive.");
        }
        MDC.put(MDC_JOB_ID, String.valueOf(jobId));
        long started = System.currentTimeMillis();
        try {
            Snapshot current = store.fetch(jobId);
            OptionalLong previousId = predecessorResolver.resolvePredecessor(jobId);
            Snapshot previous = previousId.isPresent() ? store.fetch(previousId.getAsLong()) : Snapshot.empty();

            long diffStart = System.nanoTime();
            ChangeSet changeSet = diffEngine.diff(previous, current);
            metrics.recordDiff(System.nanoTime() - diffStart);

            ReportBuild build = reportBuilder.build(changeSet,
                    previousId.isPresent() ? previous.meta() : null,
                    current.meta());

            WarehouseStatus status = insertMetrics(build);
            metrics.recordWarehouse(status);

            Report report = build.report().withMetricsStatus(status);
            metrics.recordReportSuccess(System.currentTimeMillis() - started, current.size());
            log.info("[REPORT] job {} vs {}: {} (warehouse: {})",
                     jobId, previousId.isPresent() ? previousId.getAsLong() : "empty baseline",
                     report.getSummary(), status.getOutcome());
            return report;

        } catch (SnapshotNotFoundException e) {
            metrics.recordReportNotFound();
            log.warn("[REPORT] job {}: {}", jobId, e.getMessage());
            throw e;
        } catch (StoreUnavailableException e) {
            metrics.recordReportStoreUnavailable();
            log.error("[REPORT] job {}: snapshot store unavailable", jobId, e);
            throw e;
        } catch (RuntimeException e) {
            metrics.recordReportError();
            throw e;
        } finally {
            MDC.remove(MDC_JOB_ID);
        }
    }

    private WarehouseStatus insertMetrics(ReportBuild build) {
        try {
            return warehouseSink.insert(build.metricsRecord());
        } catch (RuntimeException e) {
            log.error("[WAREHOUSE] sink {} threw for job {}", warehouseSink.getClass().getSimpleName(),
                      build.metricsRecord().getJobId(), e);
            return WarehouseStatus.failed("Warehouse insertion failed: " + e.getMessage());
        }
    }
}
