package com.di.buildtrace.snapshot;

import com.di.buildtrace.api.dto.SnapshotRequest;
import com.di.buildtrace.util.ReportMetricsCollector;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Validates submitted job snapshots and saves them for later reporting.
 *
 * <p>The whole batch is validated before the first write. A store failure stops the batch;
 * snapshots written before the failure stay stored.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SnapshotIngestionService {

    private final SnapshotStore          store;
    private final ReportMetricsCollector metrics;

    /**
     * @return the job ids stored, in submission order
     * @throws MalformedSnapshotException if any entry is structurally invalid
     * @throws StoreUnavailableException  if a write fails
     */
    public List<Long> ingest(List<SnapshotRequest> batch) {
        SnapshotValidator.validateBatch(batch);

        List<Long> stored = new ArrayList<>(batch.size());
        for (SnapshotRequest request : batch) {
            Snapshot snapshot = SnapshotValidator.toSnapshot(request);
            store.put(snapshot.getJobId(), snapshot);
            stored.add(snapshot.getJobId());
        }
        metrics.recordSnapshotsIngested(stored.size());
        log.info("[INGEST] {} job snapshot(s) stored in {}: {}", stored.size(), store.describe(), stored);
        return stored;
    }
}
