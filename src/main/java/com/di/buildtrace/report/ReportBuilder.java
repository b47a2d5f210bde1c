package com.di.buildtrace.report;

import com.di.buildtrace.diff.ChangeSet;
import com.di.buildtrace.diff.FingerprintChange;
import com.di.buildtrace.diff.MovePair;
import com.di.buildtrace.snapshot.SnapshotMeta;
import com.di.buildtrace.warehouse.MetricsRecord;
import com.di.buildtrace.warehouse.WarehouseStatus;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Aggregates a {@link ChangeSet} into a {@link MetricsRecord} and a {@link Report}.
 * No I/O; the warehouse insert happens afterwards in {@link ChangeReportService}.
 */
@Component
@RequiredArgsConstructor
public class ReportBuilder {

    static final String NO_CHANGES = "No significant changes detected.";

    private final ChangeDescriber describer;
    private final Clock           clock;

    /**
     * @param changeSet    diff of the two snapshots
     * @param previousMeta baseline metadata; null when there was no predecessor
     * @param currentMeta  metadata of the reported job, copied into the metrics record
     */
    public ReportBuild build(ChangeSet changeSet, SnapshotMeta previousMeta, SnapshotMeta currentMeta) {
        if (changeSet == null || currentMeta == null) {
            throw new IllegalArgumentException("Change set and current metadata are required");
        }
        MetricsRecord record = MetricsRecord.builder()
                .timestamp(currentMeta.timestamp())
                .jobId(currentMeta.jobId())
                .latencyMs(currentMeta.latencyMs())
                .totalAdded(changeSet.getAdded().size())
                .totalRemoved(changeSet.getRemoved().size())
                .totalModified(changeSet.getModified().size())
                .totalUnchanged(changeSet.getUnchanged().size())
                .build();

        Set<String> movedFrom = changeSet.movedFromKeys();
        Set<String> movedTo   = changeSet.movedToKeys();

        List<String> added   = new ArrayList<>();
        List<String> removed = new ArrayList<>();
        List<String> details = new ArrayList<>();
        for (String key : changeSet.getAdded()) {
            if (!movedTo.contains(key)) {
                added.add(key);
                details.add(describer.describeAdded(key, changeSet.getAddedFingerprints().get(key)));
            }
        }
        for (String key : changeSet.getRemoved()) {
            if (!movedFrom.contains(key)) {
                removed.add(key);
                details.add(describer.describeRemoved(key));
            }
        }
        for (MovePair move : changeSet.getMoves()) {
            details.add(describer.describeMove(move));
        }
        for (FingerprintChange change : changeSet.getModifications()) {
            details.add(describer.describeModified(change));
        }

        Report report = Report.builder()
                .jobId(currentMeta.jobId())
                .previousJobId(previousMeta == null ? null : previousMeta.jobId())
                .timestamp(currentMeta.timestamp())
                .latencyMs(currentMeta.latencyMs())
                .totalAdded(record.getTotalAdded())
                .totalRemoved(record.getTotalRemoved())
                .totalModified(record.getTotalModified())
                .totalUnchanged(record.getTotalUnchanged())
                .added(List.copyOf(added))
                .removed(List.copyOf(removed))
                .modified(List.copyOf(changeSet.getModified()))
                .moved(changeSet.getMoves())
                .details(List.copyOf(details))
                .summary(summarize(record, changeSet.getMoves().size()))
                .metricsStatus(WarehouseStatus.notAttempted("Warehouse insertion pending."))
                .generatedAt(Instant.now(clock))
                .build();

        return new ReportBuild(record, report);
    }

    static String summarize(MetricsRecord record, int moves) {
        List<String> parts = new ArrayList<>(4);
        if (record.getTotalAdded() > 0) {
            parts.add(record.getTotalAdded() + " item(s) added.");
        }
        if (record.getTotalRemoved() > 0) {
            parts.add(record.getTotalRemoved() + " item(s) removed.");
        }
        if (record.getTotalModified() > 0) {
            parts.add(record.getTotalModified() + " item(s) moved/modified.");
        }
        if (moves > 0) {
            parts.add(moves + " re-keyed item(s) (included in added/removed).");
        }
        return parts.isEmpty() ? NO_CHANGES : String.join(" | ", parts);
    }
}
