package com.di.buildtrace.snapshot;

import com.di.buildtrace.api.dto.SnapshotRequest;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Structural checks applied at the ingestion boundary, before anything reaches the store.
 * Duplicate keys inside one {@code state} object are rejected earlier by the JSON parser.
 */
public final class SnapshotValidator {

    private SnapshotValidator() {}

    /**
     * @throws MalformedSnapshotException on the first violation found
     */
    public static void validateBatch(List<SnapshotRequest> batch) {
        if (batch == null || batch.isEmpty()) {
            throw new MalformedSnapshotException("At least one job snapshot is required");
        }
        Set<Long> seen = new HashSet<>();
        for (int i = 0; i < batch.size(); i++) {
            SnapshotRequest request = batch.get(i);
            validate(request, i);
            if (!seen.add(request.getJobId())) {
                throw new MalformedSnapshotException("Job " + request.getJobId() + " appears more than once in the batch");
            }
        }
    }

    public static void validate(SnapshotRequest request, int index) {
        if (request == null) {
            throw new MalformedSnapshotException("Entry " + index + " is null");
        }
        if (request.getJobId() == null || request.getJobId() <= 0) {
            throw new MalformedSnapshotException("Entry " + index + ": job_id must be a positive integer");
        }
        long jobId = request.getJobId();
        if (request.getTimestamp() == null || request.getTimestamp().isBlank()) {
            throw new MalformedSnapshotException("Job " + jobId + ": timestamp is required");
        }
        if (request.getLatencyMs() == null || request.getLatencyMs() < 0) {
            throw new MalformedSnapshotException("Job " + jobId + ": latency_ms must be zero or positive");
        }
        if (request.getState() == null) {
            throw new MalformedSnapshotException("Job " + jobId + ": state is required");
        }
        for (Map.Entry<String, String> e : request.getState().entrySet()) {
            if (e.getKey() == null || e.getKey().isEmpty()) {
                throw new MalformedSnapshotException("Job " + jobId + ": object keys must be non-empty");
            }
            if (e.getValue() == null) {
                throw new MalformedSnapshotException("Job " + jobId + ": fingerprint missing for '" + e.getKey() + "'");
            }
        }
    }

    public static Snapshot toSnapshot(SnapshotRequest request) {
        return Snapshot.builder()
                .jobId(request.getJobId())
                .timestamp(request.getTimestamp())
                .latencyMs(request.getLatencyMs())
                .objects(request.getState())
                .build();
    }
}
