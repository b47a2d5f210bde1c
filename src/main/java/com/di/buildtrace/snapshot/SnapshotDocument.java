package com.di.buildtrace.snapshot;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * JSON document persisted per job in the snapshot bucket:
 * {@code gs://{bucket}/{prefix}/{jobId}.json}.
 *
 * <pre>
 * {"state": {"W001": "wall_10_20_3_4", ...}, "job_id": 7,
 *  "timestamp": "2024-05-01T10:00:00Z", "latency_ms": 12000}
 * </pre>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class SnapshotDocument {

    /** Object key → fingerprint. */
    private Map<String, String> state;
    private long                jobId;
    private String              timestamp;
    private long                latencyMs;

    public static SnapshotDocument from(Snapshot snapshot) {
        return SnapshotDocument.builder()
                .state(snapshot.getObjects())
                .jobId(snapshot.getJobId())
                .timestamp(snapshot.getTimestamp())
                .latencyMs(snapshot.getLatencyMs())
                .build();
    }

    public Snapshot toSnapshot() {
        return Snapshot.builder()
                .jobId(jobId)
                .timestamp(timestamp)
                .latencyMs(latencyMs)
                .objects(state)
                .build();
    }
}
