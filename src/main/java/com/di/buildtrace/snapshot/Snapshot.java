package com.di.buildtrace.snapshot;

import lombok.Builder;
import lombok.Value;

import java.util.Collections;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Full artifact state of one build job: every object key mapped to its fingerprint,
 * plus the job's metadata.
 *
 * <p>Instances are immutable. The object map is copied into a sorted, unmodifiable map on
 * construction so iteration order is stable across runs.
 */
@Value
public class Snapshot {

    long jobId;

    /** ISO-8601 start time of the job, as submitted. Null only for {@link #empty()}. */
    String timestamp;

    long latencyMs;

    SortedMap<String, String> objects;

    @Builder
    public Snapshot(long jobId, String timestamp, long latencyMs, Map<String, String> objects) {
        if (objects == null) {
            throw new IllegalArgumentException("Snapshot for job " + jobId + " has no object map");
        }
        TreeMap<String, String> copy = new TreeMap<>();
        for (Map.Entry<String, String> e : objects.entrySet()) {
            if (e.getKey() == null) {
                throw new IllegalArgumentException("Snapshot for job " + jobId + " contains a null object key");
            }
            if (e.getValue() == null) {
                throw new IllegalArgumentException(
                        "Snapshot for job " + jobId + " has a null fingerprint for key '" + e.getKey() + "'");
            }
            copy.put(e.getKey(), e.getValue());
        }
        this.jobId = jobId;
        this.timestamp = timestamp;
        this.latencyMs = latencyMs;
        this.objects = Collections.unmodifiableSortedMap(copy);
    }

    /**
     * Baseline used when a job has no predecessor: no objects, so every key of the
     * current snapshot is reported as added.
     */
    public static Snapshot empty() {
        return new Snapshot(0L, null, 0L, Map.of());
    }

    public SnapshotMeta meta() {
        return new SnapshotMeta(jobId, timestamp, latencyMs);
    }

    public int size() {
        return objects.size();
    }
}
