package com.di.buildtrace.snapshot;

/**
 * Metadata view of a {@link Snapshot}: everything except the object map.
 */
public record SnapshotMeta(long jobId, String timestamp, long latencyMs) {
}
