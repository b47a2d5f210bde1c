package com.di.buildtrace.snapshot;

import java.util.OptionalLong;

/**
 * Durable storage of job snapshots, one record per job id. Implementations can be GCS-backed
 * or in-memory; retry policy, if any, belongs to the implementation.
 */
public interface SnapshotStore {

    /**
     * Loads the snapshot stored for {@code jobId}.
     *
     * @throws SnapshotNotFoundException  if nothing is stored for that job
     * @throws StoreUnavailableException if the backing storage cannot be reached or read
     */
    Snapshot fetch(long jobId);

    /**
     * Stores (or replaces) the snapshot for {@code jobId}.
     *
     * @throws StoreUnavailableException if the write fails
     */
    void put(long jobId, Snapshot snapshot);

    /**
     * Greatest stored job id strictly below {@code jobId}, or empty when there is none.
     *
     * @throws StoreUnavailableException if the backing storage cannot be listed
     */
    OptionalLong findLatestBefore(long jobId);

    /** Cheap reachability probe used by the health endpoint. */
    boolean isAvailable();

    /** Short label for logs and health output, e.g. {@code gcs} or {@code memory}. */
    String describe();
}
