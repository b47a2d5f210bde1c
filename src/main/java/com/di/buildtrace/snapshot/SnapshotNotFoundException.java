package com.di.buildtrace.snapshot;

import lombok.Getter;

/**
 * Thrown by {@link SnapshotStore#fetch(long)} when no snapshot exists for a job id.
 *
 * <p>Mapped to 404 Not Found by {@link com.di.buildtrace.exception.GlobalExceptionHandler}.
 */
@Getter
public class SnapshotNotFoundException extends RuntimeException {

    private final long jobId;

    public SnapshotNotFoundException(long jobId) {
        super("No snapshot stored for job " + jobId);
        this.jobId = jobId;
    }
}
