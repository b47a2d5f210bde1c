package com.di.buildtrace.snapshot;

/**
 * Raised at the ingestion boundary when a submitted snapshot is structurally invalid
 * (missing metadata, null keys or fingerprints, a job id submitted twice in one batch).
 * Returned as 400 Bad Request.
 */
public class MalformedSnapshotException extends RuntimeException {

    public MalformedSnapshotException(String message) {
        super(message);
    }
}
