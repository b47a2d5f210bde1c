package com.di.buildtrace.snapshot;

/**
 * Transport or storage failure inside a {@link SnapshotStore}. Fatal for the request that
 * triggered it and never interpreted as "no snapshot".
 */
public class StoreUnavailableException extends RuntimeException {

    public StoreUnavailableException(String message) {
        super(message);
    }

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
