package com.di.buildtrace.diff;

/**
 * Before/after fingerprints of a key present in both snapshots with different content.
 */
public record FingerprintChange(String key, String previous, String current) {
}
