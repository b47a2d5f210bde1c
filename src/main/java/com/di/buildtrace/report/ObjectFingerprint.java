package com.di.buildtrace.report;

import java.util.Optional;

/**
 * Structural reading of a geometric pseudo-hash {@code type_x_y[_width_height]}, e.g.
 * {@code door_12_40_2_7}. Fingerprints in any other shape are opaque and have no reading.
 */
public record ObjectFingerprint(String type, int x, int y) {

    public static Optional<ObjectFingerprint> parse(String fingerprint) {
        if (fingerprint == null) {
            return Optional.empty();
        }
        String[] parts = fingerprint.split("_");
        if (parts.length < 3 || parts[0].isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(new ObjectFingerprint(parts[0], Integer.parseInt(parts[1]), Integer.parseInt(parts[2])));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }
}
