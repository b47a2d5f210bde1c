package com.di.buildtrace.diff;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * A removed key and an added key that share the same fingerprint: the same object
 * re-appearing under a new key.
 *
 * @param fromKey     key in the previous snapshot (member of {@code removed})
 * @param toKey       key in the current snapshot (member of {@code added})
 * @param fingerprint the shared fingerprint
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record MovePair(String fromKey, String toKey, String fingerprint) {
}
