package com.di.buildtrace.predecessor;

import com.di.buildtrace.snapshot.SnapshotStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.OptionalLong;

/**
 * Baseline is the most recent job actually present in the store with an id below the
 * requested one. Tolerates gaps left by failed submissions.
 * Enabled with {@code buildtrace.predecessor.strategy=latest-stored}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "buildtrace.predecessor.strategy", havingValue = "latest-stored")
public class LatestStoredPredecessorResolver implements PredecessorResolver {

    private final SnapshotStore store;

    @Override
    public OptionalLong resolvePredecessor(long jobId) {
        OptionalLong previous = store.findLatestBefore(jobId);
        if (previous.isPresent() && previous.getAsLong() != jobId - 1) {
            log.info("[PREDECESSOR] job {} compared against job {} (gap of {})",
                     jobId, previous.getAsLong(), jobId - previous.getAsLong() - 1);
        }
        return previous;
    }
}
