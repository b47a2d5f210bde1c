package com.di.buildtrace.predecessor;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.OptionalLong;

/**
 * Baseline is {@code jobId - 1}. Assumes job ids are assigned contiguously; when a submission
 * is missing the resolved id points at a job that was never stored and the report fails with
 * not-found. Use {@link LatestStoredPredecessorResolver} when ids can have gaps.
 */
@Component
@ConditionalOnProperty(name = "buildtrace.predecessor.strategy", havingValue = "decrement", matchIfMissing = true)
public class DecrementPredecessorResolver implements PredecessorResolver {

    @Override
    public OptionalLong resolvePredecessor(long jobId) {
        long previous = jobId - 1;
        return previous >= 1 ? OptionalLong.of(previous) : OptionalLong.empty();
    }
}
