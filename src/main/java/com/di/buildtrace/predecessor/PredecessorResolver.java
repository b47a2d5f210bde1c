package com.di.buildtrace.predecessor;

import java.util.OptionalLong;

/**
 * Decides which job a given job is compared against. Pluggable so that job-id
 * contiguity is not baked into report generation.
 */
public interface PredecessorResolver {

    /**
     * @param jobId the job being reported on
     * @return the baseline job id, or empty when the job has no predecessor
     *         (the report then diffs against an empty snapshot)
     */
    OptionalLong resolvePredecessor(long jobId);
}
