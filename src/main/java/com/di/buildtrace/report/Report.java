package com.di.buildtrace.report;

import com.di.buildtrace.diff.MovePair;
import com.di.buildtrace.warehouse.WarehouseStatus;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;
import lombok.With;

import java.time.Instant;
import java.util.List;

/**
 * Change report returned to the caller of {@code GET /report/{jobId}}.
 *
 * <p>{@code added} and {@code removed} list plain adds and removals; keys taking part in a
 * move are listed under {@code moved} instead. The {@code total_*} counts always include
 * moved keys.
 */
@Value
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class Report {

    long    jobId;
    /** Null when the job had no predecessor and was compared against an empty baseline. */
    Long    previousJobId;
    String  timestamp;
    long    latencyMs;

    int totalAdded;
    int totalRemoved;
    int totalModified;
    int totalUnchanged;

    List<String>   added;
    List<String>   removed;
    List<String>   modified;
    List<MovePair> moved;

    /** Human-readable lines: additions, removals, moves, then modifications. */
    List<String> details;

    String  summary;

    @With
    WarehouseStatus metricsStatus;

    Instant generatedAt;
}
