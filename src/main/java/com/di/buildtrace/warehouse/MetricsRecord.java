package com.di.buildtrace.warehouse;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One warehouse row per report request. Metadata is the current job's; counts are the
 * primary change classes (moves are not counted separately).
 */
@Value
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class MetricsRecord {

    String timestamp;
    long   jobId;
    long   latencyMs;

    int totalAdded;
    int totalRemoved;
    int totalModified;
    int totalUnchanged;

    /**
     * Row content for {@code buildtrace_metrics.job_results}. {@code job_id} is written as a
     * string to match the table's STRING column.
     */
    public Map<String, Object> toRow() {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("timestamp", timestamp);
        row.put("job_id", String.valueOf(jobId));
        row.put("latency_ms", latencyMs);
        row.put("total_added", totalAdded);
        row.put("total_removed", totalRemoved);
        row.put("total_modified", totalModified);
        row.put("total_unchanged", totalUnchanged);
        return row;
    }
}
