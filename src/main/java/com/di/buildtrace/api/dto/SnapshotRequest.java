package com.di.buildtrace.api.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * One element of the {@code POST /process} body; also the shape produced by {@code POST /simulate}.
 *
 * <pre>
 * {"state": {"W001": "wall_10_20_3_4"}, "job_id": 1,
 *  "timestamp": "2024-05-01T10:00:00Z", "latency_ms": 12000}
 * </pre>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class SnapshotRequest {

    /** Map of object keys (file paths / ids) to their content fingerprints. */
    @NotNull
    private Map<String, String> state;

    /** Unique id of the build job. */
    @NotNull
    @Positive
    private Long jobId;

    /** ISO-8601 timestamp of the job start. */
    @NotBlank
    private String timestamp;

    /** Total build latency in milliseconds. */
    @NotNull
    @PositiveOrZero
    private Long latencyMs;
}
