package com.di.buildtrace.warehouse;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Value;

/**
 * Outcome of the single best-effort warehouse insert made for a report.
 */
@Value
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class WarehouseStatus {

    boolean attempted;
    boolean succeeded;
    String  detail;

    public static WarehouseStatus notAttempted(String reason) {
        return new WarehouseStatus(false, false, reason);
    }

    public static WarehouseStatus succeeded(String detail) {
        return new WarehouseStatus(true, true, detail);
    }

    public static WarehouseStatus failed(String detail) {
        return new WarehouseStatus(true, false, detail);
    }

    /** {@code "attempted, succeeded"}, {@code "attempted, failed"} or {@code "not attempted"}. */
    public String getOutcome() {
        if (!attempted) {
            return "not attempted";
        }
        return succeeded ? "attempted, succeeded" : "attempted, failed";
    }
}
