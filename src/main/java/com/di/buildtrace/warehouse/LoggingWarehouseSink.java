package com.di.buildtrace.warehouse;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Used when {@code buildtrace.warehouse.enabled=false}: logs the row and reports that no
 * insertion was attempted.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "buildtrace.warehouse.enabled", havingValue = "false")
public class LoggingWarehouseSink implements WarehouseSink {

    @Override
    public WarehouseStatus insert(MetricsRecord record) {
        log.info("[WAREHOUSE] disabled, metrics not inserted: {}", record.toRow());
        return WarehouseStatus.notAttempted("Warehouse insertion disabled.");
    }
}
