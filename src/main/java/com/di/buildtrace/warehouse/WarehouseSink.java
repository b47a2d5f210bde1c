package com.di.buildtrace.warehouse;

/**
 * Analytics destination for {@link MetricsRecord}s.
 *
 * <p>Implementations must not throw: insert failures are logged and returned as a
 * {@link WarehouseStatus#failed(String) failed} status so that report generation continues.
 */
public interface WarehouseSink {

    WarehouseStatus insert(MetricsRecord record);
}
