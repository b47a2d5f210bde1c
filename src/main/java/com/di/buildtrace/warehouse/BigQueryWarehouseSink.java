package com.di.buildtrace.warehouse;

import com.di.buildtrace.config.BuildTraceProperties;
import com.google.cloud.bigquery.BigQuery;
import com.google.cloud.bigquery.BigQueryError;
import com.google.cloud.bigquery.InsertAllRequest;
import com.google.cloud.bigquery.InsertAllResponse;
import com.google.cloud.bigquery.TableId;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Streams each {@link MetricsRecord} into BigQuery with {@code tabledata.insertAll}.
 *
 * <p>Both row-level insert errors and client exceptions end up in a failed
 * {@link WarehouseStatus}; nothing propagates to the report request.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "buildtrace.warehouse.enabled", havingValue = "true", matchIfMissing = true)
public class BigQueryWarehouseSink implements WarehouseSink {

    private final BigQuery bigQuery;
    private final TableId  tableId;

    public BigQueryWarehouseSink(BigQuery bigQuery, BuildTraceProperties properties) {
        this.bigQuery = bigQuery;
        BuildTraceProperties.Warehouse wh = properties.getWarehouse();
        this.tableId = wh.getProject() == null || wh.getProject().isBlank()
                ? TableId.of(wh.getDataset(), wh.getTable())
                : TableId.of(wh.getProject(), wh.getDataset(), wh.getTable());
    }

    @Override
    public WarehouseStatus insert(MetricsRecord record) {
        String target = tableId.getDataset() + "." + tableId.getTable();
        try {
            InsertAllResponse response = bigQuery.insertAll(
                    InsertAllRequest.newBuilder(tableId).addRow(record.toRow()).build());
            if (response.hasErrors()) {
                Map<Long, List<BigQueryError>> errors = response.getInsertErrors();
                log.error("[WAREHOUSE] insert errors for job {} into {}: {}", record.getJobId(), target, errors);
                return WarehouseStatus.failed("BigQuery insertion failed: " + errors.values());
            }
            log.info("[WAREHOUSE] metrics for job {} inserted into {}", record.getJobId(), target);
            return WarehouseStatus.succeeded("BigQuery insertion succeeded (" + target + ")");
        } catch (RuntimeException e) {
            log.error("[WAREHOUSE] BigQuery client error for job {}: {}", record.getJobId(), e.getMessage(), e);
            return WarehouseStatus.failed("BigQuery insertion failed: " + e.getMessage());
        }
    }
}
