package com.di.buildtrace.config;

import com.google.cloud.bigquery.BigQuery;
import com.google.cloud.bigquery.BigQueryOptions;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Registers a BigQuery client bean backed by Application Default Credentials.
 *
 * <p>Used by {@link com.di.buildtrace.warehouse.BigQueryWarehouseSink} for metrics inserts.</p>
 */
@Configuration
public class BigQueryClientConfig {

    @Bean
    @ConditionalOnMissingBean(BigQuery.class)
    @ConditionalOnProperty(name = "buildtrace.warehouse.enabled", havingValue = "true", matchIfMissing = true)
    public BigQuery bigQueryClient(BuildTraceProperties properties) {
        String project = properties.getWarehouse().getProject();
        if (project == null || project.isBlank()) {
            return BigQueryOptions.getDefaultInstance().getService();
        }
        return BigQueryOptions.newBuilder().setProjectId(project).build().getService();
    }
}
