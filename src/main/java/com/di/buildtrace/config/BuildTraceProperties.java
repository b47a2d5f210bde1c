package com.di.buildtrace.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Single binding for the service configuration.
 *
 * <pre>
 * buildtrace:
 *   store:
 *     type: gcs              # gcs | memory
 *     bucket: ${BUCKET:}     # "gs://" prefix is accepted and stripped
 *     prefix: job_state
 *   warehouse:
 *     enabled: true
 *     project: ${PROJECT_ID:}
 *     dataset: buildtrace_metrics
 *     table: job_results
 *   predecessor:
 *     strategy: decrement    # decrement | latest-stored
 * </pre>
 */
@Data
@ConfigurationProperties(prefix = "buildtrace")
public class BuildTraceProperties {

    private Store       store       = new Store();
    private Warehouse   warehouse   = new Warehouse();
    private Predecessor predecessor = new Predecessor();

    @Data
    public static class Store {
        private String type   = "gcs";
        private String bucket = "";
        private String prefix = "job_state";

        /** Bucket name without the {@code gs://} scheme or trailing slash. */
        public String bucketName() {
            String b = bucket == null ? "" : bucket.trim();
            if (b.startsWith("gs://")) {
                b = b.substring(5);
            }
            while (b.endsWith("/")) {
                b = b.substring(0, b.length() - 1);
            }
            return b;
        }
    }

    @Data
    public static class Warehouse {
        private boolean enabled = true;
        /** Blank = the BigQuery client's default project. */
        private String  project = "";
        private String  dataset = "buildtrace_metrics";
        private String  table   = "job_results";
    }

    @Data
    public static class Predecessor {
        private String strategy = "decrement";
    }
}
