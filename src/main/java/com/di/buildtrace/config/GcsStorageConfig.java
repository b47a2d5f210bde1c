package com.di.buildtrace.config;

import com.google.cloud.storage.Storage;
import com.google.cloud.storage.StorageOptions;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Registers a Google Cloud Storage client bean backed by
 * Application Default Credentials (ADC).
 *
 * <p>Used by {@link com.di.buildtrace.snapshot.GcsSnapshotStore}; not created when
 * snapshots are kept in memory.</p>
 */
@Configuration
public class GcsStorageConfig {

    @Bean
    @ConditionalOnMissingBean(Storage.class)
    @ConditionalOnProperty(name = "buildtrace.store.type", havingValue = "gcs", matchIfMissing = true)
    public Storage gcsStorage() {
        return StorageOptions.getDefaultInstance().getService();
    }
}
