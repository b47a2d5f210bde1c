package com.di.buildtrace.snapshot;

import com.di.buildtrace.config.BuildTraceProperties;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.api.gax.paging.Page;
import com.google.cloud.storage.Blob;
import com.google.cloud.storage.BlobId;
import com.google.cloud.storage.BlobInfo;
import com.google.cloud.storage.Storage;
import com.google.cloud.storage.StorageException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.OptionalLong;

/**
 * {@link SnapshotStore} backed by Google Cloud Storage. One JSON document per job at
 * {@code gs://{bucket}/{prefix}/{jobId}.json} (see {@link SnapshotDocument}).
 *
 * <p>Active unless {@code buildtrace.store.type} is set to something other than {@code gcs}.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "buildtrace.store.type", havingValue = "gcs", matchIfMissing = true)
public class GcsSnapshotStore implements SnapshotStore {

    private static final String SUFFIX = ".json";

    private final Storage      storage;
    private final ObjectMapper objectMapper;
    private final String       bucket;
    private final String       prefix;

    public GcsSnapshotStore(Storage storage, BuildTraceProperties properties) {
        this.storage      = storage;
        this.objectMapper = new ObjectMapper()
                .enable(JsonParser.Feature.STRICT_DUPLICATE_DETECTION);
        this.bucket       = properties.getStore().bucketName();
        this.prefix       = properties.getStore().getPrefix();
        if (bucket.isEmpty()) {
            throw new IllegalStateException("buildtrace.store.bucket must be set when buildtrace.store.type=gcs");
        }
    }

    @Override
    public Snapshot fetch(long jobId) {
        String objectName = objectName(jobId);
        Blob blob;
        try {
            blob = storage.get(BlobId.of(bucket, objectName));
        } catch (StorageException e) {
            log.error("[STORE] failed to load gs://{}/{}: {}", bucket, objectName, e.getMessage());
            throw new StoreUnavailableException("Failed to load snapshot for job " + jobId, e);
        }
        if (blob == null) {
            throw new SnapshotNotFoundException(jobId);
        }
        Snapshot snapshot;
        try {
            byte[] bytes = blob.getContent();
            log.debug("[STORE] {} bytes from gs://{}/{}", bytes.length, bucket, objectName);
            snapshot = objectMapper.readValue(bytes, SnapshotDocument.class).toSnapshot();
        } catch (StorageException | IOException e) {
            throw new StoreUnavailableException("Failed to read snapshot document gs://" + bucket + "/" + objectName, e);
        } catch (IllegalArgumentException e) {
            // missing state map or null fingerprint in the stored document
            log.error("[STORE] corrupt snapshot document gs://{}/{}: {}", bucket, objectName, e.getMessage());
            throw new StoreUnavailableException("Corrupt snapshot document gs://" + bucket + "/" + objectName, e);
        }
        if (snapshot.getJobId() != jobId) {
            log.error("[STORE] gs://{}/{} holds job {}", bucket, objectName, snapshot.getJobId());
            throw new StoreUnavailableException("Snapshot document gs://" + bucket + "/" + objectName
                    + " holds job " + snapshot.getJobId() + ", expected " + jobId);
        }
        return snapshot;
    }

    @Override
    public void put(long jobId, Snapshot snapshot) {
        String objectName = objectName(jobId);
        try {
            byte[] json = objectMapper.writeValueAsBytes(SnapshotDocument.from(snapshot));
            BlobInfo blobInfo = BlobInfo.newBuilder(BlobId.of(bucket, objectName))
                    .setContentType("application/json")
                    .build();
            storage.create(blobInfo, json);
            log.info("[STORE] job {} saved ({} objects) → gs://{}/{}", jobId, snapshot.size(), bucket, objectName);
        } catch (StorageException | IOException e) {
            log.error("[STORE] upload failed for job {}: {}", jobId, e.getMessage());
            throw new StoreUnavailableException("Failed to save snapshot for job " + jobId, e);
        }
    }

    @Override
    public OptionalLong findLatestBefore(long jobId) {
        String listPrefix = prefix + "/";
        long best = Long.MIN_VALUE;
        try {
            Page<Blob> page = storage.list(bucket, Storage.BlobListOption.prefix(listPrefix));
            for (Blob blob : page.iterateAll()) {
                OptionalLong id = parseJobId(blob.getName(), listPrefix);
                if (id.isPresent() && id.getAsLong() < jobId && id.getAsLong() > best) {
                    best = id.getAsLong();
                }
            }
        } catch (StorageException e) {
            throw new StoreUnavailableException("Failed to list snapshots under gs://" + bucket + "/" + listPrefix, e);
        }
        return best == Long.MIN_VALUE ? OptionalLong.empty() : OptionalLong.of(best);
    }

    @Override
    public boolean isAvailable() {
        try {
            return storage.get(bucket) != null;
        } catch (StorageException e) {
            log.warn("[STORE] bucket {} unreachable: {}", bucket, e.getMessage());
            return false;
        }
    }

    @Override
    public String describe() {
        return "gcs:" + bucket + "/" + prefix;
    }

    String objectName(long jobId) {
        return prefix + "/" + jobId + SUFFIX;
    }

    /** {@code job_state/42.json} → 42; anything else (nested paths, non-numeric names) → empty. */
    static OptionalLong parseJobId(String objectName, String listPrefix) {
        if (objectName == null || !objectName.startsWith(listPrefix) || !objectName.endsWith(SUFFIX)) {
            return OptionalLong.empty();
        }
        String id = objectName.substring(listPrefix.length(), objectName.length() - SUFFIX.length());
        if (id.isEmpty() || !id.chars().allMatch(Character::isDigit)) {
            return OptionalLong.empty();
        }
        try {
            return OptionalLong.of(Long.parseLong(id));
        } catch (NumberFormatException e) {
            log.warn("[STORE] ignoring object with out-of-range job id: {}", objectName);
            return OptionalLong.empty();
        }
    }
}
