package com.di.buildtrace.snapshot;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.OptionalLong;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * In-memory implementation of {@link SnapshotStore}. Suitable for local runs and tests.
 * Enabled with {@code buildtrace.store.type=memory}.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "buildtrace.store.type", havingValue = "memory")
public class InMemorySnapshotStore implements SnapshotStore {

    private final ConcurrentSkipListMap<Long, Snapshot> byJobId = new ConcurrentSkipListMap<>();

    @Override
    public Snapshot fetch(long jobId) {
        Snapshot snapshot = byJobId.get(jobId);
        if (snapshot == null) {
            throw new SnapshotNotFoundException(jobId);
        }
        return snapshot;
    }

    @Override
    public void put(long jobId, Snapshot snapshot) {
        byJobId.put(jobId, snapshot);
        log.info("[STORE] job {} saved in memory ({} objects)", jobId, snapshot.size());
    }

    @Override
    public OptionalLong findLatestBefore(long jobId) {
        Map.Entry<Long, Snapshot> lower = byJobId.lowerEntry(jobId);
        return lower == null ? OptionalLong.empty() : OptionalLong.of(lower.getKey());
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    @Override
    public String describe() {
        return "memory";
    }
}
