package com.di.buildtrace.report;

import com.di.buildtrace.diff.DiffEngine;
import com.di.buildtrace.diff.MovePair;
import com.di.buildtrace.predecessor.DecrementPredecessorResolver;
import com.di.buildtrace.predecessor.LatestStoredPredecessorResolver;
import com.di.buildtrace.predecessor.PredecessorResolver;
import com.di.buildtrace.snapshot.InMemorySnapshotStore;
import com.di.buildtrace.snapshot.Snapshot;
import com.di.buildtrace.snapshot.SnapshotNotFoundException;
import com.di.buildtrace.snapshot.SnapshotStore;
import com.di.buildtrace.snapshot.StoreUnavailableException;
import com.di.buildtrace.util.ReportMetricsCollector;
import com.di.buildtrace.warehouse.MetricsRecord;
import com.di.buildtrace.warehouse.WarehouseSink;
import com.di.buildtrace.warehouse.WarehouseStatus;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.OptionalLong;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@DisplayName("ChangeReportService Tests")
class ChangeReportServiceTest {

    private InMemorySnapshotStore store;
    private RecordingSink sink;
    private SimpleMeterRegistry registry;

    @BeforeEach
    void setUp() {
        store = new InMemorySnapshotStore();
        sink = new RecordingSink();
        registry = new SimpleMeterRegistry();
    }

    private ChangeReportService service(SnapshotStore snapshotStore, PredecessorResolver resolver, WarehouseSink warehouseSink) {
        return new ChangeReportService(snapshotStore, resolver, new DiffEngine(),
                new ReportBuilder(new ChangeDescriber(), Clock.systemUTC()),
                warehouseSink, new ReportMetricsCollector(registry));
    }

    private ChangeReportService service() {
        return service(store, new DecrementPredecessorResolver(), sink);
    }

    private void put(long jobId, Map<String, String> objects) {
        store.put(jobId, Snapshot.builder()
                .jobId(jobId)
                .timestamp("2024-05-0" + jobId + "T08:00:00Z")
                .latencyMs(100L * jobId)
                .objects(objects)
                .build());
    }

    @Test
    @DisplayName("Should diff against the previous job and insert one metrics row")
    void testReport() {
        put(1, Map.of("a", "h1", "b", "h2"));
        put(2, Map.of("a", "h1", "c", "h2"));

        Report report = service().report(2);

        assertEquals(2, report.getJobId());
        assertEquals(Long.valueOf(1L), report.getPreviousJobId());
        assertEquals(1, report.getTotalAdded());
        assertEquals(1, report.getTotalRemoved());
        assertEquals(0, report.getTotalModified());
        assertEquals(List.of(new MovePair("b", "c", "h2")), report.getMoved());
        assertEquals("attempted, succeeded", report.getMetricsStatus().getOutcome());

        assertEquals(1, sink.records.size());
        MetricsRecord row = sink.records.get(0);
        assertEquals(2, row.getJobId());
        assertEquals("2024-05-02T08:00:00Z", row.getTimestamp());
        assertEquals(200, row.getLatencyMs());
        assertEquals(1.0, registry.get("buildtrace.report.total").tag("status", "success").counter().count());
    }

    @Test
    @DisplayName("First job is compared against an empty baseline")
    void testFirstJob() {
        put(1, Map.of("a", "h1", "b", "h2"));

        Report report = service().report(1);

        assertNull(report.getPreviousJobId());
        assertEquals(2, report.getTotalAdded());
        assertEquals(List.of("a", "b"), report.getAdded());
    }

    @Test
    @DisplayName("Warehouse failure is reported in the status and does not block the report")
    void testWarehouseFailureDoesNotBlockReport() {
        put(1, Map.of("a", "h1"));
        put(2, Map.of("a", "h2"));
        WarehouseSink throwing = record -> {
            throw new IllegalStateException("warehouse down");
        };

        Report report = service(store, new DecrementPredecessorResolver(), throwing).report(2);

        assertEquals(1, report.getTotalModified());
        assertEquals(0, report.getTotalAdded());
        assertTrue(report.getMetricsStatus().isAttempted());
        assertFalse(report.getMetricsStatus().isSucceeded());
        assertEquals("attempted, failed", report.getMetricsStatus().getOutcome());
        assertTrue(report.getMetricsStatus().getDetail().contains("warehouse down"));
        assertEquals(1.0, registry.get("buildtrace.warehouse.insert.total").tag("outcome", "failed").counter().count());
    }

    @Test
    @DisplayName("Missing current snapshot is fatal")
    void testCurrentMissing() {
        SnapshotNotFoundException e = assertThrows(SnapshotNotFoundException.class, () -> service().report(7));
        assertEquals(7, e.getJobId());
        assertTrue(sink.records.isEmpty());
        assertEquals(1.0, registry.get("buildtrace.report.total").tag("status", "not_found").counter().count());
    }

    @Test
    @DisplayName("Missing predecessor snapshot is fatal, not an empty baseline")
    void testPreviousMissing() {
        put(3, Map.of("a", "h1"));

        SnapshotNotFoundException e = assertThrows(SnapshotNotFoundException.class, () -> service().report(3));
        assertEquals(2, e.getJobId());
        assertTrue(sink.records.isEmpty());
    }

    @Test
    @DisplayName("Latest-stored strategy skips gaps in job ids")
    void testLatestStoredPredecessor() {
        put(1, Map.of("a", "h1"));
        put(4, Map.of("a", "h1", "b", "h2"));

        Report report = service(store, new LatestStoredPredecessorResolver(store), sink).report(4);

        assertEquals(Long.valueOf(1L), report.getPreviousJobId());
        assertEquals(List.of("b"), report.getAdded());
    }

    @Test
    @DisplayName("Store outage propagates and is never treated as a missing snapshot")
    void testStoreUnavailable() {
        SnapshotStore broken = mock(SnapshotStore.class);
        when(broken.fetch(anyLong())).thenThrow(new StoreUnavailableException("gcs down", new RuntimeException()));

        assertThrows(StoreUnavailableException.class,
                () -> service(broken, new DecrementPredecessorResolver(), sink).report(2));
        assertTrue(sink.records.isEmpty());
        assertEquals(1.0, registry.get("buildtrace.report.total").tag("status", "store_unavailable").counter().count());
    }

    @Test
    @DisplayName("Should reject non-positive job ids")
    void testInvalidJobId() {
        assertThrows(IllegalArgumentException.class, () -> service().report(0));
        assertThrows(IllegalArgumentException.class, () -> service().report(-3));
    }

    @Test
    @DisplayName("Resolver returning empty uses an empty baseline even when lower jobs exist")
    void testResolverDecidesBaseline() {
        put(1, Map.of("a", "h1"));
        put(2, Map.of("a", "h1"));

        Report report = service(store, jobId -> OptionalLong.empty(), sink).report(2);

        assertNull(report.getPreviousJobId());
        assertEquals(1, report.getTotalAdded());
    }

    private static class RecordingSink implements WarehouseSink {
        final List<MetricsRecord> records = new ArrayList<>();

        @Override
        public WarehouseStatus insert(MetricsRecord record) {
            records.add(record);
            return WarehouseStatus.succeeded("recorded");
        }
    }
}
