package com.di.buildtrace.api;

import com.di.buildtrace.snapshot.SnapshotStore;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Liveness probe for the service: healthy when the snapshot store answers.
 */
@RestController
@RequiredArgsConstructor
public class HealthController {

    static final String SERVICE_NAME = "BuildTrace-SyncReport-BQLog";

    private final SnapshotStore store;

    @GetMapping("/health")
    public ResponseEntity<Map<String, String>> health() {
        if (!store.isAvailable()) {
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(Map.of(
                    "status", "UNHEALTHY",
                    "service", SERVICE_NAME,
                    "store", store.describe(),
                    "detail", "Snapshot store unavailable"));
        }
        return ResponseEntity.ok(Map.of(
                "status", "SUCCESS",
                "service", SERVICE_NAME,
                "store", store.describe()));
    }
}
