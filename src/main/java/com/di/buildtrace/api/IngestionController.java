package com.di.buildtrace.api;

import com.di.buildtrace.api.dto.IngestionResponse;
import com.di.buildtrace.api.dto.SnapshotRequest;
import com.di.buildtrace.snapshot.SnapshotIngestionService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Receives job snapshots and stores them for later reporting. Nothing is diffed here.
 */
@Slf4j
@Validated
@RestController
@RequiredArgsConstructor
public class IngestionController {

    private final SnapshotIngestionService ingestionService;

    @PostMapping(value = "/process", consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<IngestionResponse> processJobs(@RequestBody List<@Valid SnapshotRequest> jobs) {
        log.info("[CONTROLLER] POST /process with {} job(s)", jobs == null ? 0 : jobs.size());
        List<Long> stored = ingestionService.ingest(jobs);
        return ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(new IngestionResponse("Jobs accepted and state stored. Ready for reporting.", stored));
    }
}
