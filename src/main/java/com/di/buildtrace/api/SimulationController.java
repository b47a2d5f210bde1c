package com.di.buildtrace.api;

import com.di.buildtrace.api.dto.SnapshotRequest;
import com.di.buildtrace.simulation.JobSimulator;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Returns a simulated {@code POST /process} payload. Nothing is stored.
 */
@RestController
@RequiredArgsConstructor
public class SimulationController {

    static final int MAX_JOBS = 1_000;
    static final int MAX_BASE_OBJECTS = 100_000;

    private final JobSimulator simulator;

    @PostMapping(value = "/simulate", produces = MediaType.APPLICATION_JSON_VALUE)
    public List<SnapshotRequest> simulate(
            @RequestParam(defaultValue = "5") int jobs,
            @RequestParam(defaultValue = "50") int baseObjects,
            @RequestParam(required = false) Long seed) {
        if (jobs > MAX_JOBS || baseObjects > MAX_BASE_OBJECTS) {
            throw new IllegalArgumentException(
                    "At most " + MAX_JOBS + " jobs and " + MAX_BASE_OBJECTS + " base objects per simulation");
        }
        return simulator.simulate(jobs, baseObjects, seed != null ? seed : System.nanoTime());
    }
}
