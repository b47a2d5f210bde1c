package com.di.buildtrace.api;

import com.di.buildtrace.report.ChangeReportService;
import com.di.buildtrace.report.Report;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;

/**
 * Synchronous change reporting.
 *
 * <table border="1">
 * <tr><th>Method</th><th>Path</th><th>Description</th></tr>
 * <tr><td>GET</td><td>/report/{jobId}</td>
 *     <td>Diff job {@code jobId} against its predecessor, log metrics to the warehouse,
 *     return the report (404 when either snapshot is missing)</td></tr>
 * </table>
 */
@Slf4j
@RestController
@RequiredArgsConstructor
public class ReportController {

    private final ChangeReportService reportService;

    @GetMapping(value = "/report/{jobId}", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<Report> getChangeReport(@PathVariable long jobId) {
        log.info("[CONTROLLER] GET /report/{}", jobId);
        return ResponseEntity.ok(reportService.report(jobId));
    }
}
