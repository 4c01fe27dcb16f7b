package com.aegis.aegis_intel_api.controller;

import com.aegis.aegis_intel_api.dto.analytics.DashboardSnapshot;
import com.aegis.aegis_intel_api.dto.response.ApiResponse;
import com.aegis.aegis_intel_api.repository.EventLog;
import com.aegis.aegis_intel_api.service.DashboardAnalyticsService;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Map;
import java.util.Optional;

@Slf4j
@Validated
@RequiredArgsConstructor
@RestController
@RequestMapping("/api")
public class DashboardController {

    static final String EXPORT_FILE_NAME = "aegis_detections.csv";

    private final DashboardAnalyticsService analyticsService;
    private final EventLog eventLog;
    private final Clock clock;

    @GetMapping("/dashboard-data")
    public ResponseEntity<ApiResponse<DashboardSnapshot>> dashboardData() {
        return ResponseEntity.ok(ApiResponse.success(analyticsService.compute()));
    }

    @GetMapping("/export-csv")
    public ResponseEntity<?> exportCsv() {
        Optional<byte[]> csv = eventLog.export();
        if (csv.isEmpty()) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ApiResponse.error("No log file found"));
        }
        return ResponseEntity.ok()
                .contentType(new MediaType("text", "csv"))
                .header(HttpHeaders.CONTENT_DISPOSITION,
                        ContentDisposition.attachment().filename(EXPORT_FILE_NAME).build().toString())
                .body(csv.get());
    }

    /**
     * Drops event log rows older than {@code keepDays} days.
     */
    @PostMapping("/admin/event-log/compact")
    public ResponseEntity<ApiResponse<Map<String, Object>>> compact(
            @RequestParam("keepDays") @Min(1) int keepDays) {
        LocalDateTime cutoff = LocalDateTime.now(clock).minusDays(keepDays);
        int removed = eventLog.purgeOlderThan(cutoff);
        log.info("Event log compacted: {} rows older than {} removed", removed, cutoff);
        return ResponseEntity.ok(ApiResponse.success(
                Map.of("removed", removed, "cutoff", cutoff.toString()), "Event log compacted"));
    }
}
