package com.aegis.aegis_intel_api.controller;

import com.aegis.aegis_intel_api.dto.log.EventLogRow;
import com.aegis.aegis_intel_api.dto.response.ApiResponse;
import com.aegis.aegis_intel_api.dto.response.ScanResponse;
import com.aegis.aegis_intel_api.repository.EventLog;
import com.aegis.aegis_intel_api.service.DetectionPipelineService;
import com.aegis.aegis_intel_api.service.analyst.TacticalAnalystService;
import com.aegis.aegis_intel_api.service.detection.Detector;
import com.aegis.aegis_intel_api.service.risk.RiskClassifier;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Image scan endpoints.
 *
 * - POST /detect  multipart "image", optional latitude / longitude
 * - GET  /logs    most recent event log rows, oldest first
 * - GET  /health  readiness check
 */
@Validated
@RequiredArgsConstructor
@RestController
public class DetectionController {

    private final DetectionPipelineService pipelineService;
    private final EventLog eventLog;
    private final Detector detector;
    private final RiskClassifier riskClassifier;
    private final TacticalAnalystService analyst;

    @PostMapping("/detect")
    public ResponseEntity<ApiResponse<ScanResponse>> detect(
            @RequestParam("image") MultipartFile image,
            @RequestParam(value = "latitude", required = false) Double latitude,
            @RequestParam(value = "longitude", required = false) Double longitude) throws IOException {
        ScanResponse response = pipelineService.scan(image, latitude, longitude);
        return ResponseEntity.ok(ApiResponse.success(response));
    }

    @GetMapping("/logs")
    public ResponseEntity<ApiResponse<List<EventLogRow>>> logs(
            @RequestParam(value = "limit", defaultValue = "50") @Min(1) @Max(1000) int limit) {
        return ResponseEntity.ok(ApiResponse.success(eventLog.readRecent(limit)));
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "ok");
        body.put("detector", detector.describe());
        body.put("riskProfile", riskClassifier.getVocabulary().profile());
        body.put("analystEnabled", analyst.isEnabled());
        body.put("analyst", analyst.isEnabled() ? analyst.describe() : "disabled");
        return ResponseEntity.ok(body);
    }
}
