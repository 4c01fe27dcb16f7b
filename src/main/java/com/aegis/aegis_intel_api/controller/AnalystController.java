package com.aegis.aegis_intel_api.controller;

import com.aegis.aegis_intel_api.dto.analyst.ChatAnswer;
import com.aegis.aegis_intel_api.dto.analyst.ScanArtifact;
import com.aegis.aegis_intel_api.dto.request.ChatRequest;
import com.aegis.aegis_intel_api.dto.response.ApiResponse;
import com.aegis.aegis_intel_api.exception.ScanNotFoundException;
import com.aegis.aegis_intel_api.repository.ScanArtifactStore;
import com.aegis.aegis_intel_api.service.analyst.TacticalAnalystService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * SITREP retrieval and follow-up chat on a stored scan.
 */
@RequiredArgsConstructor
@RestController
@RequestMapping("/api")
public class AnalystController {

    private final ScanArtifactStore artifactStore;
    private final TacticalAnalystService analyst;

    @GetMapping("/sitrep/{scanId}")
    public ResponseEntity<ApiResponse<ScanArtifact>> sitrep(@PathVariable String scanId) {
        ScanArtifact artifact = artifactStore.get(scanId)
                .orElseThrow(() -> new ScanNotFoundException(scanId));
        return ResponseEntity.ok(ApiResponse.success(artifact));
    }

    @PostMapping("/chat")
    public ResponseEntity<ApiResponse<ChatAnswer>> chat(@Valid @RequestBody ChatRequest request) {
        ChatAnswer answer = analyst.chat(request.scanId(), request.message());
        return ResponseEntity.ok(new ApiResponse<>(answer.success(), answer.success() ? null : answer.error(), answer));
    }
}
