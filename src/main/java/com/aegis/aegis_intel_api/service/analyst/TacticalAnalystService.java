package com.aegis.aegis_intel_api.service.analyst;

import com.aegis.aegis_intel_api.config.AnalystProperties;
import com.aegis.aegis_intel_api.dto.analyst.ChatAnswer;
import com.aegis.aegis_intel_api.dto.analyst.ChatTurn;
import com.aegis.aegis_intel_api.dto.analyst.LlmResponse;
import com.aegis.aegis_intel_api.dto.analyst.ScanArtifact;
import com.aegis.aegis_intel_api.dto.analyst.SitrepResult;
import com.aegis.aegis_intel_api.exception.LlmException;
import com.aegis.aegis_intel_api.exception.ScanNotFoundException;
import com.aegis.aegis_intel_api.repository.ScanArtifactStore;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Turns detection context into SITREPs and answers operator follow-up questions about a scan.
 * LLM failures end in the fallbacks below; a missing scan is not a failure and propagates.
 */
@Slf4j
@Service
public class TacticalAnalystService {

    static final String NOT_CONFIGURED = "Tactical analyst not configured";

    private final LlmClient llmClient;
    private final ScanArtifactStore artifactStore;
    private final AnalystProperties properties;

    private final Counter fallbackCounter;

    public TacticalAnalystService(LlmClient llmClient,
                                  ScanArtifactStore artifactStore,
                                  AnalystProperties properties,
                                  MeterRegistry meterRegistry) {
        this.llmClient = llmClient;
        this.artifactStore = artifactStore;
        this.properties = properties;
        this.fallbackCounter = meterRegistry.counter("aegis.analyst.fallback");
    }

    public boolean isEnabled() {
        return properties.isEnabled();
    }

    public String describe() {
        return llmClient.provider() + "/" + llmClient.model();
    }

    @CircuitBreaker(name = "tactical-analyst", fallbackMethod = "sitrepFallback")
    public SitrepResult generateSitrep(String detectionContext) {
        if (!isEnabled()) {
            log.warn("SITREP skipped: {}", NOT_CONFIGURED);
            return SitrepResult.unavailable(NOT_CONFIGURED);
        }

        LlmResponse response = llmClient.generate(
                AnalystPrompts.SYSTEM_PROMPT,
                AnalystPrompts.sitrepRequest(detectionContext),
                List.of());
        log.info("SITREP generated by {} ({} tokens)", response.model(), response.tokensUsed());
        return SitrepResult.of(response);
    }

    @CircuitBreaker(name = "tactical-analyst", fallbackMethod = "chatFallback")
    public ChatAnswer chat(String scanId, String message) {
        if (!isEnabled()) {
            log.warn("Chat skipped: {}", NOT_CONFIGURED);
            return ChatAnswer.unavailable(NOT_CONFIGURED);
        }

        ScanArtifact artifact = artifactStore.get(scanId)
                .orElseThrow(() -> new ScanNotFoundException(scanId));

        String systemPrompt = AnalystPrompts.chatSystemPrompt(
                scanId, artifact.detectionContext(), artifact.sitrep());
        LlmResponse response = llmClient.generate(systemPrompt, message, artifact.chatHistory());

        artifactStore.appendChatTurns(scanId, List.of(
                ChatTurn.user(message),
                ChatTurn.assistant(response.text())));
        return ChatAnswer.of(response);
    }

    public SitrepResult sitrepFallback(String detectionContext, LlmException e) {
        log.warn("SITREP unavailable from {}: {}", e.getProvider(), e.getMessage());
        fallbackCounter.increment();
        return SitrepResult.unavailable(e.getMessage());
    }

    public SitrepResult sitrepFallback(String detectionContext, CallNotPermittedException e) {
        log.warn("SITREP skipped, analyst circuit open");
        fallbackCounter.increment();
        return SitrepResult.unavailable("Tactical analyst temporarily unavailable");
    }

    public ChatAnswer chatFallback(String scanId, String message, LlmException e) {
        log.warn("Chat on scan {} failed at {}: {}", scanId, e.getProvider(), e.getMessage());
        fallbackCounter.increment();
        return ChatAnswer.unavailable(e.getMessage());
    }

    public ChatAnswer chatFallback(String scanId, String message, CallNotPermittedException e) {
        log.warn("Chat on scan {} skipped, analyst circuit open", scanId);
        fallbackCounter.increment();
        return ChatAnswer.unavailable("Tactical analyst temporarily unavailable");
    }
}
