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
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TacticalAnalystServiceTest {

    @Mock
    private LlmClient llmClient;

    @Mock
    private ScanArtifactStore artifactStore;

    private AnalystProperties properties;
    private MeterRegistry meterRegistry;
    private TacticalAnalystService service;

    @BeforeEach
    void setUp() {
        properties = new AnalystProperties();
        properties.setApiKey("test-key");
        meterRegistry = new SimpleMeterRegistry();
        service = new TacticalAnalystService(llmClient, artifactStore, properties, meterRegistry);
    }

    private static ScanArtifact artifact(List<ChatTurn> history) {
        return new ScanArtifact(LocalDateTime.of(2026, 3, 14, 9, 0), "IMAGE SCAN ANALYSIS",
                "SITREP: two tanks.", "test-model", 100, history);
    }

    @Test
    void generateSitrep_Success() {
        when(llmClient.generate(eq(AnalystPrompts.SYSTEM_PROMPT), anyString(), anyList()))
                .thenReturn(new LlmResponse("SITREP: two tanks.", 150, "test-model"));

        SitrepResult result = service.generateSitrep("IMAGE SCAN ANALYSIS");

        assertTrue(result.success());
        assertEquals("SITREP: two tanks.", result.sitrep());
        assertEquals("test-model", result.model());
        assertEquals(150, result.tokens());
        ArgumentCaptor<String> userMessage = ArgumentCaptor.forClass(String.class);
        verify(llmClient).generate(anyString(), userMessage.capture(), anyList());
        assertThat(userMessage.getValue()).endsWith("IMAGE SCAN ANALYSIS");
    }

    @Test
    void generateSitrep_DisabledAnalystReturnsUnavailable() {
        properties.setApiKey("");

        SitrepResult result = service.generateSitrep("ctx");

        assertFalse(result.success());
        assertEquals(TacticalAnalystService.NOT_CONFIGURED, result.error());
        verifyNoInteractions(llmClient);
    }

    @Test
    void sitrepFallback_ReturnsUnavailableAndCounts() {
        SitrepResult result = service.sitrepFallback("ctx", new LlmException("openrouter", "HTTP 429"));

        assertFalse(result.success());
        assertEquals("HTTP 429", result.error());
        assertEquals(1.0, meterRegistry.counter("aegis.analyst.fallback").count());
    }

    @Test
    void chat_SendsContextAndHistoryThenRecordsBothTurns() {
        List<ChatTurn> history = List.of(ChatTurn.user("How many?"), ChatTurn.assistant("Two."));
        when(artifactStore.get("a1b2c3d4")).thenReturn(Optional.of(artifact(history)));
        when(llmClient.generate(anyString(), eq("Where are they?"), eq(history)))
                .thenReturn(new LlmResponse("Top-left of frame.", 80, "test-model"));

        ChatAnswer answer = service.chat("a1b2c3d4", "Where are they?");

        assertTrue(answer.success());
        assertEquals("Top-left of frame.", answer.answer());
        assertEquals(80, answer.tokens());

        ArgumentCaptor<String> systemPrompt = ArgumentCaptor.forClass(String.class);
        verify(llmClient).generate(systemPrompt.capture(), eq("Where are they?"), eq(history));
        assertThat(systemPrompt.getValue())
                .contains("Scan ID: a1b2c3d4", "IMAGE SCAN ANALYSIS", "SITREP: two tanks.");
        verify(artifactStore).appendChatTurns("a1b2c3d4", List.of(
                ChatTurn.user("Where are they?"), ChatTurn.assistant("Top-left of frame.")));
    }

    @Test
    void chat_UnknownScanThrows() {
        when(artifactStore.get("deadbeef")).thenReturn(Optional.empty());

        assertThrows(ScanNotFoundException.class, () -> service.chat("deadbeef", "hello"));
        verifyNoInteractions(llmClient);
    }

    @Test
    void chat_LlmFailurePropagatesWithoutRecordingTurns() {
        when(artifactStore.get("a1b2c3d4")).thenReturn(Optional.of(artifact(List.of())));
        when(llmClient.generate(anyString(), anyString(), anyList()))
                .thenThrow(new LlmException("openrouter", "timeout"));

        assertThrows(LlmException.class, () -> service.chat("a1b2c3d4", "hello"));
        verify(artifactStore, never()).appendChatTurns(anyString(), any());
    }

    @Test
    void chatFallback_ReturnsUnavailableAndCounts() {
        ChatAnswer answer = service.chatFallback("a1b2c3d4", "hello", new LlmException("groq", "HTTP 500"));

        assertFalse(answer.success());
        assertEquals("HTTP 500", answer.error());
        assertEquals(1.0, meterRegistry.counter("aegis.analyst.fallback").count());
    }

    @Test
    void chat_DisabledAnalystReturnsUnavailable() {
        properties.setApiKey(null);

        ChatAnswer answer = service.chat("a1b2c3d4", "hello");

        assertFalse(answer.success());
        verifyNoInteractions(llmClient, artifactStore);
    }
}
