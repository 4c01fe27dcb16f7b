package com.aegis.aegis_intel_api.service.analyst;

import com.aegis.aegis_intel_api.dto.analyst.SitrepResult;
import com.github.tomakehurst.wiremock.WireMockServer;
import com.github.tomakehurst.wiremock.core.WireMockConfiguration;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.request.MockMvcRequestBuilders;

import java.nio.file.Path;

import static com.github.tomakehurst.wiremock.client.WireMock.aResponse;
import static com.github.tomakehurst.wiremock.client.WireMock.post;
import static com.github.tomakehurst.wiremock.client.WireMock.postRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.urlEqualTo;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@TestPropertySource(properties = {
        // fail fast against WireMock
        "http.client.llm.connect-timeout-ms=200",
        "http.client.llm.read-timeout-ms=1000",
        // Small count-based window so the breaker opens within one test
        "resilience4j.circuitbreaker.instances.tactical-analyst.sliding-window-type=COUNT_BASED",
        "resilience4j.circuitbreaker.instances.tactical-analyst.sliding-window-size=4",
        "resilience4j.circuitbreaker.instances.tactical-analyst.minimum-number-of-calls=4",
        "resilience4j.circuitbreaker.instances.tactical-analyst.failure-rate-threshold=50",
        "resilience4j.circuitbreaker.instances.tactical-analyst.wait-duration-in-open-state=30s"
})
class TacticalAnalystServiceIntegrationTest {

    private static final String COMPLETIONS = "/v1/chat/completions";

    private static WireMockServer wireMockServer;

    @TempDir
    static Path dataDir;

    @Autowired
    private TacticalAnalystService analystService;

    @Autowired
    private CircuitBreakerRegistry circuitBreakerRegistry;

    @Autowired
    private MeterRegistry meterRegistry;

    @Autowired
    private MockMvc mockMvc;

    @BeforeAll
    static void startWireMock() {
        wireMockServer = new WireMockServer(WireMockConfiguration.options().dynamicPort());
        wireMockServer.start();
    }

    @AfterAll
    static void stopWireMock() {
        if (wireMockServer != null) {
            wireMockServer.stop();
        }
    }

    @DynamicPropertySource
    static void registerProperties(DynamicPropertyRegistry registry) {
        registry.add("aegis.analyst.provider", () -> "openai");
        registry.add("aegis.analyst.api-key", () -> "test-key");
        registry.add("aegis.analyst.base-url", () -> wireMockServer.baseUrl() + "/v1");
        registry.add("aegis.detection.upload-dir", () -> dataDir.resolve("uploads").toString());
        registry.add("aegis.storage.event-log-path", () -> dataDir.resolve("detections.csv").toString());
        registry.add("aegis.storage.scan-artifact-path", () -> dataDir.resolve("sitreps.json").toString());
    }

    @BeforeEach
    void resetServers() {
        wireMockServer.resetAll();
        circuitBreaker().reset();
    }

    private CircuitBreaker circuitBreaker() {
        return circuitBreakerRegistry.circuitBreaker("tactical-analyst");
    }

    private double fallbackCount() {
        return meterRegistry.counter("aegis.analyst.fallback").count();
    }

    @Test
    void generateSitrep_ReturnsCompletionThroughProxy() {
        wireMockServer.stubFor(post(urlEqualTo(COMPLETIONS))
                .willReturn(aResponse()
                        .withStatus(200)
                        .withHeader("Content-Type", "application/json")
                        .withBody("""
                                {"choices":[{"message":{"role":"assistant","content":"SITREP: area clear."}}],
                                 "usage":{"total_tokens":64}}
                                """)));

        SitrepResult result = analystService.generateSitrep("IMAGE SCAN ANALYSIS");

        assertTrue(result.success());
        assertEquals("SITREP: area clear.", result.sitrep());
        assertEquals(1, circuitBreaker().getMetrics().getNumberOfSuccessfulCalls());
    }

    @Test
    void generateSitrep_ServerErrorGoesToFallback() {
        wireMockServer.stubFor(post(urlEqualTo(COMPLETIONS)).willReturn(aResponse().withStatus(500)));
        double before = fallbackCount();

        SitrepResult result = analystService.generateSitrep("IMAGE SCAN ANALYSIS");

        assertFalse(result.success());
        assertThat(result.error()).startsWith("Chat completion request failed");
        assertEquals(1, circuitBreaker().getMetrics().getNumberOfFailedCalls());
        assertEquals(before + 1, fallbackCount());
    }

    @Test
    void generateSitrep_OpensCircuitAndShortCircuitsSubsequentCalls() {
        wireMockServer.stubFor(post(urlEqualTo(COMPLETIONS)).willReturn(aResponse().withStatus(503)));

        for (int i = 0; i < 4; i++) {
            assertFalse(analystService.generateSitrep("context-" + i).success());
        }
        assertEquals(CircuitBreaker.State.OPEN, circuitBreaker().getState());

        wireMockServer.resetRequests();

        SitrepResult result = analystService.generateSitrep("context-open");

        assertFalse(result.success());
        assertEquals("Tactical analyst temporarily unavailable", result.error());
        wireMockServer.verify(0, postRequestedFor(urlEqualTo(COMPLETIONS)));
    }

    @Test
    void chat_UnknownScanIs404AndNotCountedAsFailure() throws Exception {
        for (int i = 0; i < 5; i++) {
            mockMvc.perform(MockMvcRequestBuilders.post("/api/chat")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"scanId\":\"deadbeef\",\"message\":\"status?\"}"))
                    .andExpect(status().isNotFound())
                    .andExpect(jsonPath("$.message").value("Scan not found: deadbeef"));
        }

        CircuitBreaker.Metrics metrics = circuitBreaker().getMetrics();
        assertEquals(CircuitBreaker.State.CLOSED, circuitBreaker().getState());
        assertEquals(0, metrics.getNumberOfFailedCalls());
        assertEquals(0, metrics.getNumberOfBufferedCalls());
        wireMockServer.verify(0, postRequestedFor(urlEqualTo(COMPLETIONS)));
    }
}
