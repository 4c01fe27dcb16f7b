package com.aegis.aegis_intel_api.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

/**
 * Outbound HTTP clients for the detector, the LLM provider and the geocoder.
 * Each bean gets its own timeout pair so a slow collaborator cannot stall the others.
 */
@Configuration
public class HttpClientConfig {

    @Value("${http.client.detector.connect-timeout-ms:2000}")
    private Integer detectorConnectTimeout;

    @Value("${http.client.detector.read-timeout-ms:30000}")
    private Integer detectorReadTimeout;

    @Value("${http.client.llm.connect-timeout-ms:5000}")
    private Integer llmConnectTimeout;

    @Value("${http.client.llm.read-timeout-ms:60000}")
    private Integer llmReadTimeout;

    @Value("${http.client.geocoding.connect-timeout-ms:2000}")
    private Integer geocodingConnectTimeout;

    @Value("${http.client.geocoding.read-timeout-ms:5000}")
    private Integer geocodingReadTimeout;

    /**
     * RestTemplate for the inference server.
     * Inference on large images can take a while on CPU.
     */
    @Bean(name = "detectorRestTemplate")
    public RestTemplate detectorRestTemplate() {
        return withTimeouts(detectorConnectTimeout, detectorReadTimeout);
    }

    /**
     * RestTemplate for the LLM provider (SITREP and analyst chat).
     */
    @Bean(name = "llmRestTemplate")
    public RestTemplate llmRestTemplate() {
        return withTimeouts(llmConnectTimeout, llmReadTimeout);
    }

    /**
     * RestTemplate for reverse geocoding, short timeouts since a fallback always exists.
     */
    @Bean(name = "geocodingRestTemplate")
    public RestTemplate geocodingRestTemplate() {
        return withTimeouts(geocodingConnectTimeout, geocodingReadTimeout);
    }

    private static RestTemplate withTimeouts(int connectMillis, int readMillis) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(Duration.ofMillis(connectMillis));
        requestFactory.setReadTimeout(Duration.ofMillis(readMillis));
        return new RestTemplate(requestFactory);
    }
}
