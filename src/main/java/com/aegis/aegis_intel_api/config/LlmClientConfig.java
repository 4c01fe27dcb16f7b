package com.aegis.aegis_intel_api.config;

import com.aegis.aegis_intel_api.service.analyst.AnthropicLlmClient;
import com.aegis.aegis_intel_api.service.analyst.GeminiLlmClient;
import com.aegis.aegis_intel_api.service.analyst.LlmClient;
import com.aegis.aegis_intel_api.service.analyst.OpenAiCompatibleLlmClient;
import com.aegis.aegis_intel_api.service.analyst.UnsupportedProviderLlmClient;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

@Slf4j
@Configuration
public class LlmClientConfig {

    @Bean
    public LlmClient llmClient(@Qualifier("llmRestTemplate") RestTemplate restTemplate,
                               AnalystProperties properties,
                               ObjectMapper objectMapper) {
        String provider = properties.normalizedProvider();
        LlmClient client = switch (provider) {
            case "anthropic" -> new AnthropicLlmClient(restTemplate, properties);
            case "gemini" -> new GeminiLlmClient(restTemplate, properties);
            case "openai", "groq", "openrouter" -> new OpenAiCompatibleLlmClient(restTemplate, properties, objectMapper);
            default -> {
                log.warn("Unsupported LLM provider '{}', tactical analyst disabled. Supported: {}",
                        properties.getProvider(), AnalystProperties.SUPPORTED_PROVIDERS);
                yield new UnsupportedProviderLlmClient(provider, properties.getModel());
            }
        };
        log.info("LLM client initialized: {} / {} (analyst {})", provider, properties.getModel(),
                properties.isEnabled() ? "enabled" : "disabled");
        return client;
    }
}
