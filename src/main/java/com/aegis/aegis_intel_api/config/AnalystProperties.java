package com.aegis.aegis_intel_api.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;

import java.util.Locale;
import java.util.Set;

@Data
@Configuration
@ConfigurationProperties(prefix = "aegis.analyst")
public class AnalystProperties {

    public static final Set<String> SUPPORTED_PROVIDERS = Set.of("openrouter", "openai", "groq", "anthropic", "gemini");

    /**
     * openrouter, openai, groq, anthropic or gemini.
     */
    private String provider = "openrouter";
    private String apiKey;
    /**
     * Optional override; defaults to the provider's public endpoint.
     */
    private String baseUrl;
    private String model = "meta-llama/llama-3.2-3b-instruct:free";
    private int maxTokens = 2048;
    private double temperature = 0.7;

    /**
     * The analyst runs only with an API key for a supported provider.
     */
    public boolean isEnabled() {
        return StringUtils.hasText(apiKey) && isSupportedProvider();
    }

    public boolean isSupportedProvider() {
        return provider != null && SUPPORTED_PROVIDERS.contains(normalizedProvider());
    }

    public String normalizedProvider() {
        return provider == null ? "" : provider.trim().toLowerCase(Locale.ROOT);
    }

    public String resolveBaseUrl() {
        if (StringUtils.hasText(baseUrl)) {
            return baseUrl;
        }
        return switch (normalizedProvider()) {
            case "openai" -> "https://api.openai.com/v1";
            case "gemini" -> "https://generativelanguage.googleapis.com/v1beta";
            case "groq" -> "https://api.groq.com/openai/v1";
            case "anthropic" -> "https://api.anthropic.com/v1";
            default -> "https://openrouter.ai/api/v1";
        };
    }
}
