package com.aegis.aegis_intel_api.service.analyst;

import com.aegis.aegis_intel_api.dto.analyst.ChatTurn;
import com.aegis.aegis_intel_api.dto.analyst.LlmResponse;
import com.aegis.aegis_intel_api.exception.LlmException;

import java.util.List;

/**
 * Client bound when the configured provider is unknown. The analyst reports itself disabled and
 * any call fails with an {@link LlmException}.
 */
public class UnsupportedProviderLlmClient implements LlmClient {

    private final String provider;
    private final String model;

    public UnsupportedProviderLlmClient(String provider, String model) {
        this.provider = provider;
        this.model = model;
    }

    @Override
    public LlmResponse generate(String systemPrompt, String userMessage, List<ChatTurn> history) {
        throw new LlmException(provider, "Unsupported LLM provider: " + provider);
    }

    @Override
    public String provider() {
        return provider;
    }

    @Override
    public String model() {
        return model;
    }
}
