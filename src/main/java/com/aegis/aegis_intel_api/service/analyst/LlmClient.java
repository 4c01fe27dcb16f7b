package com.aegis.aegis_intel_api.service.analyst;

import com.aegis.aegis_intel_api.dto.analyst.ChatTurn;
import com.aegis.aegis_intel_api.dto.analyst.LlmResponse;
import com.aegis.aegis_intel_api.exception.LlmException;

import java.util.List;

/**
 * Chat-style text generation backed by an external LLM provider.
 */
public interface LlmClient {

    LlmResponse generate(String systemPrompt, String userMessage, List<ChatTurn> history) throws LlmException;

    String provider();

    String model();
}
