package com.aegis.aegis_intel_api.service.analyst;

import com.aegis.aegis_intel_api.config.AnalystProperties;
import com.aegis.aegis_intel_api.dto.analyst.ChatTurn;
import com.aegis.aegis_intel_api.dto.analyst.LlmDTOs.AnthropicRequest;
import com.aegis.aegis_intel_api.dto.analyst.LlmDTOs.AnthropicResponse;
import com.aegis.aegis_intel_api.dto.analyst.LlmDTOs.Message;
import com.aegis.aegis_intel_api.dto.analyst.LlmResponse;
import com.aegis.aegis_intel_api.exception.LlmException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.ArrayList;
import java.util.List;

/**
 * Anthropic Messages API client.
 */
@Slf4j
public class AnthropicLlmClient implements LlmClient {

    static final String API_VERSION = "2023-06-01";

    private final RestTemplate restTemplate;
    private final AnalystProperties properties;

    public AnthropicLlmClient(RestTemplate restTemplate, AnalystProperties properties) {
        this.restTemplate = restTemplate;
        this.properties = properties;
    }

    @Override
    public LlmResponse generate(String systemPrompt, String userMessage, List<ChatTurn> history) {
        List<Message> messages = new ArrayList<>();
        if (history != null) {
            history.forEach(turn -> messages.add(new Message(turn.role(), turn.content())));
        }
        messages.add(new Message("user", userMessage));

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.set("x-api-key", properties.getApiKey());
        headers.set("anthropic-version", API_VERSION);

        AnthropicRequest request = new AnthropicRequest(properties.getModel(), properties.getMaxTokens(),
                systemPrompt, messages, properties.getTemperature());

        AnthropicResponse response;
        try {
            response = restTemplate.postForObject(properties.resolveBaseUrl() + "/messages",
                    new HttpEntity<>(request, headers), AnthropicResponse.class);
        } catch (RestClientException e) {
            throw new LlmException(provider(), "Messages request failed: " + e.getMessage(), e);
        }

        if (response == null || response.content() == null || response.content().isEmpty()) {
            throw new LlmException(provider(), "No content in messages response");
        }
        String text = response.content().get(0).text();
        if (!StringUtils.hasText(text)) {
            throw new LlmException(provider(), "Empty message content");
        }

        int tokens = 0;
        if (response.usage() != null) {
            tokens += response.usage().inputTokens() != null ? response.usage().inputTokens() : 0;
            tokens += response.usage().outputTokens() != null ? response.usage().outputTokens() : 0;
        }
        return new LlmResponse(text.trim(), tokens, properties.getModel());
    }

    @Override
    public String provider() {
        return "anthropic";
    }

    @Override
    public String model() {
        return properties.getModel();
    }
}
