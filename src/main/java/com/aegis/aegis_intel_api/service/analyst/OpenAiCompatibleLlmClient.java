package com.aegis.aegis_intel_api.service.analyst;

import com.aegis.aegis_intel_api.config.AnalystProperties;
import com.aegis.aegis_intel_api.dto.analyst.ChatTurn;
import com.aegis.aegis_intel_api.dto.analyst.LlmDTOs.ChatCompletionResponse;
import com.aegis.aegis_intel_api.dto.analyst.LlmDTOs.ChatRequest;
import com.aegis.aegis_intel_api.dto.analyst.LlmDTOs.Message;
import com.aegis.aegis_intel_api.dto.analyst.LlmResponse;
import com.aegis.aegis_intel_api.exception.LlmException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Chat completions client for OpenAI and the OpenAI-compatible providers (Groq, OpenRouter).
 */
@Slf4j
public class OpenAiCompatibleLlmClient implements LlmClient {

    private final RestTemplate restTemplate;
    private final AnalystProperties properties;
    private final ObjectMapper objectMapper;

    public OpenAiCompatibleLlmClient(RestTemplate restTemplate, AnalystProperties properties, ObjectMapper objectMapper) {
        this.restTemplate = restTemplate;
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    @Override
    public LlmResponse generate(String systemPrompt, String userMessage, List<ChatTurn> history) {
        List<Message> messages = new ArrayList<>();
        messages.add(new Message("system", systemPrompt));
        if (history != null) {
            history.forEach(turn -> messages.add(new Message(turn.role(), turn.content())));
        }
        messages.add(new Message("user", userMessage));

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setBearerAuth(properties.getApiKey());

        ChatRequest request = new ChatRequest(properties.getModel(), messages,
                properties.getMaxTokens(), properties.getTemperature());

        String url = properties.resolveBaseUrl() + "/chat/completions";
        ResponseEntity<String> resp;
        try {
            resp = restTemplate.exchange(url, HttpMethod.POST, new HttpEntity<>(request, headers), String.class);
        } catch (RestClientException e) {
            throw new LlmException(provider(), "Chat completion request failed: " + e.getMessage(), e);
        }

        String body = resp.getBody();
        if (!StringUtils.hasText(body)) {
            throw new LlmException(provider(), "Empty response body");
        }

        ChatCompletionResponse dto;
        try {
            dto = objectMapper.readValue(body, ChatCompletionResponse.class);
        } catch (IOException e) {
            throw new LlmException(provider(), "Unreadable chat completion response", e);
        }
        if (dto.choices() == null || dto.choices().isEmpty() || dto.choices().get(0).message() == null) {
            throw new LlmException(provider(), "No choices in chat completion response");
        }

        String content = dto.choices().get(0).message().content();
        if (!StringUtils.hasText(content)) {
            throw new LlmException(provider(), "Empty completion content");
        }

        int tokens = dto.usage() != null && dto.usage().totalTokens() != null ? dto.usage().totalTokens() : 0;
        log.debug("{} completion received ({} tokens)", provider(), tokens);
        return new LlmResponse(content.trim(), tokens, properties.getModel());
    }

    @Override
    public String provider() {
        return properties.getProvider();
    }

    @Override
    public String model() {
        return properties.getModel();
    }
}
