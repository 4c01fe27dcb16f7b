package com.aegis.aegis_intel_api.service.analyst;

import com.aegis.aegis_intel_api.config.AnalystProperties;
import com.aegis.aegis_intel_api.dto.analyst.ChatTurn;
import com.aegis.aegis_intel_api.dto.analyst.LlmDTOs.Content;
import com.aegis.aegis_intel_api.dto.analyst.LlmDTOs.GeminiRequest;
import com.aegis.aegis_intel_api.dto.analyst.LlmDTOs.GeminiResponse;
import com.aegis.aegis_intel_api.dto.analyst.LlmDTOs.Part;
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
 * Google Gemini generateContent client.
 */
@Slf4j
public class GeminiLlmClient implements LlmClient {

    private final RestTemplate restTemplate;
    private final AnalystProperties properties;

    public GeminiLlmClient(RestTemplate restTemplate, AnalystProperties properties) {
        this.restTemplate = restTemplate;
        this.properties = properties;
    }

    @Override
    public LlmResponse generate(String systemPrompt, String userMessage, List<ChatTurn> history) {
        List<Content> contents = new ArrayList<>();
        if (history != null) {
            history.forEach(turn -> contents.add(content(roleOf(turn.role()), turn.content())));
        }
        contents.add(content("user", userMessage));

        GeminiRequest request = new GeminiRequest(
                content(null, systemPrompt),
                contents,
                new GeminiRequest.GenerationConfig(properties.getMaxTokens(), properties.getTemperature()));

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.set("x-goog-api-key", properties.getApiKey());

        String url = properties.resolveBaseUrl() + "/models/" + properties.getModel() + ":generateContent";
        GeminiResponse response;
        try {
            response = restTemplate.postForObject(url, new HttpEntity<>(request, headers), GeminiResponse.class);
        } catch (RestClientException e) {
            throw new LlmException(provider(), "generateContent request failed: " + e.getMessage(), e);
        }

        String text = textOf(response);
        if (!StringUtils.hasText(text)) {
            throw new LlmException(provider(), "No candidates in generateContent response");
        }

        int tokens;
        if (response.usageMetadata() != null && response.usageMetadata().totalTokenCount() != null) {
            tokens = response.usageMetadata().totalTokenCount();
        } else {
            log.debug("No usage metadata from {}, estimating tokens from word counts", properties.getModel());
            tokens = wordCount(systemPrompt) + wordCount(userMessage) + wordCount(text);
        }
        return new LlmResponse(text.trim(), tokens, properties.getModel());
    }

    @Override
    public String provider() {
        return "gemini";
    }

    @Override
    public String model() {
        return properties.getModel();
    }

    private static Content content(String role, String text) {
        return new Content(role, List.of(new Part(text)));
    }

    static String roleOf(String chatRole) {
        return ChatTurn.ASSISTANT.equals(chatRole) ? "model" : "user";
    }

    private static String textOf(GeminiResponse response) {
        if (response == null || response.candidates() == null || response.candidates().isEmpty()) {
            return null;
        }
        GeminiResponse.GeminiContent content = response.candidates().get(0).content();
        if (content == null || content.parts() == null) {
            return null;
        }
        StringBuilder text = new StringBuilder();
        content.parts().forEach(part -> {
            if (part.text() != null) {
                text.append(part.text());
            }
        });
        return text.toString();
    }

    private static int wordCount(String text) {
        return StringUtils.hasText(text) ? text.trim().split("\\s+").length : 0;
    }
}
