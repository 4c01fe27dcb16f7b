package com.aegis.aegis_intel_api.dto.analyst;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Wire formats of the supported LLM providers.
 */
public class LlmDTOs {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Message(String role, String content) {}

    // OpenAI-compatible chat completions (OpenAI, Groq, OpenRouter)
    public record ChatRequest(
        String model,
        List<Message> messages,
        @JsonProperty("max_tokens") int maxTokens,
        double temperature
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ChatCompletionResponse(List<Choice> choices, Usage usage) {
        @JsonIgnoreProperties(ignoreUnknown = true)
        public record Choice(Message message) {}

        @JsonIgnoreProperties(ignoreUnknown = true)
        public record Usage(@JsonProperty("total_tokens") Integer totalTokens) {}
    }

    // Anthropic Messages API
    public record AnthropicRequest(
        String model,
        @JsonProperty("max_tokens") int maxTokens,
        String system,
        List<Message> messages,
        double temperature
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record AnthropicResponse(List<ContentBlock> content, Usage usage) {
        @JsonIgnoreProperties(ignoreUnknown = true)
        public record ContentBlock(String type, String text) {}

        @JsonIgnoreProperties(ignoreUnknown = true)
        public record Usage(
            @JsonProperty("input_tokens") Integer inputTokens,
            @JsonProperty("output_tokens") Integer outputTokens
        ) {}
    }

    // Gemini generateContent
    public record Part(String text) {}

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Content(String role, List<Part> parts) {}

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record GeminiRequest(
        Content systemInstruction,
        List<Content> contents,
        GenerationConfig generationConfig
    ) {
        public record GenerationConfig(int maxOutputTokens, double temperature) {}
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record GeminiResponse(List<Candidate> candidates, UsageMetadata usageMetadata) {
        @JsonIgnoreProperties(ignoreUnknown = true)
        public record Candidate(GeminiContent content, String finishReason) {}

        @JsonIgnoreProperties(ignoreUnknown = true)
        public record GeminiContent(String role, List<Part> parts) {}

        @JsonIgnoreProperties(ignoreUnknown = true)
        public record UsageMetadata(Integer totalTokenCount) {}
    }
}
