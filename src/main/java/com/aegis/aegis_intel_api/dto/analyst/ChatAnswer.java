package com.aegis.aegis_intel_api.dto.analyst;

public record ChatAnswer(boolean success, String answer, int tokens, String error) {

    public static ChatAnswer of(LlmResponse response) {
        return new ChatAnswer(true, response.text(), response.tokensUsed(), "");
    }

    public static ChatAnswer unavailable(String reason) {
        return new ChatAnswer(false, "", 0, reason);
    }
}
