package com.aegis.aegis_intel_api.dto.analyst;

/**
 * Outcome of a SITREP request. An unsuccessful result carries the reason in {@code error}.
 */
public record SitrepResult(boolean success, String sitrep, String model, int tokens, String error) {

    public static SitrepResult of(LlmResponse response) {
        return new SitrepResult(true, response.text(), response.model(), response.tokensUsed(), "");
    }

    public static SitrepResult unavailable(String reason) {
        return new SitrepResult(false, "", "", 0, reason);
    }
}
