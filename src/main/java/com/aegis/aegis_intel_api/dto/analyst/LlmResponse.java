package com.aegis.aegis_intel_api.dto.analyst;

public record LlmResponse(String text, int tokensUsed, String model) {}
