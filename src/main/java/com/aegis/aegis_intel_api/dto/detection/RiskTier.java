package com.aegis.aegis_intel_api.dto.detection;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Per-detection risk classification. Declaration order is the rendering priority.
 */
public enum RiskTier {
    HIGH("high"),
    MEDIUM("medium"),
    LOW("low");

    private final String code;

    RiskTier(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public int priority() {
        return ordinal();
    }

    public static RiskTier fromCode(String code) {
        for (RiskTier tier : values()) {
            if (tier.code.equalsIgnoreCase(code)) {
                return tier;
            }
        }
        throw new IllegalArgumentException("Unknown risk tier: " + code);
    }
}
