package com.aegis.aegis_intel_api.dto.detection;

import java.util.Map;

public record DetectionStats(
        int total,
        int highRisk,
        int mediumRisk,
        int lowRisk,
        double avgConfidence,
        double maxConfidence,
        Map<String, Integer> classCounts
) {

    public static DetectionStats empty() {
        return new DetectionStats(0, 0, 0, 0, 0.0, 0.0, Map.of());
    }
}
