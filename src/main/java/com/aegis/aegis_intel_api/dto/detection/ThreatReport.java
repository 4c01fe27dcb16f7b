package com.aegis.aegis_intel_api.dto.detection;

import java.util.List;

/**
 * Verdict for one image. Presentation fields always mirror {@link ThreatLevel}.
 */
public record ThreatReport(
        ThreatLevel threatLevel,
        String label,
        String description,
        String color,
        String icon,
        List<String> highRiskHits,
        DetectionStats stats
) {

    public static ThreatReport of(ThreatLevel level, List<String> highRiskHits, DetectionStats stats) {
        return new ThreatReport(level, level.getLabel(), level.getDescription(), level.getColor(),
                level.getIcon(), List.copyOf(highRiskHits), stats);
    }
}
