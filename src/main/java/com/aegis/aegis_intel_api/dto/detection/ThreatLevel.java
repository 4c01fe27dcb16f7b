package com.aegis.aegis_intel_api.dto.detection;

/**
 * Aggregate severity of one image, with its fixed presentation metadata.
 */
public enum ThreatLevel {
    CRITICAL("CRITICAL THREAT",
            "High-risk military target(s) detected. Immediate action required.",
            "#ff1744", "☢"),
    HIGH("HIGH ALERT",
            "Multiple concerning objects detected in the area.",
            "#ff6d00", "⚠"),
    ELEVATED("ELEVATED RISK",
            "Suspicious activity or equipment detected. Monitor closely.",
            "#ffd600", "🔶"),
    LOW("LOW RISK",
            "No immediate threats detected. Routine surveillance.",
            "#00e676", "✔"),
    CLEAR("ALL CLEAR",
            "No objects detected in image.",
            "#40c4ff", "✔");

    private final String label;
    private final String description;
    private final String color;
    private final String icon;

    ThreatLevel(String label, String description, String color, String icon) {
        this.label = label;
        this.description = description;
        this.color = color;
        this.icon = icon;
    }

    public String getLabel() {
        return label;
    }

    public String getDescription() {
        return description;
    }

    public String getColor() {
        return color;
    }

    public String getIcon() {
        return icon;
    }
}
