package com.aegis.aegis_intel_api.dto.log;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.LocalDateTime;

/**
 * One persisted event log record: a single detection, or the sentinel row of an image
 * where nothing was found.
 */
public record EventLogRow(
        @JsonFormat(pattern = "yyyy-MM-dd HH:mm:ss") LocalDateTime timestamp,
        String imageFilename,
        String threatLevel,
        int totalDetections,
        int highRiskCount,
        String className,
        double confidence,
        String riskLevel,
        int boxX1,
        int boxY1,
        int boxX2,
        int boxY2,
        double inferenceMs
) {

    public static final String SENTINEL_CLASS = "NONE";
    public static final String SENTINEL_RISK = "none";

    public static EventLogRow sentinel(LocalDateTime timestamp, String imageFilename, String threatLevel,
                                       double inferenceMs) {
        return new EventLogRow(timestamp, imageFilename, threatLevel, 0, 0,
                SENTINEL_CLASS, 0.0, SENTINEL_RISK, 0, 0, 0, 0, inferenceMs);
    }

    @JsonIgnore
    public boolean isSentinel() {
        return SENTINEL_CLASS.equals(className);
    }
}
