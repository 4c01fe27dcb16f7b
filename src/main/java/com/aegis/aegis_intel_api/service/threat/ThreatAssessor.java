package com.aegis.aegis_intel_api.service.threat;

import com.aegis.aegis_intel_api.dto.detection.Detection;
import com.aegis.aegis_intel_api.dto.detection.DetectionStats;
import com.aegis.aegis_intel_api.dto.detection.RiskTier;
import com.aegis.aegis_intel_api.dto.detection.ThreatLevel;
import com.aegis.aegis_intel_api.dto.detection.ThreatReport;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Aggregates the detections of one image into a {@link ThreatReport}. Stateless.
 */
@Component
public class ThreatAssessor {

    static final int CRITICAL_HIGH_RISK_COUNT = 2;
    static final int ELEVATED_MEDIUM_RISK_COUNT = 2;

    public ThreatReport assess(List<Detection> detections) {
        if (detections == null || detections.isEmpty()) {
            return ThreatReport.of(ThreatLevel.CLEAR, List.of(), DetectionStats.empty());
        }

        List<String> highRiskHits = detections.stream()
                .filter(d -> d.riskLevel() == RiskTier.HIGH)
                .map(Detection::className)
                .toList();
        long mediumCount = detections.stream()
                .filter(d -> d.riskLevel() == RiskTier.MEDIUM)
                .count();

        return ThreatReport.of(resolveLevel(detections.size(), highRiskHits.size(), mediumCount),
                highRiskHits, computeStats(detections));
    }

    static ThreatLevel resolveLevel(int total, long highCount, long mediumCount) {
        if (total == 0) {
            return ThreatLevel.CLEAR;
        }
        if (highCount >= CRITICAL_HIGH_RISK_COUNT) {
            return ThreatLevel.CRITICAL;
        }
        if (highCount == 1) {
            return ThreatLevel.HIGH;
        }
        if (mediumCount >= ELEVATED_MEDIUM_RISK_COUNT) {
            return ThreatLevel.ELEVATED;
        }
        return ThreatLevel.LOW;
    }

    private DetectionStats computeStats(List<Detection> detections) {
        Map<String, Integer> classCounts = new LinkedHashMap<>();
        int high = 0;
        int medium = 0;
        int low = 0;
        BigDecimal sum = BigDecimal.ZERO;
        double max = 0.0;

        for (Detection d : detections) {
            classCounts.merge(d.className(), 1, Integer::sum);
            switch (d.riskLevel()) {
                case HIGH -> high++;
                case MEDIUM -> medium++;
                default -> low++;
            }
            sum = sum.add(BigDecimal.valueOf(d.confidence()));
            max = Math.max(max, d.confidence());
        }

        double avg = sum.divide(BigDecimal.valueOf(detections.size()), 4, RoundingMode.HALF_EVEN).doubleValue();
        double roundedMax = BigDecimal.valueOf(max).setScale(4, RoundingMode.HALF_EVEN).doubleValue();

        return new DetectionStats(detections.size(), high, medium, low, avg, roundedMax,
                Collections.unmodifiableMap(classCounts));
    }
}
