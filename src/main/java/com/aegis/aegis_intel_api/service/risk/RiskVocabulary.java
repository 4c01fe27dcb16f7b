package com.aegis.aegis_intel_api.service.risk;

import java.util.Set;

/**
 * High- and medium-risk class names of the active detection model. The two sets are disjoint.
 */
public record RiskVocabulary(String profile, Set<String> highRisk, Set<String> mediumRisk) {

    public RiskVocabulary {
        highRisk = Set.copyOf(highRisk);
        mediumRisk = Set.copyOf(mediumRisk);
        for (String name : highRisk) {
            if (mediumRisk.contains(name)) {
                throw new IllegalArgumentException("Class '" + name + "' is both high and medium risk");
            }
        }
    }
}
