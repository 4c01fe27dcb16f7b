package com.aegis.aegis_intel_api.service.risk;

import com.aegis.aegis_intel_api.dto.detection.RiskTier;
import org.springframework.stereotype.Component;

import java.util.Locale;

@Component
public class RiskClassifier {

    private final RiskVocabulary vocabulary;

    public RiskClassifier(RiskVocabulary vocabulary) {
        this.vocabulary = vocabulary;
    }

    public RiskTier classify(String className) {
        return classify(className, vocabulary);
    }

    public static RiskTier classify(String className, RiskVocabulary vocabulary) {
        if (className == null) {
            return RiskTier.LOW;
        }
        String key = className.toLowerCase(Locale.ROOT).replace(" ", "_");
        if (vocabulary.highRisk().contains(key)) {
            return RiskTier.HIGH;
        }
        if (vocabulary.mediumRisk().contains(key)) {
            return RiskTier.MEDIUM;
        }
        return RiskTier.LOW;
    }

    public RiskVocabulary getVocabulary() {
        return vocabulary;
    }
}
