package com.aegis.aegis_intel_api.config;

import com.aegis.aegis_intel_api.service.risk.RiskProfile;
import com.aegis.aegis_intel_api.service.risk.RiskVocabulary;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

@Slf4j
@Configuration
public class DetectionConfig {

    /**
     * Risk vocabulary, resolved once from the configured model type.
     */
    @Bean
    public RiskVocabulary riskVocabulary(DetectionProperties properties) {
        RiskProfile profile = RiskProfile.fromModelType(properties.getModelType());
        log.info("Risk vocabulary '{}' selected for model type '{}'", profile, properties.getModelType());
        return profile.vocabulary();
    }

    @Bean
    public Clock clock(@Value("${aegis.clock.zone:UTC}") String zone) {
        return Clock.system(ZoneId.of(zone));
    }
}
