package com.aegis.aegis_intel_api.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "aegis.storage")
public class StorageProperties {

    private String eventLogPath = "logs/detections.csv";
    private String scanArtifactPath = "logs/sitreps.json";

    /**
     * Number of scan artifacts kept by the retention job.
     */
    private int scanArtifactRetention = 100;
    private String retentionCron = "0 0 3 * * ?";
}
