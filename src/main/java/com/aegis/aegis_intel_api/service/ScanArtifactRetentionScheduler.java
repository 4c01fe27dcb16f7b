package com.aegis.aegis_intel_api.service;

import com.aegis.aegis_intel_api.config.StorageProperties;
import com.aegis.aegis_intel_api.repository.ScanArtifactStore;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class ScanArtifactRetentionScheduler {

    private static final Logger log = LoggerFactory.getLogger(ScanArtifactRetentionScheduler.class);

    private final ScanArtifactStore artifactStore;
    private final StorageProperties storageProperties;

    /**
     * Evicts all but the most recent scan artifacts. Nightly at 03:00 by default
     * (configurable via aegis.storage.retention-cron).
     */
    @Scheduled(cron = "${aegis.storage.retention-cron:0 0 3 * * ?}")
    public void enforceRetention() {
        int keep = storageProperties.getScanArtifactRetention();
        try {
            int evicted = artifactStore.retainMostRecent(keep);
            if (evicted > 0) {
                log.info("Scan artifact retention evicted {} artifact(s), keeping {}", evicted, keep);
            }
        } catch (RuntimeException ex) {
            log.warn("Scan artifact retention skipped: {}", ex.getMessage());
        }
    }
}
