package com.aegis.aegis_intel_api.dto.response;

import com.aegis.aegis_intel_api.dto.analyst.SitrepResult;
import com.aegis.aegis_intel_api.dto.detection.Detection;
import com.aegis.aegis_intel_api.dto.detection.ImageSize;
import com.aegis.aegis_intel_api.dto.detection.ThreatReport;
import com.aegis.aegis_intel_api.dto.geo.GeoLocation;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Result of one image scan. {@code auditLogged} is false when the event log rejected the rows;
 * the verdict is still returned.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScanResponse {

    private String scanId;
    private List<Detection> detections;
    private ThreatReport threat;
    private String annotatedPath;
    private String originalPath;
    private double inferenceMs;
    private ImageSize imageSize;
    private SitrepResult sitrep;
    private boolean analystEnabled;
    private GeoLocation geo;

    @Builder.Default
    private boolean auditLogged = true;
    private String auditError;
}
