package com.aegis.aegis_intel_api.service.analyst;

import com.aegis.aegis_intel_api.dto.detection.BoundingBox;
import com.aegis.aegis_intel_api.dto.detection.Detection;
import com.aegis.aegis_intel_api.dto.detection.ImageSize;
import com.aegis.aegis_intel_api.dto.detection.RiskTier;
import com.aegis.aegis_intel_api.dto.detection.ThreatReport;
import com.aegis.aegis_intel_api.service.threat.ThreatAssessor;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;

class DetectionContextBuilderTest {

    private static final ImageSize FRAME = new ImageSize(1200, 900);

    private final DetectionContextBuilder builder = new DetectionContextBuilder();
    private final ThreatAssessor assessor = new ThreatAssessor();

    @Test
    void build_ListsThreatBlockAndDetections() {
        List<Detection> detections = List.of(
                new Detection(0, "tank", 0.9134, RiskTier.HIGH, new BoundingBox(50, 40, 250, 140)),
                new Detection(1, "military_truck", 0.62, RiskTier.MEDIUM, new BoundingBox(500, 400, 700, 500)));
        ThreatReport threat = assessor.assess(detections);

        String context = builder.build(detections, threat, FRAME, 42.1);

        assertThat(context).startsWith("IMAGE SCAN ANALYSIS\nResolution: 1200×900 pixels\nInference time: 42.1ms\n");
        assertThat(context).contains(
                "THREAT ASSESSMENT:",
                "  Level: HIGH",
                "  Label: HIGH ALERT",
                "  Total detections: 2",
                "  High-risk: 1",
                "  Medium-risk: 1",
                "  Low-risk: 0",
                "DETECTED OBJECTS (2 total):",
                "  1. TANK [HIGH RISK]",
                "     Confidence: 91.3%",
                "     Position: top-left of frame",
                "     Size: 200×100 pixels",
                "  2. MILITARY_TRUCK [MEDIUM RISK]",
                "     Position: center of frame");
    }

    @Test
    void build_NoDetections() {
        String context = builder.build(List.of(), assessor.assess(List.of()), FRAME, 12.0);

        assertThat(context).contains("  Level: CLEAR", "DETECTED OBJECTS: None");
    }

    @Test
    void position_UsesThirdsOfTheFrame() {
        assertEquals("top-left", DetectionContextBuilder.position(new BoundingBox(0, 0, 20, 20), FRAME));
        assertEquals("top-center", DetectionContextBuilder.position(new BoundingBox(580, 0, 620, 20), FRAME));
        assertEquals("middle-right", DetectionContextBuilder.position(new BoundingBox(1100, 430, 1180, 470), FRAME));
        assertEquals("bottom-right", DetectionContextBuilder.position(new BoundingBox(1100, 800, 1180, 880), FRAME));
        assertEquals("center", DetectionContextBuilder.position(new BoundingBox(580, 430, 620, 470), FRAME));
    }
}
