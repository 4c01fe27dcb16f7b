package com.aegis.aegis_intel_api.service.analyst;

import com.aegis.aegis_intel_api.dto.detection.BoundingBox;
import com.aegis.aegis_intel_api.dto.detection.Detection;
import com.aegis.aegis_intel_api.dto.detection.DetectionStats;
import com.aegis.aegis_intel_api.dto.detection.ImageSize;
import com.aegis.aegis_intel_api.dto.detection.ThreatReport;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Renders one scan as compact plain text for the analyst.
 */
@Component
public class DetectionContextBuilder {

    public String build(List<Detection> detections, ThreatReport threat, ImageSize imageSize, double inferenceMs) {
        List<String> lines = new ArrayList<>();
        lines.add("IMAGE SCAN ANALYSIS");
        lines.add("Resolution: " + imageSize.width() + "×" + imageSize.height() + " pixels");
        lines.add("Inference time: " + inferenceMs + "ms");
        lines.add("");

        DetectionStats stats = threat.stats();
        lines.add("THREAT ASSESSMENT:");
        lines.add("  Level: " + threat.threatLevel().name());
        lines.add("  Label: " + threat.label());
        lines.add("  Description: " + threat.description());
        lines.add("  Total detections: " + stats.total());
        lines.add("  High-risk: " + stats.highRisk());
        lines.add("  Medium-risk: " + stats.mediumRisk());
        lines.add("  Low-risk: " + stats.lowRisk());
        lines.add("");

        if (detections.isEmpty()) {
            lines.add("DETECTED OBJECTS: None");
        } else {
            lines.add("DETECTED OBJECTS (" + detections.size() + " total):");
            int n = 1;
            for (Detection det : detections) {
                BoundingBox box = det.box();
                lines.add("  " + n++ + ". " + det.className().toUpperCase(Locale.ROOT)
                        + " [" + det.riskLevel().getCode().toUpperCase(Locale.ROOT) + " RISK]");
                lines.add(String.format(Locale.ROOT, "     Confidence: %.1f%%", det.confidence() * 100));
                lines.add("     Position: " + position(box, imageSize) + " of frame");
                lines.add("     Size: " + box.width() + "×" + box.height() + " pixels");
            }
        }
        return String.join("\n", lines);
    }

    static String position(BoundingBox box, ImageSize imageSize) {
        int width = Math.max(imageSize.width(), 1);
        int height = Math.max(imageSize.height(), 1);

        String horizontal = box.cx() < width * 0.33 ? "left" : box.cx() > width * 0.67 ? "right" : "center";
        String vertical = box.cy() < height * 0.33 ? "top" : box.cy() > height * 0.67 ? "bottom" : "middle";

        if ("middle".equals(vertical) && "center".equals(horizontal)) {
            return "center";
        }
        return vertical + "-" + horizontal;
    }
}
