package com.aegis.aegis_intel_api.service.detection;

import com.aegis.aegis_intel_api.dto.detection.BoundingBox;
import com.aegis.aegis_intel_api.dto.detection.Detection;
import com.aegis.aegis_intel_api.dto.detection.RawDetectorOutput;
import com.aegis.aegis_intel_api.dto.detection.RiskTier;
import com.aegis.aegis_intel_api.service.risk.RiskClassifier;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Turns raw detector output into ordered {@link Detection} records.
 * Ordering: risk tier (high, medium, low), then confidence descending; ties keep detector order.
 */
@Component
public class DetectionNormalizer {

    static final Comparator<Detection> RENDER_ORDER = Comparator
            .comparingInt((Detection d) -> d.riskLevel().priority())
            .thenComparing(Comparator.comparingDouble(Detection::confidence).reversed());

    private final RiskClassifier riskClassifier;

    public DetectionNormalizer(RiskClassifier riskClassifier) {
        this.riskClassifier = riskClassifier;
    }

    public List<Detection> normalize(RawDetectorOutput output) {
        if (output == null || output.instances().isEmpty()) {
            return List.of();
        }

        List<Detection> detections = new ArrayList<>(output.instances().size());
        int index = 0;
        for (RawDetectorOutput.Instance instance : output.instances()) {
            String className = output.classNames()
                    .getOrDefault(instance.classIndex(), "class_" + instance.classIndex());
            RiskTier risk = riskClassifier.classify(className);
            detections.add(new Detection(index++, className, roundConfidence(instance.confidence()),
                    risk, toBox(instance)));
        }

        // List.sort is stable
        detections.sort(RENDER_ORDER);
        return List.copyOf(detections);
    }

    private BoundingBox toBox(RawDetectorOutput.Instance instance) {
        int x1 = (int) instance.x1();
        int y1 = (int) instance.y1();
        int x2 = (int) instance.x2();
        int y2 = (int) instance.y2();
        return new BoundingBox(Math.min(x1, x2), Math.min(y1, y2), Math.max(x1, x2), Math.max(y1, y2));
    }

    static double roundConfidence(double confidence) {
        return BigDecimal.valueOf(confidence).setScale(4, RoundingMode.HALF_EVEN).doubleValue();
    }
}
