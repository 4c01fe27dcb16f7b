package com.aegis.aegis_intel_api.dto.detection;

import java.util.List;
import java.util.Map;

/**
 * Structured output of the external detector for a single image.
 */
public record RawDetectorOutput(List<Instance> instances, Map<Integer, String> classNames) {

    public RawDetectorOutput {
        instances = instances == null ? List.of() : List.copyOf(instances);
        classNames = classNames == null ? Map.of() : Map.copyOf(classNames);
    }

    public static RawDetectorOutput empty() {
        return new RawDetectorOutput(List.of(), Map.of());
    }

    public record Instance(double x1, double y1, double x2, double y2, double confidence, int classIndex) {}
}
