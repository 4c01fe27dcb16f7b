package com.aegis.aegis_intel_api.dto.detection;

/**
 * One recognized object instance within one image.
 *
 * @param id         index of the instance in the detector output
 * @param className  class name as reported by the detector
 * @param confidence score in [0, 1], rounded to 4 decimals
 * @param riskLevel  tier assigned at normalization time
 * @param box        pixel box
 */
public record Detection(int id, String className, double confidence, RiskTier riskLevel, BoundingBox box) {

    public Detection {
        if (className == null) {
            throw new IllegalArgumentException("Class name is required");
        }
        if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("Confidence out of range: " + confidence);
        }
        if (riskLevel == null || box == null) {
            throw new IllegalArgumentException("Risk level and box are required");
        }
    }
}
