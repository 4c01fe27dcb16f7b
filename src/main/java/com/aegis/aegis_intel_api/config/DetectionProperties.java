package com.aegis.aegis_intel_api.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.LinkedHashSet;
import java.util.Set;

@Data
@Configuration
@ConfigurationProperties(prefix = "aegis.detection")
public class DetectionProperties {

    /**
     * Active class vocabulary: military, dota, coco or auto.
     */
    private String modelType = "auto";

    private double confidenceThreshold = 0.25;
    private double iouThreshold = 0.45;
    private int maxDetections = 100;

    private String uploadDir = "static/uploads";
    private Set<String> allowedExtensions = new LinkedHashSet<>(
            Set.of("png", "jpg", "jpeg", "gif", "bmp", "webp", "tiff"));
    private long maxFileSize = 32L * 1024 * 1024;

    /**
     * JPEG quality of the annotated artifact, 0.0 - 1.0.
     */
    private float annotatedJpegQuality = 0.92f;
}
