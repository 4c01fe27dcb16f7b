package com.aegis.aegis_intel_api.dto.detection;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Integer pixel box. Width, height and center are always derived from the corners.
 */
public record BoundingBox(int x1, int y1, int x2, int y2) {

    public BoundingBox {
        if (x1 > x2 || y1 > y2) {
            throw new IllegalArgumentException(
                    "Invalid box corners (" + x1 + "," + y1 + ")-(" + x2 + "," + y2 + ")");
        }
    }

    @JsonProperty
    public int width() {
        return x2 - x1;
    }

    @JsonProperty
    public int height() {
        return y2 - y1;
    }

    @JsonProperty
    public int cx() {
        return Math.floorDiv(x1 + x2, 2);
    }

    @JsonProperty
    public int cy() {
        return Math.floorDiv(y1 + y2, 2);
    }
}
