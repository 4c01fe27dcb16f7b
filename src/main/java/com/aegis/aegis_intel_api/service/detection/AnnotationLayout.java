package com.aegis.aegis_intel_api.service.detection;

/**
 * Geometry of the overlay, scaled to the image so labels stay legible at any resolution.
 */
public final class AnnotationLayout {

    /** Pixel height of the label font at scale 1.0. */
    static final float BASE_FONT_PX = 22f;

    private static final int PILL_PADDING = 6;

    private AnnotationLayout() {
    }

    public static double fontScale(int width, int height) {
        return Math.max(0.4, Math.min(width, height) / 1200.0);
    }

    public static int thickness(int width, int height) {
        return Math.max(1, Math.min(width, height) / 400);
    }

    /**
     * Places the label pill above the box's top-left corner, clamped to the top edge.
     */
    public static LabelPill placeLabel(int boxX1, int boxY1, int textWidth, int textHeight, int baseline) {
        int top = Math.max(boxY1 - textHeight - baseline - PILL_PADDING, 0);
        int bottom = Math.max(boxY1, textHeight + baseline + PILL_PADDING);
        return new LabelPill(boxX1, top, boxX1 + textWidth + 8, bottom,
                boxX1 + 4, bottom - baseline - 2);
    }

    public record LabelPill(int x1, int y1, int x2, int y2, int textX, int textY) {}
}
