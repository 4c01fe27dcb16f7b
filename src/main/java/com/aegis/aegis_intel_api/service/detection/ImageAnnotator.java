package com.aegis.aegis_intel_api.service.detection;

import com.aegis.aegis_intel_api.dto.detection.Detection;
import com.aegis.aegis_intel_api.dto.detection.RiskTier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.stream.ImageOutputStream;
import java.awt.BasicStroke;
import java.awt.Color;
import java.awt.Font;
import java.awt.FontMetrics;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Draws risk-coloured boxes and labels onto a copy of the source image.
 */
@Slf4j
@Component
public class ImageAnnotator {

    static final Map<RiskTier, Color> RISK_COLORS = Map.of(
            RiskTier.HIGH, new Color(255, 0, 0),
            RiskTier.MEDIUM, new Color(255, 140, 0),
            RiskTier.LOW, new Color(80, 200, 0));

    private static final Color TEXT_COLOR = Color.WHITE;

    public BufferedImage annotate(BufferedImage source, List<Detection> detections) {
        int width = source.getWidth();
        int height = source.getHeight();

        BufferedImage annotated = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = annotated.createGraphics();
        try {
            g.drawImage(source, 0, 0, null);
            g.setRenderingHint(RenderingHints.KEY_TEXT_ANTIALIASING, RenderingHints.VALUE_TEXT_ANTIALIAS_ON);

            double fontScale = AnnotationLayout.fontScale(width, height);
            int thickness = AnnotationLayout.thickness(width, height);
            g.setFont(new Font(Font.SANS_SERIF, Font.BOLD,
                    Math.max(1, Math.round((float) fontScale * AnnotationLayout.BASE_FONT_PX))));
            FontMetrics metrics = g.getFontMetrics();

            for (Detection detection : detections) {
                drawDetection(g, metrics, detection, thickness);
            }
        } finally {
            g.dispose();
        }
        return annotated;
    }

    public void writeJpeg(BufferedImage image, Path target, float quality) throws IOException {
        Iterator<ImageWriter> writers = ImageIO.getImageWritersByFormatName("jpeg");
        if (!writers.hasNext()) {
            throw new IOException("No JPEG writer available");
        }
        ImageWriter writer = writers.next();
        ImageWriteParam param = writer.getDefaultWriteParam();
        param.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
        param.setCompressionQuality(quality);

        Files.createDirectories(target.toAbsolutePath().getParent());
        Files.deleteIfExists(target);
        try (ImageOutputStream out = ImageIO.createImageOutputStream(target.toFile())) {
            writer.setOutput(out);
            writer.write(null, new IIOImage(image, null, null), param);
        } finally {
            writer.dispose();
        }
        log.debug("Annotated image written to {}", target);
    }

    static String label(Detection detection) {
        return String.format(Locale.ROOT, "%s  %.0f%%", detection.className(), detection.confidence() * 100);
    }

    private void drawDetection(Graphics2D g, FontMetrics metrics, Detection detection, int thickness) {
        Color color = RISK_COLORS.get(detection.riskLevel());
        int x1 = detection.box().x1();
        int y1 = detection.box().y1();

        g.setColor(color);
        g.setStroke(new BasicStroke(thickness + 1));
        g.drawRect(x1, y1, detection.box().width(), detection.box().height());

        String text = label(detection);
        AnnotationLayout.LabelPill pill = AnnotationLayout.placeLabel(
                x1, y1, metrics.stringWidth(text), metrics.getAscent(), metrics.getDescent());
        g.fillRect(pill.x1(), pill.y1(), pill.x2() - pill.x1(), pill.y2() - pill.y1());

        g.setColor(TEXT_COLOR);
        g.drawString(text, pill.textX(), pill.textY());
    }
}
