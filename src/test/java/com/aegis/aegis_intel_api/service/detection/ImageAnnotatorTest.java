package com.aegis.aegis_intel_api.service.detection;

import com.aegis.aegis_intel_api.dto.detection.BoundingBox;
import com.aegis.aegis_intel_api.dto.detection.Detection;
import com.aegis.aegis_intel_api.dto.detection.RiskTier;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import javax.imageio.ImageIO;
import java.awt.Color;
import java.awt.Font;
import java.awt.image.BufferedImage;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

class ImageAnnotatorTest {

    @TempDir
    Path tempDir;

    private final ImageAnnotator annotator = new ImageAnnotator();

    private static boolean fontsAvailable() {
        try {
            BufferedImage scratch = new BufferedImage(1, 1, BufferedImage.TYPE_INT_RGB);
            scratch.createGraphics().getFontMetrics(new Font(Font.SANS_SERIF, Font.BOLD, 12)).stringWidth("x");
            return true;
        } catch (Throwable t) {
            return false;
        }
    }

    @Test
    void annotate_DrawsRiskColouredBoxOnACopy() {
        assumeTrue(fontsAvailable(), "no fonts in this environment");
        BufferedImage source = new BufferedImage(100, 100, BufferedImage.TYPE_INT_RGB);
        Detection tank = new Detection(0, "tank", 0.91, RiskTier.HIGH, new BoundingBox(10, 40, 60, 90));
        Detection tree = new Detection(1, "tree", 0.50, RiskTier.LOW, new BoundingBox(70, 70, 95, 95));

        BufferedImage annotated = annotator.annotate(source, List.of(tank, tree));

        assertNotSame(source, annotated);
        assertEquals(new Color(255, 0, 0).getRGB(), annotated.getRGB(10, 80));
        assertEquals(new Color(80, 200, 0).getRGB(), annotated.getRGB(95, 90));
        assertEquals(Color.BLACK.getRGB(), source.getRGB(10, 80));
        assertEquals(Color.BLACK.getRGB(), annotated.getRGB(35, 75));
    }

    @Test
    void annotate_NoDetectionsReturnsUnchangedCopy() {
        assumeTrue(fontsAvailable(), "no fonts in this environment");
        BufferedImage source = new BufferedImage(20, 10, BufferedImage.TYPE_INT_RGB);
        source.setRGB(5, 5, Color.CYAN.getRGB());

        BufferedImage annotated = annotator.annotate(source, List.of());

        assertEquals(20, annotated.getWidth());
        assertEquals(Color.CYAN.getRGB(), annotated.getRGB(5, 5));
    }

    @Test
    void writeJpeg_ProducesReadableImage() throws Exception {
        BufferedImage image = new BufferedImage(40, 30, BufferedImage.TYPE_INT_RGB);
        Path target = tempDir.resolve("out/annotated_scene.jpg");

        annotator.writeJpeg(image, target, 0.92f);

        assertTrue(Files.size(target) > 0);
        BufferedImage readBack = ImageIO.read(target.toFile());
        assertEquals(40, readBack.getWidth());
        assertEquals(30, readBack.getHeight());
    }

    @Test
    void label_ShowsWholePercent() {
        Detection detection = new Detection(0, "armored_vehicle", 0.876, RiskTier.HIGH,
                new BoundingBox(0, 0, 1, 1));

        assertEquals("armored_vehicle  88%", ImageAnnotator.label(detection));
    }
}
