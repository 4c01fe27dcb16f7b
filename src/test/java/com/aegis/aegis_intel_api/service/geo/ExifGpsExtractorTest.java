package com.aegis.aegis_intel_api.service.geo;

import com.aegis.aegis_intel_api.dto.geo.GpsFix;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ExifGpsExtractorTest {

    private static final short TYPE_BYTE = 1;
    private static final short TYPE_ASCII = 2;
    private static final short TYPE_LONG = 4;
    private static final short TYPE_RATIONAL = 5;

    @TempDir
    Path tempDir;

    private final ExifGpsExtractor extractor = new ExifGpsExtractor();

    @Test
    void extract_ReadsCoordinatesAndAltitude() throws Exception {
        // 48°51'30.24" N, 2°17'40.2" E, 35.5 m
        Path image = writeJpeg("tower.jpg", gpsExif('N', new int[]{48, 1, 51, 1, 3024, 100},
                'E', new int[]{2, 1, 17, 1, 402, 10}, 0, 71, 2));

        GpsFix fix = extractor.extract(image).orElseThrow();

        assertEquals(48.8584, fix.latitude(), 1e-6);
        assertEquals(2.2945, fix.longitude(), 1e-6);
        assertEquals(35.5, fix.altitude());
    }

    @Test
    void extract_SouthWestAndBelowSeaLevelAreNegative() throws Exception {
        // 33°52'7.68" S, 151°12'33.48" W, 12 m below sea level
        Path image = writeJpeg("harbour.jpg", gpsExif('S', new int[]{33, 1, 52, 1, 768, 100},
                'W', new int[]{151, 1, 12, 1, 3348, 100}, 1, 12, 1));

        GpsFix fix = extractor.extract(image).orElseThrow();

        assertEquals(-33.8688, fix.latitude(), 1e-6);
        assertEquals(-151.2093, fix.longitude(), 1e-6);
        assertEquals(-12.0, fix.altitude());
    }

    @Test
    void extract_ImageWithoutExifIsEmpty() throws Exception {
        Path image = writeJpeg("plain.jpg", null);

        assertTrue(extractor.extract(image).isEmpty());
    }

    @Test
    void extract_NonImageIsEmpty() throws Exception {
        Path file = tempDir.resolve("notes.jpg");
        Files.writeString(file, "not an image", StandardCharsets.UTF_8);

        Optional<GpsFix> fix = extractor.extract(file);

        assertTrue(fix.isEmpty());
    }

    @Test
    void writeJpeg_StaysDecodable() throws Exception {
        Path image = writeJpeg("tower.jpg", gpsExif('N', new int[]{48, 1, 51, 1, 3024, 100},
                'E', new int[]{2, 1, 17, 1, 402, 10}, 0, 71, 2));

        BufferedImage decoded = ImageIO.read(image.toFile());

        assertNotNull(decoded);
        assertEquals(16, decoded.getWidth());
    }

    private Path writeJpeg(String name, byte[] exifSegment) throws Exception {
        ByteArrayOutputStream jpeg = new ByteArrayOutputStream();
        ImageIO.write(new BufferedImage(16, 16, BufferedImage.TYPE_INT_RGB), "jpg", jpeg);
        byte[] encoded = jpeg.toByteArray();

        // EXIF goes after SOI and the JFIF APP0 segment
        int insertAt = 2;
        if ((encoded[2] & 0xFF) == 0xFF && (encoded[3] & 0xFF) == 0xE0) {
            insertAt = 4 + (((encoded[4] & 0xFF) << 8) | (encoded[5] & 0xFF));
        }
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        out.write(encoded, 0, insertAt);
        if (exifSegment != null) {
            out.write(exifSegment);
        }
        out.write(encoded, insertAt, encoded.length - insertAt);

        Path file = tempDir.resolve(name);
        Files.write(file, out.toByteArray());
        return file;
    }

    /**
     * Big-endian APP1 segment holding IFD0 with a single pointer to a six-entry GPS IFD.
     */
    private static byte[] gpsExif(char latRef, int[] latitude, char lonRef, int[] longitude,
                                  int altitudeRef, int altitudeNumerator, int altitudeDenominator) {
        int gpsIfdOffset = 8 + 2 + 12 + 4;
        int dataOffset = gpsIfdOffset + 2 + 6 * 12 + 4;
        int latitudeOffset = dataOffset;
        int longitudeOffset = latitudeOffset + 24;
        int altitudeOffset = longitudeOffset + 24;
        int tiffLength = altitudeOffset + 8;

        ByteBuffer tiff = ByteBuffer.allocate(tiffLength);
        tiff.put((byte) 'M').put((byte) 'M').putShort((short) 42).putInt(8);

        tiff.putShort((short) 1);
        entry(tiff, 0x8825, TYPE_LONG, 1, gpsIfdOffset);
        tiff.putInt(0);

        tiff.putShort((short) 6);
        asciiEntry(tiff, 0x0001, latRef);
        entry(tiff, 0x0002, TYPE_RATIONAL, 3, latitudeOffset);
        asciiEntry(tiff, 0x0003, lonRef);
        entry(tiff, 0x0004, TYPE_RATIONAL, 3, longitudeOffset);
        tiff.putShort((short) 0x0005).putShort(TYPE_BYTE).putInt(1)
                .put((byte) altitudeRef).put((byte) 0).put((byte) 0).put((byte) 0);
        entry(tiff, 0x0006, TYPE_RATIONAL, 1, altitudeOffset);
        tiff.putInt(0);

        for (int value : latitude) {
            tiff.putInt(value);
        }
        for (int value : longitude) {
            tiff.putInt(value);
        }
        tiff.putInt(altitudeNumerator).putInt(altitudeDenominator);

        byte[] header = "Exif\0\0".getBytes(StandardCharsets.US_ASCII);
        ByteBuffer segment = ByteBuffer.allocate(4 + header.length + tiffLength);
        segment.put((byte) 0xFF).put((byte) 0xE1)
                .putShort((short) (2 + header.length + tiffLength))
                .put(header)
                .put(tiff.array());
        return segment.array();
    }

    private static void entry(ByteBuffer buffer, int tag, short type, int count, int value) {
        buffer.putShort((short) tag).putShort(type).putInt(count).putInt(value);
    }

    private static void asciiEntry(ByteBuffer buffer, int tag, char value) {
        buffer.putShort((short) tag).putShort(TYPE_ASCII).putInt(2)
                .put((byte) value).put((byte) 0).put((byte) 0).put((byte) 0);
    }
}
