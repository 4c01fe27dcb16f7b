package com.aegis.aegis_intel_api.service.geo;

import com.aegis.aegis_intel_api.dto.geo.GpsFix;
import com.drew.imaging.ImageMetadataReader;
import com.drew.imaging.ImageProcessingException;
import com.drew.lang.Rational;
import com.drew.metadata.Metadata;
import com.drew.metadata.exif.GpsDirectory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Reads the GPS block of an image's EXIF metadata.
 */
@Slf4j
@Component
public class ExifGpsExtractor {

    private static final int BELOW_SEA_LEVEL = 1;

    /**
     * @return empty when the image has no GPS tags, unreadable metadata, or coordinates out of range
     */
    public Optional<GpsFix> extract(Path image) {
        Metadata metadata;
        try {
            metadata = ImageMetadataReader.readMetadata(image.toFile());
        } catch (ImageProcessingException | IOException e) {
            log.debug("No readable metadata in {}: {}", image.getFileName(), e.getMessage());
            return Optional.empty();
        }

        GpsDirectory gps = metadata.getFirstDirectoryOfType(GpsDirectory.class);
        if (gps == null) {
            return Optional.empty();
        }
        com.drew.lang.GeoLocation location = gps.getGeoLocation();
        if (location == null) {
            return Optional.empty();
        }

        double latitude = location.getLatitude();
        double longitude = location.getLongitude();
        if (!NominatimGeocodingService.isValid(latitude, longitude)) {
            log.warn("Invalid GPS coordinates in {}: lat={}, lon={}", image.getFileName(), latitude, longitude);
            return Optional.empty();
        }

        GpsFix fix = new GpsFix(round(latitude, 6), round(longitude, 6), altitudeOf(gps));
        log.info("GPS extracted from {}: {}, {} (altitude {})", image.getFileName(),
                fix.latitude(), fix.longitude(), fix.altitude());
        return Optional.of(fix);
    }

    private static Double altitudeOf(GpsDirectory gps) {
        Rational altitude = gps.getRational(GpsDirectory.TAG_ALTITUDE);
        if (altitude == null || altitude.getDenominator() == 0) {
            return null;
        }
        double metres = altitude.doubleValue();
        Integer ref = gps.getInteger(GpsDirectory.TAG_ALTITUDE_REF);
        if (ref != null && ref == BELOW_SEA_LEVEL) {
            metres = -metres;
        }
        return round(metres, 1);
    }

    private static double round(double value, int scale) {
        return BigDecimal.valueOf(value).setScale(scale, RoundingMode.HALF_UP).doubleValue();
    }
}
