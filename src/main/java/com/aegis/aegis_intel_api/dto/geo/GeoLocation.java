package com.aegis.aegis_intel_api.dto.geo;

import java.util.Locale;

/**
 * Where an image was taken. {@code altitude} is in metres and null when the image carries none.
 */
public record GeoLocation(double latitude, double longitude, Double altitude, String locationName, String mapsLink) {

    public static GeoLocation of(double latitude, double longitude, String locationName) {
        String link = String.format(Locale.ROOT, "https://www.google.com/maps?q=%s,%s", latitude, longitude);
        return new GeoLocation(latitude, longitude, null, locationName, link);
    }

    public GeoLocation withAltitude(Double altitude) {
        return new GeoLocation(latitude, longitude, altitude, locationName, mapsLink);
    }
}
