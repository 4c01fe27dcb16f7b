package com.aegis.aegis_intel_api.service.geo;

import com.aegis.aegis_intel_api.dto.geo.GeoLocation;

import java.util.Optional;

public interface GeocodingService {

    /**
     * Best-effort place name for a coordinate pair. Never fails for valid coordinates; the name
     * falls back to the formatted coordinates when the lookup is unavailable.
     *
     * @return empty when the coordinates are out of range
     */
    Optional<GeoLocation> reverseGeocode(double latitude, double longitude);
}
