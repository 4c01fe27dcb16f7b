package com.aegis.aegis_intel_api.dto.geo;

/**
 * GPS position embedded in an image, decimal degrees with an optional altitude in metres.
 */
public record GpsFix(double latitude, double longitude, Double altitude) {}
