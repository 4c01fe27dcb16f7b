package com.aegis.aegis_intel_api.dto.detection;

public record ImageSize(int width, int height) {}
