package com.aegis.aegis_intel_api.exception;

public class ScanNotFoundException extends RuntimeException {

    public ScanNotFoundException(String scanId) {
        super("Scan not found: " + scanId);
    }
}
