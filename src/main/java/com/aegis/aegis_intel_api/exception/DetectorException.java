package com.aegis.aegis_intel_api.exception;

/**
 * The external detector could not produce a result for an image.
 */
public class DetectorException extends RuntimeException {

    public DetectorException(String message) {
        super(message);
    }

    public DetectorException(String message, Throwable cause) {
        super(message, cause);
    }
}
