package com.aegis.aegis_intel_api.exception;

import lombok.Getter;

/**
 * Upload rejected before entering the pipeline.
 */
@Getter
public class InvalidImageException extends RuntimeException {

    private final boolean unsupportedType;

    public InvalidImageException(String message) {
        this(message, false);
    }

    public InvalidImageException(String message, boolean unsupportedType) {
        super(message);
        this.unsupportedType = unsupportedType;
    }
}
