package com.aegis.aegis_intel_api.exception;

import lombok.Getter;

@Getter
public class LlmException extends RuntimeException {

    private final String provider;

    public LlmException(String provider, String message) {
        super(message);
        this.provider = provider;
    }

    public LlmException(String provider, String message, Throwable cause) {
        super(message, cause);
        this.provider = provider;
    }
}
