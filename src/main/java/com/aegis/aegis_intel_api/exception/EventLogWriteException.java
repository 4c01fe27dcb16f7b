package com.aegis.aegis_intel_api.exception;

/**
 * An append to the event log failed; none of the rows of that call were persisted.
 */
public class EventLogWriteException extends RuntimeException {

    public EventLogWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
