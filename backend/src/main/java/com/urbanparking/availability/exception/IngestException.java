package com.urbanparking.availability.exception;

/**
 * Exception thrown when refresh input cannot be turned into a snapshot
 */
public class IngestException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public IngestException(String message) {
        super(message);
    }

    public IngestException(String message, Throwable cause) {
        super(message, cause);
    }
}
