package com.urbanparking.availability.exception;

/**
 * Exception thrown when a bay coordinate is not finite or lies outside the service region
 */
public class InvalidCoordinateException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public InvalidCoordinateException(String message) {
        super(message);
    }

    public InvalidCoordinateException(String message, Throwable cause) {
        super(message, cause);
    }
}
