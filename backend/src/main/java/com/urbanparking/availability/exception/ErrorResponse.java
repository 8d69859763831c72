package com.urbanparking.availability.exception;

import java.time.Instant;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.context.request.WebRequest;

/**
 * Error body returned by every failed API call
 */
@Data
@AllArgsConstructor
@NoArgsConstructor
public class ErrorResponse {
    private Instant timestamp;
    private int status;
    private String error;
    private String message;
    private String path;

    public static ErrorResponse of(HttpStatus status, String error, String message, WebRequest request) {
        return new ErrorResponse(Instant.now(), status.value(), error, message, request.getDescription(false));
    }
}
