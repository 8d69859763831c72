package com.urbanparking.availability.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.Map;
import java.util.TreeMap;

import lombok.extern.slf4j.Slf4j;


@ControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleResourceNotFoundException(
            ResourceNotFoundException ex, WebRequest request) {
        return respond(HttpStatus.NOT_FOUND, "Resource Not Found", ex.getMessage(), request);
    }

    /**
     * Handle rejected query parameters. No partial result is returned.
     */
    @ExceptionHandler(InvalidQueryException.class)
    public ResponseEntity<ErrorResponse> handleInvalidQuery(
            InvalidQueryException ex, WebRequest request) {
        log.warn("Rejected query {}: {}", request.getDescription(false), ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "Invalid Query", ex.getMessage(), request);
    }

    @ExceptionHandler(InvalidCoordinateException.class)
    public ResponseEntity<ErrorResponse> handleInvalidCoordinate(
            InvalidCoordinateException ex, WebRequest request) {
        return respond(HttpStatus.BAD_REQUEST, "Invalid Coordinate", ex.getMessage(), request);
    }

    /**
     * Handle refresh input that could not be turned into a snapshot.
     * The previously published snapshot keeps serving.
     */
    @ExceptionHandler(IngestException.class)
    public ResponseEntity<ErrorResponse> handleIngestException(
            IngestException ex, WebRequest request) {
        log.error("Refresh rejected: {}", ex.getMessage());
        return respond(HttpStatus.UNPROCESSABLE_ENTITY, "Ingest Error", ex.getMessage(), request);
    }

    /**
     * Handle validation errors
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ValidationErrorResponse> handleValidationExceptions(
            MethodArgumentNotValidException ex, WebRequest request) {

        Map<String, String> errors = new TreeMap<>();
        ex.getBindingResult().getFieldErrors().forEach(error ->
                errors.put(error.getField(), error.getDefaultMessage())
        );

        ValidationErrorResponse errorDetails = new ValidationErrorResponse(
                Instant.now(),
                HttpStatus.BAD_REQUEST.value(),
                "Validation Error",
                "Please correct the invalid input fields",
                request.getDescription(false),
                errors);

        return new ResponseEntity<>(errorDetails, HttpStatus.BAD_REQUEST);
    }

    /**
     * Handle missing or mistyped query parameters
     */
    @ExceptionHandler({MissingServletRequestParameterException.class,
            MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ErrorResponse> handleBadQueryParameter(
            Exception ex, WebRequest request) {
        return respond(HttpStatus.BAD_REQUEST, "Invalid Query", ex.getMessage(), request);
    }

    /**
     * Handle a request body that is not readable JSON of the expected shape
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableBody(
            HttpMessageNotReadableException ex, WebRequest request) {
        log.warn("Unreadable request body for {}: {}", request.getDescription(false), ex.getMostSpecificCause().getMessage());
        return respond(HttpStatus.BAD_REQUEST, "Bad Request", "Request body could not be read", request);
    }

    /**
     * Handle all other exceptions
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGlobalException(
            Exception ex, WebRequest request) {

        // Log the full stack trace for internal server errors
        log.error("Unhandled exception occurred: ", ex);

        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "System Error",
                "An unexpected error occurred. Please try again later or contact support if the issue persists.",
                request);
    }

    private static ResponseEntity<ErrorResponse> respond(HttpStatus status, String error, String message,
                                                         WebRequest request) {
        return new ResponseEntity<>(ErrorResponse.of(status, error, message, request), status);
    }
}
