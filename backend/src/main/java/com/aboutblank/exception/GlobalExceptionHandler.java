package com.aboutblank.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Global exception handler for REST API endpoints.
 *
 * Converts exceptions thrown by controllers and services into RFC 7807
 * problem details (see ProblemDetails for the response shape).
 *
 * <p>Handled Exception Categories:
 * <ul>
 *   <li>Validation errors (400): invalid request body, bad query parameters</li>
 *   <li>Not found errors (404): reactions to unknown messages</li>
 *   <li>Datastore errors (500): generic per-operation message, detail stays in the log</li>
 *   <li>Server errors (500): unexpected internal errors</li>
 * </ul>
 *
 * Authentication (401), rate limit (429) and payload size (413) rejections
 * happen in servlet filters before a controller runs and are written there.
 *
 * @see <a href="https://datatracker.ietf.org/doc/html/rfc7807">RFC 7807 Specification</a>
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    /**
     * Handles SyncOperationException - a datastore operation failed.
     *
     * The service has already logged the cause with its stack trace; only the
     * generic operation message is returned to the client.
     *
     * @param ex the SyncOperationException
     * @param request the web request context
     * @return RFC 7807 problem details with 500 status
     */
    @ExceptionHandler(SyncOperationException.class)
    public ResponseEntity<ProblemDetail> handleSyncOperationException(
            SyncOperationException ex,
            WebRequest request
    ) {
        log.warn("Sync operation failed: operation={}, message={}", ex.getOperation(), ex.getMessage());

        ProblemDetail problemDetail = ProblemDetails.create(
                HttpStatus.INTERNAL_SERVER_ERROR,
                "Sync Failed",
                ex.getMessage(),
                requestPath(request),
                "sync-failed"
        );
        problemDetail.setProperty("operation", ex.getOperation());

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(problemDetail);
    }

    /**
     * Handles ResourceNotFoundException - the referenced resource does not exist.
     *
     * @param ex the ResourceNotFoundException
     * @param request the web request context
     * @return RFC 7807 problem details with 404 status
     */
    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<ProblemDetail> handleResourceNotFoundException(
            ResourceNotFoundException ex,
            WebRequest request
    ) {
        log.warn("Resource not found: {}", ex.getMessage());

        ProblemDetail problemDetail = ProblemDetails.create(
                HttpStatus.NOT_FOUND,
                "Resource Not Found",
                ex.getMessage(),
                requestPath(request),
                "resource-not-found"
        );

        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(problemDetail);
    }

    /**
     * Handles MethodArgumentNotValidException - bean validation failures.
     *
     * This occurs when @Valid annotated request bodies fail validation, e.g. an
     * empty or oversized community message.
     *
     * @param ex the MethodArgumentNotValidException
     * @param request the web request context
     * @return RFC 7807 problem details with 400 status and validation errors
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ProblemDetail> handleValidationException(
            MethodArgumentNotValidException ex,
            WebRequest request
    ) {
        log.warn("Request validation failed: {}", ex.getMessage());

        Map<String, String> validationErrors = new LinkedHashMap<>();
        ex.getBindingResult().getFieldErrors().forEach(error ->
                validationErrors.putIfAbsent(error.getField(), error.getDefaultMessage()));

        ProblemDetail problemDetail = ProblemDetails.create(
                HttpStatus.BAD_REQUEST,
                "Validation Failed",
                "Request validation failed. Please check the 'errors' property for details.",
                requestPath(request),
                "validation-failed"
        );
        problemDetail.setProperty("errors", validationErrors);

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(problemDetail);
    }

    /**
     * Handles HttpMessageNotReadableException - malformed request body.
     *
     * @param ex the HttpMessageNotReadableException
     * @param request the web request context
     * @return RFC 7807 problem details with 400 status
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ProblemDetail> handleHttpMessageNotReadableException(
            HttpMessageNotReadableException ex,
            WebRequest request
    ) {
        log.warn("Request body parsing failed: {}", ex.getMessage());

        ProblemDetail problemDetail = ProblemDetails.create(
                HttpStatus.BAD_REQUEST,
                "Invalid Request Body",
                "The request body is malformed or contains invalid JSON. Please check your request format.",
                requestPath(request),
                "invalid-request-body"
        );

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(problemDetail);
    }

    /**
     * Handles MethodArgumentTypeMismatchException - a query or path parameter
     * of the wrong type, such as {@code ?limit=abc}.
     *
     * @param ex the MethodArgumentTypeMismatchException
     * @param request the web request context
     * @return RFC 7807 problem details with 400 status
     */
    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ProblemDetail> handleTypeMismatchException(
            MethodArgumentTypeMismatchException ex,
            WebRequest request
    ) {
        log.warn("Invalid parameter '{}': {}", ex.getName(), ex.getValue());

        ProblemDetail problemDetail = ProblemDetails.create(
                HttpStatus.BAD_REQUEST,
                "Invalid Argument",
                String.format("Parameter '%s' has an invalid value.", ex.getName()),
                requestPath(request),
                "invalid-argument"
        );

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(problemDetail);
    }

    /**
     * Handles IllegalArgumentException - illegal argument passed to a service.
     *
     * @param ex the IllegalArgumentException
     * @param request the web request context
     * @return RFC 7807 problem details with 400 status
     */
    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ProblemDetail> handleIllegalArgumentException(
            IllegalArgumentException ex,
            WebRequest request
    ) {
        log.warn("Invalid argument: {}", ex.getMessage());

        ProblemDetail problemDetail = ProblemDetails.create(
                HttpStatus.BAD_REQUEST,
                "Invalid Argument",
                ex.getMessage(),
                requestPath(request),
                "invalid-argument"
        );

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(problemDetail);
    }

    /**
     * Fallback handler for all unhandled exceptions.
     *
     * Spring MVC's own exceptions (unknown route, unsupported method or media
     * type) already carry a 4xx status and keep it. Anything else is logged
     * with its full stack trace and returned as a generic 500 with an error id
     * the client can quote.
     *
     * @param ex the unhandled exception
     * @param request the web request context
     * @return RFC 7807 problem details
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ProblemDetail> handleUnhandledException(
            Exception ex,
            WebRequest request
    ) {
        if (ex instanceof ErrorResponse) {
            ErrorResponse errorResponse = (ErrorResponse) ex;
            HttpStatus status = HttpStatus.valueOf(errorResponse.getStatusCode().value());
            log.warn("Request rejected by MVC: status={}, message={}", status.value(), ex.getMessage());

            ProblemDetail problemDetail = ProblemDetails.create(
                    status,
                    status.getReasonPhrase(),
                    errorResponse.getBody().getDetail(),
                    requestPath(request),
                    "request-rejected"
            );
            return ResponseEntity.status(status).body(problemDetail);
        }

        String errorId = generateErrorId();
        log.error("Unexpected error occurred [{}]: {}", errorId, ex.getMessage(), ex);

        ProblemDetail problemDetail = ProblemDetails.create(
                HttpStatus.INTERNAL_SERVER_ERROR,
                "Internal Server Error",
                "An unexpected error occurred. Please try again later.",
                requestPath(request),
                "internal-error"
        );
        problemDetail.setProperty("errorId", errorId);

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(problemDetail);
    }

    private String requestPath(WebRequest request) {
        String description = request.getDescription(false);
        if (description != null && description.startsWith("uri=")) {
            return description.substring(4);
        }
        return null;
    }

    private String generateErrorId() {
        return String.format("ERR-%d", System.currentTimeMillis());
    }
}
