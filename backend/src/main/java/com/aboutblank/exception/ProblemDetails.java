package com.aboutblank.exception;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ProblemDetail;

import java.io.IOException;
import java.net.URI;
import java.time.Instant;

/**
 * Builds RFC 7807 problem details in the shape every error response uses.
 *
 * Shared by GlobalExceptionHandler and the servlet filters, which reject
 * requests before they reach a controller and therefore have to write the
 * body themselves.
 *
 * <pre>
 * {
 *   "type": "https://api.aboutblank.ie/errors/authentication-failed",
 *   "title": "Authentication Failed",
 *   "status": 401,
 *   "detail": "Invalid authentication",
 *   "instance": "/api/progress",
 *   "timestamp": "2024-02-26T10:30:00Z"
 * }
 * </pre>
 */
public final class ProblemDetails {

    private static final String BASE_ERROR_URI = "https://api.aboutblank.ie/errors";

    private ProblemDetails() {
    }

    /**
     * Create a ProblemDetail with the standard fields populated.
     *
     * @param status the HTTP status
     * @param title short, human-readable title
     * @param detail explanation safe to show to the client
     * @param path request path, or null when unknown
     * @param errorType error category used in the type URI
     * @return the populated ProblemDetail
     */
    public static ProblemDetail create(HttpStatus status, String title, String detail, String path, String errorType) {
        ProblemDetail problemDetail = ProblemDetail.forStatusAndDetail(status, detail);
        problemDetail.setType(URI.create(String.format("%s/%s", BASE_ERROR_URI, errorType)));
        problemDetail.setTitle(title);
        if (path != null && !path.isEmpty()) {
            problemDetail.setInstance(URI.create(path));
        }
        problemDetail.setProperty("timestamp", Instant.now().toString());
        return problemDetail;
    }

    /**
     * Write a ProblemDetail straight to a servlet response.
     *
     * @param response the response to write to
     * @param objectMapper mapper used to serialize the body
     * @param problemDetail the problem to write
     * @throws IOException if the body cannot be written
     */
    public static void write(HttpServletResponse response, ObjectMapper objectMapper, ProblemDetail problemDetail)
            throws IOException {
        response.setStatus(problemDetail.getStatus());
        response.setContentType(MediaType.APPLICATION_PROBLEM_JSON_VALUE);
        response.setCharacterEncoding("UTF-8");
        objectMapper.writeValue(response.getWriter(), problemDetail);
    }
}
