package com.aboutblank.security;

import com.aboutblank.exception.ProblemDetails;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * Writes the 401 problem detail for requests that reach a protected route
 * without a usable auth key.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AuthKeyAuthenticationEntryPoint implements AuthenticationEntryPoint {

    private final ObjectMapper objectMapper;

    @Override
    public void commence(
            HttpServletRequest request,
            HttpServletResponse response,
            AuthenticationException authException
    ) throws IOException {
        Object reason = request.getAttribute(AuthKeyAuthenticationFilter.AUTH_ERROR_ATTRIBUTE);
        String detail = reason != null ? reason.toString() : AuthKeyAuthenticationFilter.MISSING_KEY_MESSAGE;

        log.warn("Rejected unauthenticated request: path={}, reason={}", request.getRequestURI(), detail);

        ProblemDetails.write(response, objectMapper, ProblemDetails.create(
                HttpStatus.UNAUTHORIZED,
                "Authentication Failed",
                detail,
                request.getRequestURI(),
                "authentication-failed"
        ));
    }
}
