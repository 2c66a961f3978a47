package com.aboutblank.security;

import com.aboutblank.exception.ProblemDetails;
import com.aboutblank.service.RateLimitService;
import com.aboutblank.service.RateLimitService.Decision;
import com.aboutblank.service.RateLimitService.Policy;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.lang.NonNull;
import org.springframework.security.web.util.matcher.AntPathRequestMatcher;
import org.springframework.security.web.util.matcher.RequestMatcher;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/**
 * Per-IP rate limiting for API routes.
 *
 * Policies:
 * - general: every /api/** route, 100 requests per 15 minutes by default
 * - strict: POST /api/community/message, 5 requests per hour by default;
 *   successful responses give their hit back so only failed attempts count
 *
 * A request on the strict route is counted against both policies, general
 * first. Allowed responses carry RateLimit-Limit, RateLimit-Remaining and
 * RateLimit-Reset for the most specific policy that applied; rejected ones
 * get 429 with Retry-After as well.
 *
 * @see com.aboutblank.service.RateLimitService
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RateLimitFilter extends OncePerRequestFilter {

    static final String HEADER_LIMIT = "RateLimit-Limit";
    static final String HEADER_REMAINING = "RateLimit-Remaining";
    static final String HEADER_RESET = "RateLimit-Reset";

    private static final RequestMatcher STRICT_ROUTE =
            new AntPathRequestMatcher("/api/community/message", HttpMethod.POST.name());

    private final RateLimitService rateLimitService;
    private final ObjectMapper objectMapper;

    @Value("${app.rate-limit.general.max-requests:100}")
    private int generalMaxRequests;

    @Value("${app.rate-limit.general.window-minutes:15}")
    private int generalWindowMinutes;

    @Value("${app.rate-limit.strict.max-requests:5}")
    private int strictMaxRequests;

    @Value("${app.rate-limit.strict.window-minutes:60}")
    private int strictWindowMinutes;

    @Value("${app.rate-limit.strict.skip-successful-requests:true}")
    private boolean strictSkipSuccessfulRequests;

    private Policy generalPolicy;
    private Policy strictPolicy;

    @Override
    protected void initFilterBean() throws ServletException {
        generalPolicy = new Policy("general", generalMaxRequests, generalWindowMinutes * 60L,
                false, "Too many requests, please try again later");
        strictPolicy = new Policy("strict", strictMaxRequests, strictWindowMinutes * 60L,
                strictSkipSuccessfulRequests, "Too many authentication attempts");

        log.info("Rate limits configured: general={}/{}min, strict={}/{}min (skip successful: {})",
                generalMaxRequests, generalWindowMinutes, strictMaxRequests, strictWindowMinutes,
                strictSkipSuccessfulRequests);
    }

    @Override
    protected void doFilterInternal(
            @NonNull HttpServletRequest request,
            @NonNull HttpServletResponse response,
            @NonNull FilterChain filterChain
    ) throws ServletException, IOException {
        String clientIp = request.getRemoteAddr();

        Decision general = rateLimitService.tryConsume(generalPolicy, clientIp);
        if (!general.isAllowed()) {
            reject(request, response, generalPolicy, general);
            return;
        }

        Decision strict = null;
        if (STRICT_ROUTE.matches(request)) {
            strict = rateLimitService.tryConsume(strictPolicy, clientIp);
            if (!strict.isAllowed()) {
                reject(request, response, strictPolicy, strict);
                return;
            }
        }

        writeHeaders(response, strict != null ? strict : general);

        filterChain.doFilter(request, response);

        if (strict != null && strict.isTracked() && strictPolicy.isSkipSuccessfulRequests()
                && response.getStatus() < 400) {
            rateLimitService.refund(strictPolicy, clientIp);
        }
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) throws ServletException {
        return !request.getRequestURI().startsWith("/api/");
    }

    private void reject(HttpServletRequest request, HttpServletResponse response, Policy policy, Decision decision)
            throws IOException {
        writeHeaders(response, decision);
        response.setHeader(HttpHeaders.RETRY_AFTER, String.valueOf(decision.getResetSeconds()));

        ProblemDetails.write(response, objectMapper, ProblemDetails.create(
                HttpStatus.TOO_MANY_REQUESTS,
                "Too Many Requests",
                policy.getMessage(),
                request.getRequestURI(),
                "rate-limit-exceeded"
        ));
    }

    private void writeHeaders(HttpServletResponse response, Decision decision) {
        if (!decision.isTracked()) {
            return;
        }
        response.setHeader(HEADER_LIMIT, String.valueOf(decision.getLimit()));
        response.setHeader(HEADER_REMAINING, String.valueOf(decision.getRemaining()));
        response.setHeader(HEADER_RESET, String.valueOf(decision.getResetSeconds()));
    }
}
