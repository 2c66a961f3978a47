package com.aboutblank.security;

import com.aboutblank.exception.ProblemDetails;
import com.aboutblank.exception.SyncOperationException;
import com.aboutblank.service.UserService;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.lang.NonNull;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.authentication.WebAuthenticationDetailsSource;
import org.springframework.security.web.util.matcher.AntPathRequestMatcher;
import org.springframework.security.web.util.matcher.OrRequestMatcher;
import org.springframework.security.web.util.matcher.RequestMatcher;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.List;

/**
 * Auth key filter guarding every per-user route.
 *
 * Filter Execution Flow:
 * 1. Read the key from the auth header (X-Auth-Key by default)
 * 2. Reject keys that are not 64 hex characters without touching the datastore
 * 3. Get-or-create the user row, which also refreshes last_active
 * 4. Set a UsernamePasswordAuthenticationToken whose principal is the key
 * 5. Pass the request to the next filter in the chain
 *
 * A missing or malformed key leaves the SecurityContext empty; authorization
 * then fails and AuthKeyAuthenticationEntryPoint answers 401 with the reason
 * stored under {@link #AUTH_ERROR_ATTRIBUTE}. A datastore failure during the
 * upsert is answered here with 500, since the key itself may be fine.
 *
 * The public community routes are skipped.
 *
 * @see AuthKeyAuthenticationEntryPoint
 * @see com.aboutblank.service.UserService
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AuthKeyAuthenticationFilter extends OncePerRequestFilter {

    /**
     * Request attribute carrying the client-facing reason authentication failed.
     */
    public static final String AUTH_ERROR_ATTRIBUTE = AuthKeyAuthenticationFilter.class.getName() + ".error";

    static final String MISSING_KEY_MESSAGE = "Authentication required";
    static final String INVALID_KEY_MESSAGE = "Invalid authentication";

    private static final RequestMatcher PUBLIC_API_ROUTES = new OrRequestMatcher(
            new AntPathRequestMatcher("/api/community/message", HttpMethod.POST.name()),
            new AntPathRequestMatcher("/api/community/messages", HttpMethod.GET.name())
    );

    private final UserService userService;
    private final ObjectMapper objectMapper;

    @Value("${app.auth.header-name:X-Auth-Key}")
    private String headerName;

    @Override
    protected void doFilterInternal(
            @NonNull HttpServletRequest request,
            @NonNull HttpServletResponse response,
            @NonNull FilterChain filterChain
    ) throws ServletException, IOException {
        String authKey = request.getHeader(headerName);

        if (authKey == null || authKey.isEmpty()) {
            log.debug("No auth key on path: {}", request.getRequestURI());
            request.setAttribute(AUTH_ERROR_ATTRIBUTE, MISSING_KEY_MESSAGE);
            filterChain.doFilter(request, response);
            return;
        }

        if (!AuthKeys.isValid(authKey)) {
            log.warn("Malformed auth key {} on path: {}", AuthKeys.abbreviate(authKey), request.getRequestURI());
            request.setAttribute(AUTH_ERROR_ATTRIBUTE, INVALID_KEY_MESSAGE);
            filterChain.doFilter(request, response);
            return;
        }

        try {
            userService.getOrCreate(authKey);
        } catch (SyncOperationException ex) {
            SecurityContextHolder.clearContext();
            ProblemDetails.write(response, objectMapper, ProblemDetails.create(
                    HttpStatus.INTERNAL_SERVER_ERROR,
                    "Authentication Failed",
                    "Authentication failed",
                    request.getRequestURI(),
                    "internal-error"
            ));
            return;
        }

        UsernamePasswordAuthenticationToken authentication = new UsernamePasswordAuthenticationToken(
                authKey,
                null,
                List.of(new SimpleGrantedAuthority("ROLE_USER"))
        );
        authentication.setDetails(new WebAuthenticationDetailsSource().buildDetails(request));
        SecurityContextHolder.getContext().setAuthentication(authentication);

        log.debug("Authenticated key {} on path: {}", AuthKeys.abbreviate(authKey), request.getRequestURI());

        filterChain.doFilter(request, response);
    }

    /**
     * Only API routes are guarded, minus the anonymous community board.
     */
    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) throws ServletException {
        String path = request.getRequestURI();
        if (!path.startsWith("/api/")) {
            return true;
        }
        return PUBLIC_API_ROUTES.matches(request);
    }
}
