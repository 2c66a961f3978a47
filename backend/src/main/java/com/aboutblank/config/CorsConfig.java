package com.aboutblank.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.cors.CorsConfiguration;
import org.springframework.web.cors.CorsConfigurationSource;
import org.springframework.web.cors.UrlBasedCorsConfigurationSource;

import java.util.List;

/**
 * CORS (Cross-Origin Resource Sharing) configuration for the web client.
 *
 * The mobile app does not need CORS; only the browser build of the app and
 * local development servers do, so origins are an explicit allow-list.
 *
 * Features:
 * - Allowed origins from app.cors.allowed-origins (CORS_ALLOWED_ORIGINS)
 * - Credentials support
 * - The auth key header accepted on cross-origin requests
 * - RateLimit-* headers exposed so the client can back off
 *
 * Spring Security picks the CorsConfigurationSource bean up through
 * {@code .cors(Customizer.withDefaults())} in SecurityConfig, so preflight
 * requests are answered before authentication runs.
 */
@Configuration
@Slf4j
public class CorsConfig {

    @Value("${app.cors.allowed-origins:https://aboutblank.ie,http://localhost:3003}")
    private List<String> allowedOrigins;

    @Value("${app.cors.allowed-methods:GET,POST,OPTIONS}")
    private List<String> allowedMethods;

    @Value("${app.cors.allowed-headers:Content-Type,Accept,Origin,X-Auth-Key}")
    private List<String> allowedHeaders;

    @Value("${app.cors.exposed-headers:RateLimit-Limit,RateLimit-Remaining,RateLimit-Reset,Retry-After}")
    private List<String> exposedHeaders;

    @Value("${app.cors.allow-credentials:true}")
    private boolean allowCredentials;

    @Value("${app.cors.max-age:3600}")
    private long maxAge;

    /**
     * Configure the CORS policy applied to all paths.
     *
     * When credentials are enabled, allowed origins cannot be "*"; explicit
     * origins must be configured.
     *
     * @return CORS configuration source used by the security filter chain
     */
    @Bean
    public CorsConfigurationSource corsConfigurationSource() {
        CorsConfiguration config = new CorsConfiguration();

        config.setAllowedOrigins(allowedOrigins);
        log.info("CORS allowed origins: {}", allowedOrigins);

        config.setAllowedMethods(allowedMethods);
        config.setAllowedHeaders(allowedHeaders);
        config.setExposedHeaders(exposedHeaders);
        config.setAllowCredentials(allowCredentials);
        config.setMaxAge(maxAge);
        log.debug("CORS methods={}, headers={}, exposed={}, credentials={}, max-age={}s",
                allowedMethods, allowedHeaders, exposedHeaders, allowCredentials, maxAge);

        UrlBasedCorsConfigurationSource source = new UrlBasedCorsConfigurationSource();
        source.registerCorsConfiguration("/**", config);
        return source;
    }
}
