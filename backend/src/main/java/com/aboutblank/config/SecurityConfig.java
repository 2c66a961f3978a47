package com.aboutblank.config;

import com.aboutblank.security.AuthKeyAuthenticationEntryPoint;
import com.aboutblank.security.AuthKeyAuthenticationFilter;
import com.aboutblank.security.RateLimitFilter;
import com.aboutblank.security.RequestSizeLimitFilter;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpMethod;
import org.springframework.security.config.Customizer;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.annotation.web.configurers.AbstractHttpConfigurer;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.UsernamePasswordAuthenticationFilter;

/**
 * Spring Security configuration for auth-key based access.
 *
 * - Stateless; no sessions, no CSRF tokens, no form or basic login
 * - CORS from the CorsConfigurationSource bean in CorsConfig
 * - Public: /health, POST /api/community/message, GET /api/community/messages
 * - Every other route requires a valid auth key
 *
 * Filter order inside the chain (after CORS):
 * 1. RequestSizeLimitFilter: 413 for oversized bodies
 * 2. RateLimitFilter: 429 once an IP exhausts its budget
 * 3. AuthKeyAuthenticationFilter: validates the key and registers unseen users
 *
 * Requests that reach a protected route without an authentication end in
 * AuthKeyAuthenticationEntryPoint (401).
 *
 * @see com.aboutblank.security.AuthKeyAuthenticationFilter
 * @see com.aboutblank.config.CorsConfig
 */
@Configuration
@EnableWebSecurity
@RequiredArgsConstructor
public class SecurityConfig {

    private final RequestSizeLimitFilter requestSizeLimitFilter;
    private final RateLimitFilter rateLimitFilter;
    private final AuthKeyAuthenticationFilter authKeyAuthenticationFilter;
    private final AuthKeyAuthenticationEntryPoint authKeyAuthenticationEntryPoint;

    @Bean
    public SecurityFilterChain filterChain(HttpSecurity http) throws Exception {
        http
                .csrf(AbstractHttpConfigurer::disable)
                .cors(Customizer.withDefaults())
                .httpBasic(AbstractHttpConfigurer::disable)
                .formLogin(AbstractHttpConfigurer::disable)

                .authorizeHttpRequests(auth -> auth
                        .requestMatchers(HttpMethod.OPTIONS, "/**").permitAll()
                        .requestMatchers("/health", "/error").permitAll()
                        .requestMatchers(HttpMethod.POST, "/api/community/message").permitAll()
                        .requestMatchers(HttpMethod.GET, "/api/community/messages").permitAll()
                        .anyRequest().authenticated()
                )

                .sessionManagement(session -> session
                        .sessionCreationPolicy(SessionCreationPolicy.STATELESS)
                )

                .exceptionHandling(exceptions -> exceptions
                        .authenticationEntryPoint(authKeyAuthenticationEntryPoint)
                )

                .addFilterBefore(authKeyAuthenticationFilter, UsernamePasswordAuthenticationFilter.class)
                .addFilterBefore(rateLimitFilter, AuthKeyAuthenticationFilter.class)
                .addFilterBefore(requestSizeLimitFilter, RateLimitFilter.class);

        return http.build();
    }

    // The filters are @Components so they can be injected above; keep the servlet
    // container from registering them a second time outside the security chain.

    @Bean
    public FilterRegistrationBean<AuthKeyAuthenticationFilter> authKeyFilterRegistration(
            AuthKeyAuthenticationFilter filter) {
        FilterRegistrationBean<AuthKeyAuthenticationFilter> registration = new FilterRegistrationBean<>(filter);
        registration.setEnabled(false);
        return registration;
    }

    @Bean
    public FilterRegistrationBean<RateLimitFilter> rateLimitFilterRegistration(RateLimitFilter filter) {
        FilterRegistrationBean<RateLimitFilter> registration = new FilterRegistrationBean<>(filter);
        registration.setEnabled(false);
        return registration;
    }

    @Bean
    public FilterRegistrationBean<RequestSizeLimitFilter> requestSizeLimitFilterRegistration(
            RequestSizeLimitFilter filter) {
        FilterRegistrationBean<RequestSizeLimitFilter> registration = new FilterRegistrationBean<>(filter);
        registration.setEnabled(false);
        return registration;
    }
}
