package com.aboutblank.security;

import com.aboutblank.service.RateLimitService;
import com.aboutblank.service.RateLimitService.Decision;
import com.aboutblank.service.RateLimitService.Policy;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.FilterChain;
import jakarta.servlet.http.HttpServletResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentMatcher;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.test.util.ReflectionTestUtils;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for RateLimitFilter.
 *
 * Covers:
 * - Header values on allowed requests
 * - 429 with Retry-After once a budget is exhausted
 * - Strict route counting and the refund for successful responses
 * - Fail-open behaviour when counters are unavailable
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("RateLimitFilter Unit Tests")
class RateLimitFilterTest {

    private static final String CLIENT_IP = "203.0.113.9";

    @Mock
    private RateLimitService rateLimitService;

    private RateLimitFilter filter;

    @BeforeEach
    void setUp() throws Exception {
        filter = new RateLimitFilter(rateLimitService, new ObjectMapper());
        ReflectionTestUtils.setField(filter, "generalMaxRequests", 100);
        ReflectionTestUtils.setField(filter, "generalWindowMinutes", 15);
        ReflectionTestUtils.setField(filter, "strictMaxRequests", 5);
        ReflectionTestUtils.setField(filter, "strictWindowMinutes", 60);
        ReflectionTestUtils.setField(filter, "strictSkipSuccessfulRequests", true);
        filter.afterPropertiesSet();
    }

    @Test
    @DisplayName("allowed request should carry RateLimit headers and continue")
    void testAllowed_SetsHeaders() throws Exception {
        // Arrange
        MockHttpServletRequest request = request("GET", "/api/progress");
        MockHttpServletResponse response = new MockHttpServletResponse();
        MockFilterChain chain = new MockFilterChain();
        when(rateLimitService.tryConsume(argThat(policyNamed("general")), eq(CLIENT_IP)))
                .thenReturn(new Decision(true, true, 100, 99, 900));

        // Act
        filter.doFilter(request, response, chain);

        // Assert
        assertNotNull(chain.getRequest());
        assertEquals("100", response.getHeader("RateLimit-Limit"));
        assertEquals("99", response.getHeader("RateLimit-Remaining"));
        assertEquals("900", response.getHeader("RateLimit-Reset"));
    }

    @Test
    @DisplayName("exhausted general budget should answer 429 with Retry-After")
    void testGeneralExhausted_Returns429() throws Exception {
        // Arrange
        MockHttpServletRequest request = request("GET", "/api/cravings");
        MockHttpServletResponse response = new MockHttpServletResponse();
        MockFilterChain chain = new MockFilterChain();
        when(rateLimitService.tryConsume(argThat(policyNamed("general")), eq(CLIENT_IP)))
                .thenReturn(new Decision(false, true, 100, 0, 321));

        // Act
        filter.doFilter(request, response, chain);

        // Assert
        assertEquals(429, response.getStatus());
        assertEquals("321", response.getHeader("Retry-After"));
        assertEquals("0", response.getHeader("RateLimit-Remaining"));
        assertTrue(response.getContentAsString().contains("Too many requests, please try again later"));
        assertNull(chain.getRequest());
    }

    @Test
    @DisplayName("strict route should be counted against both policies and reject with its own message")
    void testStrictExhausted_Returns429() throws Exception {
        // Arrange
        MockHttpServletRequest request = request("POST", "/api/community/message");
        MockHttpServletResponse response = new MockHttpServletResponse();
        when(rateLimitService.tryConsume(argThat(policyNamed("general")), eq(CLIENT_IP)))
                .thenReturn(new Decision(true, true, 100, 50, 900));
        when(rateLimitService.tryConsume(argThat(policyNamed("strict")), eq(CLIENT_IP)))
                .thenReturn(new Decision(false, true, 5, 0, 3000));

        // Act
        filter.doFilter(request, response, new MockFilterChain());

        // Assert
        assertEquals(429, response.getStatus());
        assertEquals("5", response.getHeader("RateLimit-Limit"));
        assertTrue(response.getContentAsString().contains("Too many authentication attempts"));
        verify(rateLimitService, never()).refund(any(), anyString());
    }

    @Test
    @DisplayName("successful strict request should give its hit back")
    void testStrictSuccess_Refunded() throws Exception {
        // Arrange
        MockHttpServletRequest request = request("POST", "/api/community/message");
        MockHttpServletResponse response = new MockHttpServletResponse();
        when(rateLimitService.tryConsume(any(Policy.class), eq(CLIENT_IP)))
                .thenReturn(new Decision(true, true, 5, 4, 3600));

        // Act
        filter.doFilter(request, response, new MockFilterChain());

        // Assert
        verify(rateLimitService).refund(argThat(policyNamed("strict")), eq(CLIENT_IP));
    }

    @Test
    @DisplayName("failed strict request should keep its hit")
    void testStrictFailure_Counted() throws Exception {
        // Arrange
        MockHttpServletRequest request = request("POST", "/api/community/message");
        MockHttpServletResponse response = new MockHttpServletResponse();
        FilterChain rejectingChain = (req, res) -> ((HttpServletResponse) res).setStatus(400);
        when(rateLimitService.tryConsume(any(Policy.class), eq(CLIENT_IP)))
                .thenReturn(new Decision(true, true, 5, 4, 3600));

        // Act
        filter.doFilter(request, response, rejectingChain);

        // Assert
        assertEquals(400, response.getStatus());
        verify(rateLimitService, never()).refund(any(), anyString());
    }

    @Test
    @DisplayName("untracked decision should let the request through without headers")
    void testFailOpen_NoHeaders() throws Exception {
        // Arrange
        MockHttpServletRequest request = request("GET", "/api/progress");
        MockHttpServletResponse response = new MockHttpServletResponse();
        MockFilterChain chain = new MockFilterChain();
        when(rateLimitService.tryConsume(any(Policy.class), eq(CLIENT_IP)))
                .thenReturn(new Decision(true, false, 100, 100, 900));

        // Act
        filter.doFilter(request, response, chain);

        // Assert
        assertNotNull(chain.getRequest());
        assertNull(response.getHeader("RateLimit-Limit"));
    }

    @Test
    @DisplayName("health endpoint should not be rate limited")
    void testHealth_NotLimited() throws Exception {
        // Arrange
        MockHttpServletRequest request = request("GET", "/health");

        // Act
        filter.doFilter(request, new MockHttpServletResponse(), new MockFilterChain());

        // Assert
        verifyNoInteractions(rateLimitService);
    }

    private MockHttpServletRequest request(String method, String path) {
        MockHttpServletRequest request = new MockHttpServletRequest(method, path);
        request.setServletPath(path);
        request.setRemoteAddr(CLIENT_IP);
        return request;
    }

    private static ArgumentMatcher<Policy> policyNamed(String name) {
        return policy -> policy != null && name.equals(policy.getName());
    }
}
