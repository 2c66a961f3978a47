package com.aboutblank.service;

import com.aboutblank.service.RateLimitService.Decision;
import com.aboutblank.service.RateLimitService.Policy;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for RateLimitService.
 *
 * Tests the fixed-window counters including:
 * - Window creation on the first hit
 * - Remaining budget and reset values
 * - Rejection once the budget is spent
 * - Fail-open when Redis is unreachable
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("RateLimitService Unit Tests")
class RateLimitServiceTest {

    private static final String CLIENT_IP = "198.51.100.7";
    private static final String KEY = "ratelimit:general:" + CLIENT_IP;
    private static final Policy POLICY = new Policy("general", 3, 900L, false, "Too many requests");

    @Mock
    private RedisTemplate<String, String> redisStringTemplate;

    @Mock
    private ValueOperations<String, String> valueOperations;

    @InjectMocks
    private RateLimitService rateLimitService;

    @BeforeEach
    void setUp() {
        lenient().when(redisStringTemplate.opsForValue()).thenReturn(valueOperations);
    }

    @Test
    @DisplayName("first hit should open a window with the policy TTL")
    void testTryConsume_FirstHitOpensWindow() {
        // Arrange
        when(valueOperations.increment(KEY)).thenReturn(1L);
        when(redisStringTemplate.getExpire(KEY, TimeUnit.SECONDS)).thenReturn(-1L);

        // Act
        Decision decision = rateLimitService.tryConsume(POLICY, CLIENT_IP);

        // Assert
        assertTrue(decision.isAllowed());
        assertTrue(decision.isTracked());
        assertEquals(3, decision.getLimit());
        assertEquals(2, decision.getRemaining());
        assertEquals(900, decision.getResetSeconds());
        verify(redisStringTemplate).expire(KEY, 900L, TimeUnit.SECONDS);
    }

    @Test
    @DisplayName("hits inside an open window should not reset its TTL")
    void testTryConsume_InsideWindow() {
        // Arrange
        when(valueOperations.increment(KEY)).thenReturn(2L);
        when(redisStringTemplate.getExpire(KEY, TimeUnit.SECONDS)).thenReturn(500L);

        // Act
        Decision decision = rateLimitService.tryConsume(POLICY, CLIENT_IP);

        // Assert
        assertTrue(decision.isAllowed());
        assertEquals(1, decision.getRemaining());
        assertEquals(500, decision.getResetSeconds());
        verify(redisStringTemplate, never()).expire(anyString(), anyLong(), any(TimeUnit.class));
    }

    @Test
    @DisplayName("hit beyond the budget should be rejected")
    void testTryConsume_OverLimit() {
        // Arrange
        when(valueOperations.increment(KEY)).thenReturn(4L);
        when(redisStringTemplate.getExpire(KEY, TimeUnit.SECONDS)).thenReturn(120L);

        // Act
        Decision decision = rateLimitService.tryConsume(POLICY, CLIENT_IP);

        // Assert
        assertFalse(decision.isAllowed());
        assertEquals(0, decision.getRemaining());
        assertEquals(120, decision.getResetSeconds());
    }

    @Test
    @DisplayName("last hit of the budget should still be allowed")
    void testTryConsume_ExactlyAtLimit() {
        // Arrange
        when(valueOperations.increment(KEY)).thenReturn(3L);
        when(redisStringTemplate.getExpire(KEY, TimeUnit.SECONDS)).thenReturn(10L);

        // Act
        Decision decision = rateLimitService.tryConsume(POLICY, CLIENT_IP);

        // Assert
        assertTrue(decision.isAllowed());
        assertEquals(0, decision.getRemaining());
    }

    @Test
    @DisplayName("unreachable Redis should fail open with an untracked decision")
    void testTryConsume_RedisDown() {
        // Arrange
        when(valueOperations.increment(KEY)).thenThrow(new RedisConnectionFailureException("connection refused"));

        // Act
        Decision decision = rateLimitService.tryConsume(POLICY, CLIENT_IP);

        // Assert
        assertTrue(decision.isAllowed());
        assertFalse(decision.isTracked());
    }

    @Test
    @DisplayName("refund should decrement the counter while the window is open")
    void testRefund() {
        // Arrange
        when(redisStringTemplate.getExpire(KEY, TimeUnit.SECONDS)).thenReturn(600L);

        // Act
        rateLimitService.refund(POLICY, CLIENT_IP);

        // Assert
        verify(valueOperations).decrement(KEY);
    }

    @Test
    @DisplayName("refund should swallow Redis outages after logging")
    void testRefund_RedisDown() {
        // Arrange
        when(redisStringTemplate.getExpire(KEY, TimeUnit.SECONDS)).thenReturn(600L);
        when(valueOperations.decrement(KEY)).thenThrow(new RedisConnectionFailureException("connection refused"));

        // Act & Assert
        assertDoesNotThrow(() -> rateLimitService.refund(POLICY, CLIENT_IP));
    }

    @Test
    @DisplayName("refund after the window expired should not recreate the counter")
    void testRefund_WindowExpired() {
        // Arrange
        when(redisStringTemplate.getExpire(KEY, TimeUnit.SECONDS)).thenReturn(-2L);

        // Act
        rateLimitService.refund(POLICY, CLIENT_IP);

        // Assert
        verify(valueOperations, never()).decrement(anyString());
    }

    @Test
    @DisplayName("refund should not touch a counter that has no TTL")
    void testRefund_CounterWithoutTtl() {
        // Arrange
        when(redisStringTemplate.getExpire(KEY, TimeUnit.SECONDS)).thenReturn(-1L);

        // Act
        rateLimitService.refund(POLICY, CLIENT_IP);

        // Assert
        verify(valueOperations, never()).decrement(anyString());
    }
}
