package com.aboutblank.service;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Service;

import java.util.concurrent.TimeUnit;

/**
 * Fixed-window request counters per client IP, stored in Redis.
 *
 * Each policy gets its own counter per IP. The first hit in a window creates
 * the counter and sets its TTL to the window length; the counter disappears
 * when the window ends.
 *
 * Redis Key Structure:
 * - Counter: "ratelimit:{policy}:{ip}" → hits in the current window
 *
 * When Redis cannot be reached the limiter fails open: the request is allowed
 * and a warning is logged.
 *
 * @see com.aboutblank.security.RateLimitFilter
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class RateLimitService {

    private static final String KEY_PREFIX = "ratelimit:";

    private final RedisTemplate<String, String> redisStringTemplate;

    /**
     * Count one request against a policy and decide whether it may proceed.
     *
     * @param policy the policy to apply
     * @param clientIp the caller's address
     * @return the decision, with the values for the RateLimit-* headers
     */
    public Decision tryConsume(Policy policy, String clientIp) {
        String key = key(policy, clientIp);
        long windowSeconds = policy.getWindowSeconds();

        try {
            Long count = redisStringTemplate.opsForValue().increment(key);
            long hits = count != null ? count : 1L;

            // A counter without TTL is either new or lost its EXPIRE; (re)open the window.
            Long ttl = redisStringTemplate.getExpire(key, TimeUnit.SECONDS);
            if (ttl == null || ttl < 0) {
                redisStringTemplate.expire(key, windowSeconds, TimeUnit.SECONDS);
                ttl = windowSeconds;
            }

            boolean allowed = hits <= policy.getMaxRequests();
            long remaining = Math.max(0L, policy.getMaxRequests() - hits);

            if (!allowed) {
                log.warn("Rate limit exceeded: policy={}, ip={}, hits={}/{}",
                        policy.getName(), clientIp, hits, policy.getMaxRequests());
            } else {
                log.debug("Rate limit hit: policy={}, ip={}, hits={}/{}",
                        policy.getName(), clientIp, hits, policy.getMaxRequests());
            }

            return new Decision(allowed, true, policy.getMaxRequests(), remaining, ttl);
        } catch (DataAccessException ex) {
            log.warn("Rate limiter unavailable, allowing request: policy={}, ip={}, error={}",
                    policy.getName(), clientIp, ex.getMessage());
            return new Decision(true, false, policy.getMaxRequests(), policy.getMaxRequests(), windowSeconds);
        }
    }

    /**
     * Give a previously counted hit back, for policies that only count failures.
     *
     * Nothing is decremented once the window has closed; a DECR on a missing
     * key would leave a negative counter without TTL behind.
     *
     * @param policy the policy the hit was counted against
     * @param clientIp the caller's address
     */
    public void refund(Policy policy, String clientIp) {
        String key = key(policy, clientIp);
        try {
            Long ttl = redisStringTemplate.getExpire(key, TimeUnit.SECONDS);
            if (ttl == null || ttl <= 0) {
                log.debug("Rate limit window already closed, no refund: policy={}, ip={}", policy.getName(), clientIp);
                return;
            }
            redisStringTemplate.opsForValue().decrement(key);
            log.debug("Rate limit hit refunded: policy={}, ip={}", policy.getName(), clientIp);
        } catch (DataAccessException ex) {
            log.warn("Rate limiter unavailable, refund dropped: policy={}, ip={}, error={}",
                    policy.getName(), clientIp, ex.getMessage());
        }
    }

    private String key(Policy policy, String clientIp) {
        return KEY_PREFIX + policy.getName() + ":" + clientIp;
    }

    /**
     * A named request budget.
     */
    @Getter
    @AllArgsConstructor
    public static class Policy {

        private final String name;

        private final int maxRequests;

        private final long windowSeconds;

        /**
         * Responses with status below 400 give their hit back.
         */
        private final boolean skipSuccessfulRequests;

        /**
         * Detail returned to the client on 429.
         */
        private final String message;
    }

    /**
     * Outcome of counting one request.
     */
    @Getter
    @AllArgsConstructor
    public static class Decision {

        private final boolean allowed;

        /**
         * False when Redis was unavailable and the request was let through uncounted.
         */
        private final boolean tracked;

        private final int limit;

        private final long remaining;

        private final long resetSeconds;
    }
}
