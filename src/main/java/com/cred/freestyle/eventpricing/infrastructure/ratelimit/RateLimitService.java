package com.cred.freestyle.eventpricing.infrastructure.ratelimit;

import com.cred.freestyle.eventpricing.infrastructure.metrics.PricingMetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.ZSetOperations;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Set;
import java.util.UUID;

/**
 * Per-customer booking rate limiting with a sliding window on Redis.
 *
 * Algorithm:
 * 1. Drop request timestamps older than the window from the customer's sorted set
 * 2. Record the current request (score = epoch millis)
 * 3. Count the requests in the window
 * 4. Over the limit: remove the request just recorded and reject with a retry-after
 *
 * Recording before counting means two racing requests can both be rejected at the
 * boundary, never both accepted past it.
 *
 * Redis failures fail open: the request is allowed and the error is recorded.
 *
 * @author Event Pricing Team
 */
@Service
public class RateLimitService {

    private static final Logger logger = LoggerFactory.getLogger(RateLimitService.class);

    private static final String KEY_PREFIX = "rate_limit:booking:";

    private final RedisTemplate<String, String> redisTemplate;
    private final PricingMetricsService metricsService;

    @Value("${eventpricing.rate-limiting.enabled:true}")
    private boolean enabled = true;

    @Value("${eventpricing.rate-limiting.max-requests:5}")
    private int maxRequests = 5;

    @Value("${eventpricing.rate-limiting.window-seconds:60}")
    private long windowSeconds = 60;

    public RateLimitService(RedisTemplate<String, String> redisTemplate, PricingMetricsService metricsService) {
        this.redisTemplate = redisTemplate;
        this.metricsService = metricsService;
    }

    /**
     * Check and record a booking request of a customer.
     *
     * @param customerEmail Normalized customer email
     * @return RateLimitResult with allow/reject decision
     */
    public RateLimitResult checkRateLimit(String customerEmail) {
        if (!enabled) {
            return RateLimitResult.allowed(maxRequests);
        }

        String key = KEY_PREFIX + customerEmail;
        long now = System.currentTimeMillis();
        long windowMillis = windowSeconds * 1000;
        String member = now + ":" + UUID.randomUUID();

        try {
            ZSetOperations<String, String> window = redisTemplate.opsForZSet();
            window.removeRangeByScore(key, 0, now - windowMillis);
            window.add(key, member, now);
            redisTemplate.expire(key, Duration.ofSeconds(windowSeconds));

            Long count = window.zCard(key);
            if (count == null || count <= maxRequests) {
                int remaining = count == null ? maxRequests : (int) (maxRequests - count);
                logger.debug("Rate limit check PASSED for customer: {}, remaining: {}", customerEmail, remaining);
                return RateLimitResult.allowed(remaining);
            }

            window.remove(key, member);
            long retryAfterSeconds = retryAfter(window, key, now, windowMillis);
            logger.warn("Rate limit EXCEEDED for customer: {}, {} requests in {}s",
                    customerEmail, count - 1, windowSeconds);
            metricsService.recordRateLimited();

            return RateLimitResult.rejected(retryAfterSeconds,
                    String.format("Too many booking requests. Please retry after %d seconds", retryAfterSeconds));

        } catch (Exception e) {
            logger.error("Error checking rate limit for customer: {}, defaulting to ALLOW", customerEmail, e);
            metricsService.recordError("RATE_LIMIT_CHECK_ERROR", "checkRateLimit");
            return RateLimitResult.allowed(maxRequests);
        }
    }

    /**
     * Seconds until the oldest request in the window leaves it.
     */
    private long retryAfter(ZSetOperations<String, String> window, String key, long now, long windowMillis) {
        Set<ZSetOperations.TypedTuple<String>> oldest = window.rangeWithScores(key, 0, 0);
        if (oldest == null || oldest.isEmpty()) {
            return windowSeconds;
        }
        Double oldestScore = oldest.iterator().next().getScore();
        if (oldestScore == null) {
            return windowSeconds;
        }
        long waitMillis = oldestScore.longValue() + windowMillis - now;
        return Math.max(1, (waitMillis + 999) / 1000);
    }
}
