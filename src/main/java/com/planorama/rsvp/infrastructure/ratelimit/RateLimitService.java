package com.planorama.rsvp.infrastructure.ratelimit;

import com.planorama.rsvp.infrastructure.metrics.CloudWatchMetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;

/**
 * Fixed-window rate limiting backed by Redis counters.
 *
 * Each (policy, client, window) gets one counter key that expires with its window, so all
 * application instances share the same budget. The check fails open: if Redis is unavailable
 * the request is allowed and an error metric is recorded.
 *
 * @author Planorama Team
 */
@Service
public class RateLimitService {

    private static final Logger logger = LoggerFactory.getLogger(RateLimitService.class);

    private static final String KEY_PREFIX = "rate_limit:";

    private final StringRedisTemplate redisTemplate;
    private final CloudWatchMetricsService metricsService;
    private final Clock clock;

    public RateLimitService(StringRedisTemplate redisTemplate, CloudWatchMetricsService metricsService) {
        this(redisTemplate, metricsService, Clock.systemUTC());
    }

    RateLimitService(StringRedisTemplate redisTemplate, CloudWatchMetricsService metricsService, Clock clock) {
        this.redisTemplate = redisTemplate;
        this.metricsService = metricsService;
        this.clock = clock;
    }

    /**
     * Count one request against the client's budget for the policy.
     *
     * @param policy Rate limit policy
     * @param clientId Client identifier (IP address)
     * @return RateLimitResult with allow/reject decision
     */
    public RateLimitResult checkRateLimit(RateLimitPolicy policy, String clientId) {
        long nowSeconds = clock.millis() / 1000;
        long windowStart = nowSeconds - (nowSeconds % policy.getWindowSeconds());
        String key = KEY_PREFIX + policy.name().toLowerCase() + ":" + clientId + ":" + windowStart;

        try {
            Long count = redisTemplate.opsForValue().increment(key);
            if (count != null && count == 1L) {
                redisTemplate.expire(key, Duration.ofSeconds(policy.getWindowSeconds()));
            }

            if (count == null || count <= policy.getMaxRequests()) {
                int remaining = count == null ? policy.getMaxRequests() : (int) (policy.getMaxRequests() - count);
                return RateLimitResult.allowed(remaining, policy);
            }

            long retryAfter = Math.max(1, windowStart + policy.getWindowSeconds() - nowSeconds);
            logger.warn("Rate limit EXCEEDED for client: {}, policy: {}, count: {}", clientId, policy, count);
            metricsService.recordRateLimitRejection(policy.name());
            return RateLimitResult.rejected(retryAfter, policy);

        } catch (Exception e) {
            logger.error("Error checking rate limit for client: {}, defaulting to ALLOW", clientId, e);
            metricsService.recordError("RATE_LIMIT_CHECK_ERROR", "checkRateLimit");
            return RateLimitResult.allowed(policy.getMaxRequests(), policy);
        }
    }
}
