package com.planorama.rsvp.infrastructure.ratelimit;

import com.planorama.rsvp.infrastructure.metrics.CloudWatchMetricsService;
import org.junit.jupiter.api.*;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import redis.embedded.RedisServer;

import java.io.IOException;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

/**
 * Integration tests for RateLimitService using embedded Redis.
 * Counts requests against a real Redis instance.
 */
@DisplayName("Rate Limit Redis Integration Tests")
class RateLimitServiceIT {

    private static final int REDIS_PORT = 6371;

    private static RedisServer redisServer;
    private static LettuceConnectionFactory connectionFactory;

    private StringRedisTemplate redisTemplate;
    private CloudWatchMetricsService metricsService;
    private RateLimitService rateLimitService;

    @BeforeAll
    static void startRedis() throws IOException {
        redisServer = new RedisServer(REDIS_PORT);
        redisServer.start();

        connectionFactory = new LettuceConnectionFactory("localhost", REDIS_PORT);
        connectionFactory.afterPropertiesSet();
    }

    @AfterAll
    static void stopRedis() {
        if (connectionFactory != null) {
            connectionFactory.destroy();
        }
        if (redisServer != null) {
            redisServer.stop();
        }
    }

    @BeforeEach
    void setUp() {
        redisTemplate = new StringRedisTemplate(connectionFactory);
        redisTemplate.afterPropertiesSet();
        Set<String> keys = redisTemplate.keys("rate_limit:*");
        if (keys != null && !keys.isEmpty()) {
            redisTemplate.delete(keys);
        }

        metricsService = mock(CloudWatchMetricsService.class);
        rateLimitService = new RateLimitService(redisTemplate, metricsService);
    }

    @Test
    @DisplayName("Auth budget allows five attempts and rejects the sixth")
    void checkRateLimit_AuthBudgetExhausted_RejectsSixth() {
        // Given
        for (int i = 0; i < 5; i++) {
            assertThat(rateLimitService.checkRateLimit(RateLimitPolicy.AUTH, "10.0.0.1").isAllowed()).isTrue();
        }

        // When
        RateLimitResult result = rateLimitService.checkRateLimit(RateLimitPolicy.AUTH, "10.0.0.1");

        // Then
        assertThat(result.isAllowed()).isFalse();
        assertThat(result.getRetryAfterSeconds()).isBetween(1L, 900L);
        verify(metricsService).recordRateLimitRejection("AUTH");
    }

    @Test
    @DisplayName("Counters are kept per client and expire with their window")
    void checkRateLimit_SeparateClients_SeparateCounters() {
        // When
        rateLimitService.checkRateLimit(RateLimitPolicy.RSVP, "10.0.0.1");
        rateLimitService.checkRateLimit(RateLimitPolicy.RSVP, "10.0.0.1");
        RateLimitResult other = rateLimitService.checkRateLimit(RateLimitPolicy.RSVP, "10.0.0.2");

        // Then
        assertThat(other.getRemainingRequests()).isEqualTo(19);

        Set<String> keys = redisTemplate.keys("rate_limit:rsvp:10.0.0.1:*");
        assertThat(keys).hasSize(1);
        Long ttl = redisTemplate.getExpire(keys.iterator().next());
        assertThat(ttl).isBetween(1L, 60L);
    }
}
