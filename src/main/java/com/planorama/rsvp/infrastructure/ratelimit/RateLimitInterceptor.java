package com.planorama.rsvp.infrastructure.ratelimit;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.web.servlet.HandlerInterceptor;

/**
 * Interceptor applying one {@link RateLimitPolicy} before controller methods execute.
 * Rejected requests get a 429 JSON body and a Retry-After header.
 *
 * @author Planorama Team
 */
public class RateLimitInterceptor implements HandlerInterceptor {

    private static final Logger logger = LoggerFactory.getLogger(RateLimitInterceptor.class);

    private final RateLimitService rateLimitService;
    private final RateLimitPolicy policy;
    private final boolean writesOnly;

    /**
     * @param rateLimitService Shared counter service
     * @param policy Budget to enforce
     * @param writesOnly Only count POST requests (GETs pass through untouched)
     */
    public RateLimitInterceptor(RateLimitService rateLimitService, RateLimitPolicy policy, boolean writesOnly) {
        this.rateLimitService = rateLimitService;
        this.policy = policy;
        this.writesOnly = writesOnly;
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler)
            throws Exception {

        if (writesOnly && !"POST".equalsIgnoreCase(request.getMethod())) {
            return true;
        }

        String ipAddress = getClientIp(request);
        RateLimitResult result = rateLimitService.checkRateLimit(policy, ipAddress);

        response.setHeader("X-RateLimit-Limit", String.valueOf(policy.getMaxRequests()));

        if (result.isAllowed()) {
            response.setHeader("X-RateLimit-Remaining", String.valueOf(result.getRemainingRequests()));
            return true;
        }

        logger.warn("Rate limit exceeded for ip: {}, policy: {}, path: {}", ipAddress, policy, request.getRequestURI());

        response.setStatus(HttpStatus.TOO_MANY_REQUESTS.value());
        response.setHeader("Retry-After", String.valueOf(result.getRetryAfterSeconds()));
        response.setHeader("X-RateLimit-Remaining", "0");
        response.setContentType("application/json");

        String errorJson = String.format(
            "{\"status\":429,\"error\":\"Too Many Requests\",\"message\":\"%s\",\"retryAfter\":%d}",
            result.getReason(),
            result.getRetryAfterSeconds()
        );
        response.getWriter().write(errorJson);

        return false;
    }

    /**
     * Get client IP address, handling proxies and load balancers.
     *
     * @param request HTTP request
     * @return Client IP address
     */
    static String getClientIp(HttpServletRequest request) {
        // First entry of X-Forwarded-For is the original client
        String xForwardedFor = request.getHeader("X-Forwarded-For");
        if (xForwardedFor != null && !xForwardedFor.isEmpty()) {
            return xForwardedFor.split(",")[0].trim();
        }

        String xRealIp = request.getHeader("X-Real-IP");
        if (xRealIp != null && !xRealIp.isEmpty()) {
            return xRealIp;
        }

        return request.getRemoteAddr();
    }
}
