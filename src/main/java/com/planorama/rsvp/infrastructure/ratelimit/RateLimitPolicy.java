package com.planorama.rsvp.infrastructure.ratelimit;

/**
 * Fixed-window request budgets, applied per client IP.
 *
 * @author Planorama Team
 */
public enum RateLimitPolicy {

    /**
     * Login and signup: 5 requests per 15 minutes.
     */
    AUTH(5, 900, "Too many authentication attempts, please try again later"),

    /**
     * Organizer API reads and writes: 100 requests per 15 minutes.
     */
    API(100, 900, "Too many requests, please try again later"),

    /**
     * RSVP submissions: 20 requests per minute.
     */
    RSVP(20, 60, "Too many RSVP requests, please try again later");

    private final int maxRequests;
    private final int windowSeconds;
    private final String message;

    RateLimitPolicy(int maxRequests, int windowSeconds, String message) {
        this.maxRequests = maxRequests;
        this.windowSeconds = windowSeconds;
        this.message = message;
    }

    public int getMaxRequests() {
        return maxRequests;
    }

    public int getWindowSeconds() {
        return windowSeconds;
    }

    public String getMessage() {
        return message;
    }
}
