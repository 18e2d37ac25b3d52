package com.planorama.rsvp.infrastructure.ratelimit;

/**
 * Result of rate limit check.
 *
 * @author Planorama Team
 */
public class RateLimitResult {
    private final boolean allowed;
    private final int remainingRequests;
    private final long retryAfterSeconds;
    private final RateLimitPolicy policy;
    private final String reason;

    private RateLimitResult(boolean allowed, int remainingRequests, long retryAfterSeconds,
                            RateLimitPolicy policy, String reason) {
        this.allowed = allowed;
        this.remainingRequests = remainingRequests;
        this.retryAfterSeconds = retryAfterSeconds;
        this.policy = policy;
        this.reason = reason;
    }

    public static RateLimitResult allowed(int remainingRequests, RateLimitPolicy policy) {
        return new RateLimitResult(true, remainingRequests, 0, policy, null);
    }

    public static RateLimitResult rejected(long retryAfterSeconds, RateLimitPolicy policy) {
        return new RateLimitResult(false, 0, retryAfterSeconds, policy, policy.getMessage());
    }

    public boolean isAllowed() {
        return allowed;
    }

    public int getRemainingRequests() {
        return remainingRequests;
    }

    public long getRetryAfterSeconds() {
        return retryAfterSeconds;
    }

    public RateLimitPolicy getPolicy() {
        return policy;
    }

    public String getReason() {
        return reason;
    }
}
