package com.aiPortfolio.secureGateway.ratelimit.model;

/**
 * Outcome of a single rate limit check.
 *
 * @param allowed whether the tokens were consumed
 * @param remaining whole tokens left in the bucket after the check
 */
public record RateLimitResult(boolean allowed, long remaining) {

    public static RateLimitResult allowed(long remaining) {
        return new RateLimitResult(true, remaining);
    }

    public static RateLimitResult rejected(long remaining) {
        return new RateLimitResult(false, remaining);
    }
}
