package com.aiPortfolio.secureGateway.ratelimit.service;

import com.aiPortfolio.secureGateway.ratelimit.model.RateLimitResult;

import java.util.function.LongSupplier;

/**
 * Token bucket with lazy, time-based refill.
 *
 * There is no background timer: every call first credits the tokens earned since the last
 * call and then decides, inside the same critical section. Rejection is immediate, callers
 * are never queued.
 *
 * Invariant: 0 <= tokens <= capacity.
 */
public class TokenBucket {

    private static final double NANOS_PER_SECOND = 1_000_000_000d;

    private final long capacity;
    private final double refillRate;
    private final LongSupplier nanoClock;

    private double tokens;
    private long lastRefillNanos;

    public TokenBucket(long capacity, double refillRate) {
        this(capacity, refillRate, System::nanoTime);
    }

    /**
     * @param capacity maximum tokens, the bucket starts full
     * @param refillRate tokens added per second
     * @param nanoClock monotonic time source in nanoseconds
     */
    public TokenBucket(long capacity, double refillRate, LongSupplier nanoClock) {
        if (capacity < 0) {
            throw new IllegalArgumentException("capacity must be >= 0, was " + capacity);
        }
        if (refillRate < 0 || Double.isNaN(refillRate)) {
            throw new IllegalArgumentException("refillRate must be >= 0, was " + refillRate);
        }
        this.capacity = capacity;
        this.refillRate = refillRate;
        this.nanoClock = nanoClock;
        this.tokens = capacity;
        this.lastRefillNanos = nanoClock.getAsLong();
    }

    /**
     * Refills, then removes {@code amount} tokens if enough are available.
     * A rejected call leaves the token count untouched.
     *
     * @param amount tokens to remove
     * @return the decision and the whole tokens left
     */
    public synchronized RateLimitResult consume(long amount) {
        if (amount < 0) {
            throw new IllegalArgumentException("amount must be >= 0, was " + amount);
        }
        refill();

        if (tokens >= amount) {
            tokens -= amount;
            return RateLimitResult.allowed(wholeTokens());
        }
        return RateLimitResult.rejected(wholeTokens());
    }

    /**
     * Refills and returns the whole tokens available, without consuming.
     */
    public synchronized long peek() {
        refill();
        return wholeTokens();
    }

    /**
     * Refills and returns the exact (fractional) token count.
     */
    public synchronized double availableTokens() {
        refill();
        return tokens;
    }

    private void refill() {
        long now = nanoClock.getAsLong();
        long elapsedNanos = now - lastRefillNanos;
        if (elapsedNanos > 0) {
            tokens = Math.min(capacity, tokens + (elapsedNanos / NANOS_PER_SECOND) * refillRate);
        }
        lastRefillNanos = now;
    }

    private long wholeTokens() {
        return (long) Math.floor(tokens);
    }
}
