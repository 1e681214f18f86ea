package com.aiPortfolio.secureGateway.ratelimit.service;

import com.aiPortfolio.secureGateway.gateway.util.ClientIdentityMasker;
import com.aiPortfolio.secureGateway.ratelimit.model.RateLimitResult;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.RemovalCause;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.function.LongSupplier;

/**
 * Token bucket rate limiter keyed by client identity.
 *
 * Per-client mode keeps one bucket per identity, created lazily on the first request.
 * Global mode sends every caller through a single shared bucket.
 *
 * Per-client buckets live in a Caffeine cache so the map cannot grow without bound:
 * - entries idle longer than {@code idleTtl} expire. A bucket that has been idle for at least
 *   {@code capacity / refillRate} seconds is full again anyway, so as long as the TTL exceeds
 *   that, expiry is invisible to the client.
 * - beyond {@code maxClients} entries Caffeine's size policy evicts the coldest buckets. An
 *   evicted client starts over with a full bucket; this is logged at debug level.
 */
@Slf4j
public class RateLimiter {

    public static final Duration DEFAULT_IDLE_TTL = Duration.ofHours(1);
    public static final long DEFAULT_MAX_CLIENTS = 100_000;

    private static final String UNKNOWN_CLIENT = "unknown";

    private final long capacity;
    private final double refillRate;
    private final boolean perClientMode;
    private final boolean enabled;
    private final LongSupplier nanoClock;

    private final TokenBucket globalBucket;
    private final Cache<String, TokenBucket> clientBuckets;

    public RateLimiter(long capacity, double refillRate, boolean perClientMode) {
        this(capacity, refillRate, perClientMode, true, DEFAULT_IDLE_TTL, DEFAULT_MAX_CLIENTS, System::nanoTime);
    }

    /**
     * @param capacity bucket capacity, shared by every bucket
     * @param refillRate tokens per second, shared by every bucket
     * @param perClientMode one bucket per identity when true, one global bucket otherwise
     * @param enabled when false every check is allowed
     * @param idleTtl how long an untouched client bucket is kept
     * @param maxClients upper bound on tracked client buckets
     * @param nanoClock time source for the buckets and for cache expiry
     */
    public RateLimiter(long capacity,
                       double refillRate,
                       boolean perClientMode,
                       boolean enabled,
                       Duration idleTtl,
                       long maxClients,
                       LongSupplier nanoClock) {
        this.capacity = capacity;
        this.refillRate = refillRate;
        this.perClientMode = perClientMode;
        this.enabled = enabled;
        this.nanoClock = nanoClock;
        this.globalBucket = new TokenBucket(capacity, refillRate, nanoClock);
        this.clientBuckets = Caffeine.newBuilder()
                .expireAfterAccess(idleTtl)
                .maximumSize(maxClients)
                .ticker(nanoClock::getAsLong)
                .executor(Runnable::run)
                .removalListener((String client, TokenBucket bucket, RemovalCause cause) -> {
                    if (cause == RemovalCause.SIZE && bucket != null) {
                        log.debug("Evicted rate limit bucket - client: {}, remaining: {}",
                                ClientIdentityMasker.mask(client), bucket.peek());
                    }
                })
                .build();
    }

    /**
     * Consumes one token for the client.
     */
    public RateLimitResult check(String clientIdentity) {
        return check(clientIdentity, 1);
    }

    /**
     * Consumes {@code cost} tokens for the client. Expensive routes pass a higher cost.
     *
     * @param clientIdentity caller key, ignored in global mode
     * @param cost tokens to consume
     * @return whether the call is allowed and the tokens left
     */
    public RateLimitResult check(String clientIdentity, long cost) {
        if (!enabled) {
            return RateLimitResult.allowed(capacity);
        }

        RateLimitResult result = bucketFor(clientIdentity).consume(cost);
        if (!result.allowed()) {
            log.warn("Rate limit exceeded - client: {}, cost: {}, remaining: {}",
                    ClientIdentityMasker.mask(clientIdentity), cost, result.remaining());
        }
        return result;
    }

    /**
     * Tokens currently available to the client, without consuming any.
     */
    public long remaining(String clientIdentity) {
        if (!enabled) {
            return capacity;
        }
        return bucketFor(clientIdentity).peek();
    }

    /**
     * Number of client buckets currently tracked. Always 1 in global mode.
     */
    public long activeClients() {
        if (!perClientMode) {
            return 1;
        }
        clientBuckets.cleanUp();
        return clientBuckets.estimatedSize();
    }

    private TokenBucket bucketFor(String clientIdentity) {
        if (!perClientMode) {
            return globalBucket;
        }
        String key = clientIdentity == null || clientIdentity.isBlank() ? UNKNOWN_CLIENT : clientIdentity;
        // Caffeine runs the mapping function at most once per key, concurrent callers share the result
        return clientBuckets.get(key, k -> new TokenBucket(capacity, refillRate, nanoClock));
    }
}
