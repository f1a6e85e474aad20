package com.relaychat.chatserver.security;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.LongSupplier;

/**
 * Per-session token-bucket limiter for inbound frames.
 * <p>
 * Burst size is the bucket capacity; the sustained rate is {@code refillTokens} per
 * {@code refillPeriod}. Buckets are independent, so no lock spans sessions.
 */
public class RateLimiter {
    private static final Logger log = LoggerFactory.getLogger(RateLimiter.class);

    public enum Decision {
        ALLOWED,
        /** First denial of a violation episode; the sender gets one notice. */
        THROTTLED,
        /** Further denials in the same episode; dropped without a notice. */
        THROTTLED_SILENT;

        public boolean allowed() {
            return this == ALLOWED;
        }
    }

    private final ConcurrentHashMap<Long, TokenBucket> buckets = new ConcurrentHashMap<>();
    private final int capacity;
    private final double tokensPerSecond;
    private final LongSupplier nanoClock;

    public RateLimiter(int capacity, int refillTokens, Duration refillPeriod) {
        this(capacity, refillTokens, refillPeriod, System::nanoTime);
    }

    public RateLimiter(int capacity, int refillTokens, Duration refillPeriod, LongSupplier nanoClock) {
        if (refillPeriod == null || refillPeriod.isZero() || refillPeriod.isNegative()) {
            throw new IllegalArgumentException("refillPeriod must be positive");
        }
        if (refillTokens <= 0) {
            throw new IllegalArgumentException("refillTokens must be positive");
        }
        this.capacity = capacity;
        this.tokensPerSecond = refillTokens / (refillPeriod.toNanos() / 1_000_000_000d);
        this.nanoClock = nanoClock;
        log.info("Rate limiter: burst {} tokens, {} tokens/s sustained", capacity, tokensPerSecond);
    }

    public boolean tryConsume(long sessionId) {
        return tryConsume(sessionId, 1);
    }

    public boolean tryConsume(long sessionId, int cost) {
        return bucket(sessionId).tryConsume(cost);
    }

    public Decision acquire(long sessionId, int cost) {
        return bucket(sessionId).acquire(cost);
    }

    public double availableTokens(long sessionId) {
        return bucket(sessionId).availableTokens();
    }

    public void remove(long sessionId) {
        buckets.remove(sessionId);
    }

    public int trackedSessions() {
        return buckets.size();
    }

    private TokenBucket bucket(long sessionId) {
        return buckets.computeIfAbsent(sessionId,
                id -> new TokenBucket(capacity, tokensPerSecond, nanoClock));
    }
}
