package com.relaychat.chatserver.security;

import java.util.function.LongSupplier;

/**
 * Token bucket with lazy, elapsed-time refill. Tokens never exceed the capacity.
 * Access is serialized on the bucket itself.
 */
public class TokenBucket {
    private final double capacity;
    private final double tokensPerNano;
    private final LongSupplier nanoClock;

    private double tokens;
    private long lastRefillNanos;
    private boolean throttled;

    public TokenBucket(int capacity, double tokensPerSecond, LongSupplier nanoClock) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        if (tokensPerSecond <= 0) {
            throw new IllegalArgumentException("refill rate must be positive");
        }
        this.capacity = capacity;
        this.tokensPerNano = tokensPerSecond / 1_000_000_000d;
        this.nanoClock = nanoClock;
        this.tokens = capacity;
        this.lastRefillNanos = nanoClock.getAsLong();
    }

    public synchronized boolean tryConsume(int cost) {
        refill();
        if (tokens < cost) {
            return false;
        }
        tokens -= cost;
        return true;
    }

    /**
     * Consumes {@code cost} tokens and reports whether this denial opened a new violation episode.
     */
    synchronized RateLimiter.Decision acquire(int cost) {
        if (tryConsume(cost)) {
            throttled = false;
            return RateLimiter.Decision.ALLOWED;
        }
        if (throttled) {
            return RateLimiter.Decision.THROTTLED_SILENT;
        }
        throttled = true;
        return RateLimiter.Decision.THROTTLED;
    }

    public synchronized double availableTokens() {
        refill();
        return tokens;
    }

    private void refill() {
        long now = nanoClock.getAsLong();
        long elapsed = now - lastRefillNanos;
        if (elapsed > 0) {
            tokens = Math.min(capacity, tokens + elapsed * tokensPerNano);
            lastRefillNanos = now;
        }
    }
}
