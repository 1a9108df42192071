package com.bulwark.resilience.ratelimit;

import java.time.Duration;
import java.time.Instant;

/**
 * Immutable token bucket state.
 *
 * @param tokens     tokens currently in the bucket, within [0, capacity]
 * @param lastRefill instant of the last refill computation
 */
record BucketState(double tokens, Instant lastRefill) {

    BucketState {
        if (tokens < 0) {
            throw new IllegalArgumentException("tokens must be non-negative");
        }
    }

    static BucketState full(int capacity, Instant now) {
        return new BucketState(capacity, now);
    }

    /**
     * Add the tokens accrued since the last refill, capped at capacity.
     * A clock that did not move forward leaves the state unchanged.
     */
    BucketState refill(double ratePerSecond, int capacity, Instant now) {
        if (!now.isAfter(lastRefill)) {
            return this;
        }
        double elapsedSeconds = Duration.between(lastRefill, now).toNanos() / 1_000_000_000.0;
        double refilled = Math.min(capacity, tokens + elapsedSeconds * ratePerSecond);
        return new BucketState(refilled, now);
    }

    BucketState take(int count) {
        return new BucketState(Math.max(0.0, tokens - count), lastRefill);
    }

    BucketState give(int count, int capacity) {
        return new BucketState(Math.min(capacity, tokens + count), lastRefill);
    }
}
