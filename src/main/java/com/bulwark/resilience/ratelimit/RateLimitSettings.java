package com.bulwark.resilience.ratelimit;

import lombok.Builder;
import lombok.Value;

/**
 * Token bucket parameters for one provider.
 */
@Value
@Builder
public class RateLimitSettings {

    public static final double DEFAULT_RATE_PER_SECOND = 5.0;
    public static final int DEFAULT_CAPACITY = 10;

    /**
     * Steady-state refill rate in tokens per second.
     */
    @Builder.Default
    double ratePerSecond = DEFAULT_RATE_PER_SECOND;

    /**
     * Burst capacity: the most tokens the bucket can hold.
     */
    @Builder.Default
    int capacity = DEFAULT_CAPACITY;

    public void validate() {
        if (!(ratePerSecond > 0) || Double.isInfinite(ratePerSecond)) {
            throw new IllegalArgumentException("ratePerSecond must be a positive finite number, got " + ratePerSecond);
        }
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive, got " + capacity);
        }
    }
}
