package com.bulwark.service;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Call-level limits of the resilient client.
 */
@Value
@Builder
public class ClientSettings {

    /**
     * End-to-end deadline for requests that do not carry their own.
     */
    @Builder.Default
    Duration defaultTimeout = Duration.ofSeconds(60);

    /**
     * Longest wait for rate-limit tokens, further bounded by the remaining deadline.
     */
    @Builder.Default
    Duration rateLimitWait = Duration.ofSeconds(5);

    /**
     * Longest wait for a pooled connection, further bounded by the remaining deadline.
     */
    @Builder.Default
    Duration poolAcquireTimeout = Duration.ofSeconds(10);

    public void validate() {
        if (defaultTimeout == null || defaultTimeout.isNegative() || defaultTimeout.isZero()) {
            throw new IllegalArgumentException("defaultTimeout must be positive, got " + defaultTimeout);
        }
        if (rateLimitWait == null || rateLimitWait.isNegative()) {
            throw new IllegalArgumentException("rateLimitWait must not be negative, got " + rateLimitWait);
        }
        if (poolAcquireTimeout == null || poolAcquireTimeout.isNegative()) {
            throw new IllegalArgumentException("poolAcquireTimeout must not be negative, got " + poolAcquireTimeout);
        }
    }
}
