package com.bulwark.resilience.pool;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Pool-wide connection settings.
 */
@Value
@Builder
public class PoolSettings {

    /**
     * Upper bound on connections checked out at once, across all hosts.
     */
    @Builder.Default
    int maxTotalConnections = 100;

    /**
     * Per-host bound used for hosts that were not registered with their own limit.
     */
    @Builder.Default
    int maxConnectionsPerHost = 20;

    @Builder.Default
    Duration idleTimeout = Duration.ofSeconds(300);

    @Builder.Default
    Duration reaperInterval = Duration.ofSeconds(60);

    @Builder.Default
    Duration dnsCacheTtl = Duration.ofSeconds(300);

    @Builder.Default
    Duration connectTimeout = Duration.ofSeconds(30);

    public void validate() {
        if (maxTotalConnections <= 0) {
            throw new IllegalArgumentException("maxTotalConnections must be positive, got " + maxTotalConnections);
        }
        if (maxConnectionsPerHost <= 0) {
            throw new IllegalArgumentException("maxConnectionsPerHost must be positive, got " + maxConnectionsPerHost);
        }
        requirePositive("idleTimeout", idleTimeout);
        requirePositive("reaperInterval", reaperInterval);
        requirePositive("dnsCacheTtl", dnsCacheTtl);
        requirePositive("connectTimeout", connectTimeout);
    }

    static void requirePositive(String field, Duration value) {
        if (value == null || value.isNegative() || value.isZero()) {
            throw new IllegalArgumentException(field + " must be positive, got " + value);
        }
    }
}
