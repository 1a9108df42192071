package com.bulwark.resilience.breaker;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Thresholds of one provider's circuit breaker.
 */
@Value
@Builder
public class CircuitBreakerSettings {

    public static final int DEFAULT_FAILURE_THRESHOLD = 5;
    public static final int DEFAULT_SUCCESS_THRESHOLD = 3;
    public static final Duration DEFAULT_RECOVERY_TIMEOUT = Duration.ofSeconds(60);
    public static final Duration DEFAULT_FAILURE_RESET_TIMEOUT = Duration.ofSeconds(300);

    @Builder.Default
    int failureThreshold = DEFAULT_FAILURE_THRESHOLD;

    @Builder.Default
    int successThreshold = DEFAULT_SUCCESS_THRESHOLD;

    @Builder.Default
    Duration recoveryTimeout = DEFAULT_RECOVERY_TIMEOUT;

    /**
     * Quiet period after which the closed-state failure count starts over.
     */
    @Builder.Default
    Duration failureResetTimeout = DEFAULT_FAILURE_RESET_TIMEOUT;

    /**
     * Concurrent trial calls allowed while half-open. {@code null} means the success threshold.
     */
    Integer halfOpenMaxCalls;

    public int effectiveHalfOpenMaxCalls() {
        return halfOpenMaxCalls != null ? halfOpenMaxCalls : successThreshold;
    }

    public void validate() {
        if (failureThreshold <= 0) {
            throw new IllegalArgumentException("failureThreshold must be positive, got " + failureThreshold);
        }
        if (successThreshold <= 0) {
            throw new IllegalArgumentException("successThreshold must be positive, got " + successThreshold);
        }
        if (recoveryTimeout == null || recoveryTimeout.isNegative() || recoveryTimeout.isZero()) {
            throw new IllegalArgumentException("recoveryTimeout must be positive, got " + recoveryTimeout);
        }
        if (failureResetTimeout == null || failureResetTimeout.isNegative() || failureResetTimeout.isZero()) {
            throw new IllegalArgumentException("failureResetTimeout must be positive, got " + failureResetTimeout);
        }
        if (halfOpenMaxCalls != null && halfOpenMaxCalls <= 0) {
            throw new IllegalArgumentException("halfOpenMaxCalls must be positive, got " + halfOpenMaxCalls);
        }
    }
}
