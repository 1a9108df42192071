package com.bulwark.exception;

import com.bulwark.model.ProviderKey;

/**
 * The provider's circuit breaker rejected the call without a network attempt.
 */
public class CircuitOpenException extends ResilienceException {

    public CircuitOpenException(ProviderKey providerKey, String message) {
        super(providerKey, FailureStage.CIRCUIT_BREAKER, RetryDisposition.FAIL_OVER, message, null);
    }
}
