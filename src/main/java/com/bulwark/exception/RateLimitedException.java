package com.bulwark.exception;

import com.bulwark.model.ProviderKey;

/**
 * The provider's token bucket did not admit the call in time.
 */
public class RateLimitedException extends ResilienceException {

    public RateLimitedException(ProviderKey providerKey, String message) {
        super(providerKey, FailureStage.RATE_LIMIT, RetryDisposition.RETRY_LATER, message, null);
    }
}
