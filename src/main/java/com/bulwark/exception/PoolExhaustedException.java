package com.bulwark.exception;

import com.bulwark.model.ProviderKey;

/**
 * No pooled connection could be checked out before the acquisition timeout.
 */
public class PoolExhaustedException extends ResilienceException {

    public PoolExhaustedException(ProviderKey providerKey, String message) {
        this(providerKey, message, null);
    }

    public PoolExhaustedException(ProviderKey providerKey, String message, Throwable cause) {
        super(providerKey, FailureStage.CONNECTION_POOL, RetryDisposition.RETRY_LATER, message, cause);
    }
}
