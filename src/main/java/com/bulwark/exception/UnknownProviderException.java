package com.bulwark.exception;

import com.bulwark.model.ProviderKey;

/**
 * The request names a provider that is not configured.
 */
public class UnknownProviderException extends ResilienceException {

    public UnknownProviderException(ProviderKey providerKey) {
        super(providerKey, FailureStage.CONFIGURATION, RetryDisposition.DO_NOT_RETRY,
                "Unknown provider: " + providerKey, null);
    }
}
