package com.bulwark.exception;

import com.bulwark.model.ProviderKey;
import lombok.Getter;

/**
 * Base type for every failure surfaced by the resilient client.
 * Each failure names the provider, the stage that produced it and how a caller may react.
 */
@Getter
public abstract class ResilienceException extends RuntimeException {

    private final ProviderKey providerKey;
    private final FailureStage stage;
    private final RetryDisposition disposition;

    protected ResilienceException(
            ProviderKey providerKey,
            FailureStage stage,
            RetryDisposition disposition,
            String message,
            Throwable cause) {
        super(message, cause);
        this.providerKey = providerKey;
        this.stage = stage;
        this.disposition = disposition;
    }

    public boolean isRetryable() {
        return disposition == RetryDisposition.RETRY_LATER;
    }
}
