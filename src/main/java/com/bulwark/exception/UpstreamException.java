package com.bulwark.exception;

import com.bulwark.model.ProviderKey;
import lombok.Getter;

/**
 * The network call failed or the provider answered with a server-side error.
 * Counted against the provider's circuit breaker.
 */
@Getter
public class UpstreamException extends ResilienceException {

    /**
     * HTTP status returned by the provider, or {@code null} when no response was received.
     */
    private final Integer statusCode;

    public UpstreamException(ProviderKey providerKey, Integer statusCode, String message, Throwable cause) {
        super(providerKey, FailureStage.UPSTREAM_CALL, RetryDisposition.FAIL_OVER, message, cause);
        this.statusCode = statusCode;
    }
}
