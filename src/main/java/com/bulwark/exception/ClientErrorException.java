package com.bulwark.exception;

import com.bulwark.model.ProviderKey;
import lombok.Getter;

/**
 * The call failed because of the request itself (malformed input, rejected parameters).
 * Not counted against the circuit breaker and not worth retrying.
 */
@Getter
public class ClientErrorException extends ResilienceException {

    private final Integer statusCode;

    public ClientErrorException(ProviderKey providerKey, FailureStage stage, Integer statusCode,
                                String message, Throwable cause) {
        super(providerKey, stage, RetryDisposition.DO_NOT_RETRY, message, cause);
        this.statusCode = statusCode;
    }
}
