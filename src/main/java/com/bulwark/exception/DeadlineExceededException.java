package com.bulwark.exception;

import com.bulwark.model.ProviderKey;

/**
 * The caller's deadline expired at some stage of the call.
 */
public class DeadlineExceededException extends ResilienceException {

    public DeadlineExceededException(ProviderKey providerKey, FailureStage stage, String message, Throwable cause) {
        super(providerKey, stage, RetryDisposition.RETRY_LATER, message, cause);
    }
}
