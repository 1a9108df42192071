package com.bulwark.exception;

/**
 * What a caller should do with a failed call.
 */
public enum RetryDisposition {

    /**
     * Transient condition on this provider. Waiting and retrying the same provider is reasonable.
     */
    RETRY_LATER,

    /**
     * The provider is considered unhealthy. Send the call to another provider.
     */
    FAIL_OVER,

    /**
     * Retrying the same request will not help (malformed input, misconfiguration).
     */
    DO_NOT_RETRY
}
