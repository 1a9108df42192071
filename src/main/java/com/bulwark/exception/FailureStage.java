package com.bulwark.exception;

/**
 * Pipeline stage that produced a failure.
 */
public enum FailureStage {
    CONFIGURATION,
    CACHE,
    RATE_LIMIT,
    CIRCUIT_BREAKER,
    CONNECTION_POOL,
    UPSTREAM_CALL
}
