package com.bulwark.resilience.breaker;

/**
 * Circuit breaker states.
 * <ul>
 * <li>CLOSED to OPEN: consecutive failures reach the failure threshold</li>
 * <li>OPEN to HALF_OPEN: the recovery timeout elapsed, on the next admission check</li>
 * <li>HALF_OPEN to CLOSED: consecutive trial successes reach the success threshold</li>
 * <li>HALF_OPEN to OPEN: any trial failure</li>
 * </ul>
 */
public enum CircuitState {

    /**
     * Calls flow normally.
     */
    CLOSED,

    /**
     * Calls are rejected without reaching the provider.
     */
    OPEN,

    /**
     * A limited number of trial calls test whether the provider recovered.
     */
    HALF_OPEN
}
