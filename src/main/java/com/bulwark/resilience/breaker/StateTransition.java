package com.bulwark.resilience.breaker;

import java.time.Instant;

/**
 * One recorded state change of a circuit breaker.
 */
public record StateTransition(CircuitState from, CircuitState to, Instant at, String reason) {
}
