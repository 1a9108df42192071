package com.bulwark.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * Snapshot of one provider's circuit breaker, including its recent transitions.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CircuitBreakerStatistics {

    private String state;
    private int consecutiveFailures;
    private int consecutiveSuccesses;
    private int halfOpenTrialsInFlight;
    private Instant lastTransitionAt;
    private long permitted;
    private long rejected;
    private long successes;
    private long failures;

    /**
     * Outcomes of calls admitted under an earlier breaker state, counted but not applied.
     */
    private long staleOutcomes;

    /**
     * Most recent transitions, oldest first.
     */
    private List<Transition> transitions;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Transition {
        private String from;
        private String to;
        private Instant at;
        private String reason;
    }
}
