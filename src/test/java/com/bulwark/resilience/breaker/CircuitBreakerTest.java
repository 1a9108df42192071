package com.bulwark.resilience.breaker;

import com.bulwark.model.dto.CircuitBreakerStatistics;
import com.bulwark.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CircuitBreaker")
class CircuitBreakerTest {

    private MutableClock clock;
    private CircuitBreaker breaker;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        breaker = new CircuitBreaker("test", CircuitBreakerSettings.builder()
                .failureThreshold(3)
                .successThreshold(2)
                .recoveryTimeout(Duration.ofSeconds(10))
                .failureResetTimeout(Duration.ofSeconds(300))
                .build(), clock);
    }

    private CircuitBreaker.Permit admit() {
        Optional<CircuitBreaker.Permit> permit = breaker.tryAcquirePermission();
        assertTrue(permit.isPresent(), "expected the call to be admitted");
        return permit.get();
    }

    private void fail(int times) {
        for (int i = 0; i < times; i++) {
            breaker.recordFailure(admit(), new IOException("boom"));
        }
    }

    @Nested
    @DisplayName("Closed state")
    class Closed {

        @Test
        @DisplayName("Opens after the failure threshold of consecutive failures")
        void opensAtThreshold() {
            fail(2);
            assertEquals(CircuitState.CLOSED, breaker.getState());

            fail(1);
            assertEquals(CircuitState.OPEN, breaker.getState());
            assertTrue(breaker.tryAcquirePermission().isEmpty());
        }

        @Test
        @DisplayName("A success resets the consecutive failure count")
        void successResetsCount() {
            fail(2);
            breaker.recordSuccess(admit());
            fail(2);

            assertEquals(CircuitState.CLOSED, breaker.getState());
            assertEquals(2, breaker.statistics().getConsecutiveFailures());
        }

        @Test
        @DisplayName("The failure count starts over after a quiet period")
        void quietPeriodRestartsCount() {
            fail(2);
            clock.advanceSeconds(300);
            fail(1);

            assertEquals(CircuitState.CLOSED, breaker.getState());
            assertEquals(1, breaker.statistics().getConsecutiveFailures());

            clock.advanceSeconds(299);
            fail(2);
            assertEquals(CircuitState.OPEN, breaker.getState());
        }
    }

    @Nested
    @DisplayName("Recovery")
    class Recovery {

        @Test
        @DisplayName("Rejects calls until the recovery timeout elapses")
        void rejectsBeforeTimeout() {
            fail(3);
            clock.advanceSeconds(5);
            assertTrue(breaker.tryAcquirePermission().isEmpty());
            assertEquals(CircuitState.OPEN, breaker.getState());

            clock.advanceSeconds(6);
            CircuitBreaker.Permit trial = admit();
            assertEquals(CircuitState.HALF_OPEN, breaker.getState());
            assertEquals(CircuitState.HALF_OPEN, trial.admittedIn());
        }

        @Test
        @DisplayName("Closes after the success threshold of trial successes")
        void closesAfterTrialSuccesses() {
            fail(3);
            clock.advanceSeconds(11);
            breaker.recordSuccess(admit());
            assertEquals(CircuitState.HALF_OPEN, breaker.getState());

            breaker.recordSuccess(admit());
            assertEquals(CircuitState.CLOSED, breaker.getState());
        }

        @Test
        @DisplayName("Reopens on a trial failure and restarts the recovery timer")
        void reopensOnTrialFailure() {
            fail(3);
            clock.advanceSeconds(11);
            breaker.recordFailure(admit(), new IOException("still down"));

            assertEquals(CircuitState.OPEN, breaker.getState());
            clock.advanceSeconds(9);
            assertTrue(breaker.tryAcquirePermission().isEmpty());
            clock.advanceSeconds(2);
            assertTrue(breaker.tryAcquirePermission().isPresent());
        }

        @Test
        @DisplayName("Limits concurrent trial calls while half-open")
        void limitsTrials() {
            fail(3);
            clock.advanceSeconds(11);
            CircuitBreaker.Permit first = admit();
            admit();
            assertTrue(breaker.tryAcquirePermission().isEmpty());

            breaker.releasePermission(first);
            assertTrue(breaker.tryAcquirePermission().isPresent());
        }

        @Test
        @DisplayName("Ignores late outcomes while open")
        void ignoresLateOutcomesWhileOpen() {
            CircuitBreaker.Permit early = admit();
            CircuitBreaker.Permit other = admit();
            fail(3);

            breaker.recordSuccess(early);
            breaker.recordFailure(other, null);
            assertEquals(CircuitState.OPEN, breaker.getState());
            assertEquals(2, breaker.statistics().getStaleOutcomes());
        }

        @Test
        @DisplayName("Late successes of calls admitted while closed do not close a half-open breaker")
        void lateSuccessesDoNotDecideTrials() {
            CircuitBreaker.Permit slowA = admit();
            CircuitBreaker.Permit slowB = admit();
            fail(3);
            clock.advanceSeconds(11);
            CircuitBreaker.Permit trial = admit();

            breaker.recordSuccess(slowA);
            breaker.recordSuccess(slowB);
            assertEquals(CircuitState.HALF_OPEN, breaker.getState());
            assertEquals(1, breaker.statistics().getHalfOpenTrialsInFlight());
            assertEquals(0, breaker.statistics().getConsecutiveSuccesses());

            breaker.recordSuccess(trial);
            assertEquals(CircuitState.HALF_OPEN, breaker.getState());
            breaker.recordSuccess(admit());
            assertEquals(CircuitState.CLOSED, breaker.getState());
        }

        @Test
        @DisplayName("A late failure of a call admitted while closed does not reopen a half-open breaker")
        void lateFailureDoesNotReopen() {
            CircuitBreaker.Permit slow = admit();
            fail(3);
            clock.advanceSeconds(11);
            CircuitBreaker.Permit trial = admit();

            breaker.recordFailure(slow, new IOException("timed out long ago"));
            assertEquals(CircuitState.HALF_OPEN, breaker.getState());

            breaker.releasePermission(slow);
            assertEquals(1, breaker.statistics().getHalfOpenTrialsInFlight());

            breaker.recordSuccess(trial);
            assertEquals(CircuitState.HALF_OPEN, breaker.getState());
        }

        @Test
        @DisplayName("A trial permit from an earlier half-open period is stale after reopening")
        void earlierTrialIsStale() {
            fail(3);
            clock.advanceSeconds(11);
            CircuitBreaker.Permit first = admit();
            CircuitBreaker.Permit second = admit();
            breaker.recordFailure(first, new IOException("still down"));
            assertEquals(CircuitState.OPEN, breaker.getState());

            clock.advanceSeconds(11);
            admit();
            breaker.recordSuccess(second);
            assertEquals(0, breaker.statistics().getConsecutiveSuccesses());
        }
    }

    @Nested
    @DisplayName("Administration")
    class Administration {

        @Test
        @DisplayName("Force open rejects calls even without failures")
        void forceOpen() {
            breaker.forceOpen();
            assertEquals(CircuitState.OPEN, breaker.getState());
            assertTrue(breaker.tryAcquirePermission().isEmpty());
        }

        @Test
        @DisplayName("Force closed admits calls again")
        void forceClosed() {
            fail(3);
            breaker.forceClosed();
            assertEquals(CircuitState.CLOSED, breaker.getState());
            assertTrue(breaker.tryAcquirePermission().isPresent());
        }

        @Test
        @DisplayName("Outcomes of calls admitted before a forced transition are ignored")
        void forcedTransitionInvalidatesPermits() {
            CircuitBreaker.Permit before = admit();
            breaker.forceClosed();
            fail(2);

            breaker.recordFailure(before, new IOException("boom"));
            assertEquals(CircuitState.CLOSED, breaker.getState());
            assertEquals(2, breaker.statistics().getConsecutiveFailures());
        }

        @Test
        @DisplayName("Reset clears history and counters")
        void reset() {
            fail(3);
            breaker.reset();

            CircuitBreakerStatistics stats = breaker.statistics();
            assertEquals("CLOSED", stats.getState());
            assertEquals(0, stats.getFailures());
            assertTrue(stats.getTransitions().isEmpty());
        }

        @Test
        @DisplayName("Records transitions with reasons, bounded in size")
        void history() {
            fail(3);
            List<StateTransition> transitions = breaker.getHistory();
            assertEquals(1, transitions.size());
            assertEquals(CircuitState.CLOSED, transitions.get(0).from());
            assertEquals(CircuitState.OPEN, transitions.get(0).to());
            assertTrue(transitions.get(0).reason().startsWith("3 consecutive failures"));

            for (int i = 0; i < CircuitBreaker.HISTORY_SIZE; i++) {
                breaker.forceClosed();
            }
            assertEquals(CircuitBreaker.HISTORY_SIZE, breaker.getHistory().size());
        }
    }

    @Test
    @DisplayName("Half-open trial limit defaults to the success threshold")
    void halfOpenDefault() {
        CircuitBreakerSettings settings = CircuitBreakerSettings.builder().successThreshold(4).build();
        assertEquals(4, settings.effectiveHalfOpenMaxCalls());
        assertThrows(IllegalArgumentException.class,
                () -> CircuitBreakerSettings.builder().failureThreshold(0).build().validate());
        assertThrows(IllegalArgumentException.class,
                () -> CircuitBreakerSettings.builder().failureResetTimeout(Duration.ZERO).build().validate());
    }
}
