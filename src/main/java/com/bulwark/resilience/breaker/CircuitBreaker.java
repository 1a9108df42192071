package com.bulwark.resilience.breaker;

import com.bulwark.model.dto.CircuitBreakerStatistics;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.atomic.LongAdder;

/**
 * Consecutive-failure circuit breaker for one provider.
 *
 * <p>The whole state lives in one immutable {@link Snapshot}; every decision is a single
 * compare-and-set, so no lock is ever held while a call is in flight. Each granted {@link Permit}
 * is settled with exactly one of {@link #recordSuccess(Permit)}, {@link #recordFailure(Permit, Throwable)}
 * or {@link #releasePermission(Permit)}.
 *
 * <p>Every state change starts a new generation. A permit only affects the state of the generation
 * that granted it, so a call admitted while closed cannot decide the outcome of a later half-open trial.
 */
@Slf4j
public class CircuitBreaker {

    static final int HISTORY_SIZE = 50;

    private final String name;
    private final CircuitBreakerSettings settings;
    private final Clock clock;
    private final AtomicReference<Snapshot> snapshot;
    private final ConcurrentLinkedDeque<StateTransition> history = new ConcurrentLinkedDeque<>();

    private final LongAdder permitted = new LongAdder();
    private final LongAdder rejected = new LongAdder();
    private final LongAdder successes = new LongAdder();
    private final LongAdder failures = new LongAdder();
    private final LongAdder staleOutcomes = new LongAdder();

    public CircuitBreaker(String name, CircuitBreakerSettings settings, Clock clock) {
        settings.validate();
        this.name = name;
        this.settings = settings;
        this.clock = clock;
        this.snapshot = new AtomicReference<>(Snapshot.closed(clock.instant(), 0));
    }

    /**
     * Ask whether a call may proceed.
     * An open breaker whose recovery timeout elapsed turns half-open here and admits the caller as a trial.
     *
     * @return the permit to settle once the call finished, or empty if the call is rejected
     */
    public Optional<Permit> tryAcquirePermission() {
        while (true) {
            Snapshot current = snapshot.get();
            Instant now = clock.instant();

            switch (current.state()) {
                case CLOSED:
                    permitted.increment();
                    return Optional.of(new Permit(current.generation(), CircuitState.CLOSED));

                case OPEN:
                    Duration sinceOpened = Duration.between(current.transitionedAt(), now);
                    if (sinceOpened.compareTo(settings.getRecoveryTimeout()) < 0) {
                        rejected.increment();
                        return Optional.empty();
                    }
                    Snapshot trial = Snapshot.halfOpen(now, current.generation() + 1).withTrials(1);
                    if (snapshot.compareAndSet(current, trial)) {
                        onTransition(current, trial, "recovery timeout elapsed");
                        permitted.increment();
                        return Optional.of(new Permit(trial.generation(), CircuitState.HALF_OPEN));
                    }
                    break;

                case HALF_OPEN:
                    if (current.trialsInFlight() >= settings.effectiveHalfOpenMaxCalls()) {
                        rejected.increment();
                        return Optional.empty();
                    }
                    if (snapshot.compareAndSet(current, current.withTrials(current.trialsInFlight() + 1))) {
                        permitted.increment();
                        return Optional.of(new Permit(current.generation(), CircuitState.HALF_OPEN));
                    }
                    break;

                default:
                    throw new IllegalStateException("Unknown circuit state " + current.state());
            }
        }
    }

    /**
     * Record a successful call.
     */
    public void recordSuccess(Permit permit) {
        successes.increment();
        while (true) {
            Snapshot current = snapshot.get();
            if (isStale(permit, current, "success")) {
                return;
            }
            Snapshot next;

            switch (current.state()) {
                case CLOSED:
                    if (current.consecutiveFailures() == 0) {
                        return;
                    }
                    next = current.withFailures(0, null);
                    break;

                case HALF_OPEN:
                    int consecutive = current.consecutiveSuccesses() + 1;
                    if (consecutive >= settings.getSuccessThreshold()) {
                        next = Snapshot.closed(clock.instant(), current.generation() + 1);
                    } else {
                        next = new Snapshot(CircuitState.HALF_OPEN, current.generation(), 0, consecutive,
                                Math.max(0, current.trialsInFlight() - 1), current.transitionedAt(), null);
                    }
                    break;

                default:
                    return;
            }

            if (snapshot.compareAndSet(current, next)) {
                if (next.state() != current.state()) {
                    onTransition(current, next, settings.getSuccessThreshold() + " consecutive trial successes");
                }
                return;
            }
        }
    }

    /**
     * Record a failed call. The cause is only used for logging; classification happens before.
     */
    public void recordFailure(Permit permit, Throwable cause) {
        failures.increment();
        while (true) {
            Snapshot current = snapshot.get();
            if (isStale(permit, current, "failure")) {
                return;
            }
            Instant now = clock.instant();
            Snapshot next;
            String reason;

            switch (current.state()) {
                case CLOSED:
                    int consecutive = countsSince(current, now) + 1;
                    if (consecutive >= settings.getFailureThreshold()) {
                        next = Snapshot.open(now, current.generation() + 1);
                        reason = consecutive + " consecutive failures";
                    } else {
                        next = current.withFailures(consecutive, now);
                        reason = null;
                    }
                    break;

                case HALF_OPEN:
                    next = Snapshot.open(now, current.generation() + 1);
                    reason = "trial call failed";
                    break;

                default:
                    return;
            }

            if (snapshot.compareAndSet(current, next)) {
                if (next.state() != current.state()) {
                    onTransition(current, next, reason + describe(cause));
                } else {
                    log.debug("Circuit {}: failure {} of {}{}", name, next.consecutiveFailures(),
                            settings.getFailureThreshold(), describe(cause));
                }
                return;
            }
        }
    }

    /**
     * Give back a permission whose call produced no verdict on provider health
     * (client error, or the call never reached the network).
     */
    public void releasePermission(Permit permit) {
        while (true) {
            Snapshot current = snapshot.get();
            if (permit.generation() != current.generation()
                    || current.state() != CircuitState.HALF_OPEN
                    || current.trialsInFlight() == 0) {
                return;
            }
            if (snapshot.compareAndSet(current, current.withTrials(current.trialsInFlight() - 1))) {
                return;
            }
        }
    }

    public CircuitState getState() {
        return snapshot.get().state();
    }

    /**
     * Open the breaker until the recovery timeout elapses, regardless of outcomes.
     */
    public void forceOpen() {
        transitionTo(CircuitState.OPEN, "forced open");
    }

    /**
     * Close the breaker and clear its counters.
     */
    public void forceClosed() {
        transitionTo(CircuitState.CLOSED, "forced closed");
    }

    /**
     * Close the breaker and clear counters, statistics and history.
     */
    public void reset() {
        Snapshot previous = snapshot.get();
        while (!snapshot.compareAndSet(previous, Snapshot.closed(clock.instant(), previous.generation() + 1))) {
            previous = snapshot.get();
        }
        history.clear();
        permitted.reset();
        rejected.reset();
        successes.reset();
        failures.reset();
        staleOutcomes.reset();
        log.info("Circuit {} reset", name);
    }

    /**
     * Recorded transitions, oldest first.
     */
    public List<StateTransition> getHistory() {
        return new ArrayList<>(history);
    }

    public CircuitBreakerStatistics statistics() {
        Snapshot current = snapshot.get();
        List<CircuitBreakerStatistics.Transition> transitions = new ArrayList<>();
        for (StateTransition transition : history) {
            transitions.add(CircuitBreakerStatistics.Transition.builder()
                    .from(transition.from().name())
                    .to(transition.to().name())
                    .at(transition.at())
                    .reason(transition.reason())
                    .build());
        }

        return CircuitBreakerStatistics.builder()
                .state(current.state().name())
                .consecutiveFailures(current.consecutiveFailures())
                .consecutiveSuccesses(current.consecutiveSuccesses())
                .halfOpenTrialsInFlight(current.trialsInFlight())
                .lastTransitionAt(current.transitionedAt())
                .permitted(permitted.sum())
                .rejected(rejected.sum())
                .successes(successes.sum())
                .failures(failures.sum())
                .staleOutcomes(staleOutcomes.sum())
                .transitions(transitions)
                .build();
    }

    private void transitionTo(CircuitState state, String reason) {
        while (true) {
            Snapshot previous = snapshot.get();
            Instant now = clock.instant();
            Snapshot next = state == CircuitState.OPEN
                    ? Snapshot.open(now, previous.generation() + 1)
                    : Snapshot.closed(now, previous.generation() + 1);
            if (snapshot.compareAndSet(previous, next)) {
                onTransition(previous, next, reason);
                return;
            }
        }
    }

    /**
     * Failures counted so far in the closed state, restarted after a quiet period.
     */
    private int countsSince(Snapshot current, Instant now) {
        if (current.lastFailureAt() == null) {
            return current.consecutiveFailures();
        }
        Duration quiet = Duration.between(current.lastFailureAt(), now);
        if (quiet.compareTo(settings.getFailureResetTimeout()) >= 0) {
            log.debug("Circuit {}: no failure for {}s, restarting the failure count", name, quiet.toSeconds());
            return 0;
        }
        return current.consecutiveFailures();
    }

    private boolean isStale(Permit permit, Snapshot current, String outcome) {
        if (permit.generation() == current.generation()) {
            return false;
        }
        staleOutcomes.increment();
        log.debug("Circuit {}: ignoring {} of a call admitted while {} (now {})",
                name, outcome, permit.admittedIn(), current.state());
        return true;
    }

    private void onTransition(Snapshot from, Snapshot to, String reason) {
        StateTransition transition = new StateTransition(from.state(), to.state(), to.transitionedAt(), reason);
        history.addLast(transition);
        while (history.size() > HISTORY_SIZE) {
            history.pollFirst();
        }
        log.info("Circuit {} transitioned {} -> {} ({})", name, from.state(), to.state(), reason);
    }

    private static String describe(Throwable cause) {
        return cause == null ? "" : ": " + cause.getClass().getSimpleName();
    }

    /**
     * Proof of admission, bound to the generation that granted it.
     */
    public record Permit(long generation, CircuitState admittedIn) {
    }

    /**
     * Immutable breaker state.
     */
    private record Snapshot(
            CircuitState state,
            long generation,
            int consecutiveFailures,
            int consecutiveSuccesses,
            int trialsInFlight,
            Instant transitionedAt,
            Instant lastFailureAt) {

        static Snapshot closed(Instant at, long generation) {
            return new Snapshot(CircuitState.CLOSED, generation, 0, 0, 0, at, null);
        }

        static Snapshot open(Instant at, long generation) {
            return new Snapshot(CircuitState.OPEN, generation, 0, 0, 0, at, null);
        }

        static Snapshot halfOpen(Instant at, long generation) {
            return new Snapshot(CircuitState.HALF_OPEN, generation, 0, 0, 0, at, null);
        }

        Snapshot withTrials(int trials) {
            return new Snapshot(state, generation, consecutiveFailures, consecutiveSuccesses, trials,
                    transitionedAt, lastFailureAt);
        }

        Snapshot withFailures(int failures, Instant at) {
            return new Snapshot(state, generation, failures, consecutiveSuccesses, trialsInFlight,
                    transitionedAt, at);
        }
    }
}
