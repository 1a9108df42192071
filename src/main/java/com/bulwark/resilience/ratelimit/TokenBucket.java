package com.bulwark.resilience.ratelimit;

import com.bulwark.model.dto.RateLimiterStatistics;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.atomic.LongAdder;

/**
 * Token bucket for one provider.
 *
 * Refill is computed lazily from wall-clock deltas at every acquire attempt, so an idle
 * bucket costs nothing. Each acquisition is a single compare-and-set of an immutable
 * {@link BucketState}; concurrent callers never hold a lock.
 */
@Slf4j
public class TokenBucket {

    private static final long MAX_WAIT_STEP_NANOS = TimeUnit.SECONDS.toNanos(1);
    private static final long MIN_WAIT_STEP_NANOS = TimeUnit.MILLISECONDS.toNanos(1);

    private final String name;
    private final double ratePerSecond;
    private final int capacity;
    private final Clock clock;
    private final AtomicReference<BucketState> state;

    private final LongAdder admitted = new LongAdder();
    private final LongAdder rejected = new LongAdder();

    public TokenBucket(String name, RateLimitSettings settings, Clock clock) {
        settings.validate();
        this.name = name;
        this.ratePerSecond = settings.getRatePerSecond();
        this.capacity = settings.getCapacity();
        this.clock = clock;
        this.state = new AtomicReference<>(BucketState.full(capacity, clock.instant()));
    }

    /**
     * Take tokens without waiting.
     *
     * @param tokens number of tokens, at least 1
     * @return true if the tokens were taken
     */
    public boolean tryConsume(int tokens) {
        return tryAcquire(tokens, Duration.ZERO);
    }

    /**
     * Take tokens, waiting up to {@code timeout} for them to accrue.
     * A zero timeout fails fast. Requests above the bucket capacity are rejected at once.
     *
     * @param tokens  number of tokens, at least 1
     * @param timeout longest time to wait
     * @return true if the tokens were taken
     */
    public boolean tryAcquire(int tokens, Duration timeout) {
        if (tokens < 1) {
            throw new IllegalArgumentException("tokens must be at least 1, got " + tokens);
        }
        if (tokens > capacity) {
            log.debug("Bucket {}: request for {} tokens exceeds capacity {}", name, tokens, capacity);
            rejected.increment();
            return false;
        }

        long waitBudgetNanos = timeout == null || timeout.isNegative() ? 0 : timeout.toNanos();
        long waitDeadline = System.nanoTime() + waitBudgetNanos;

        while (true) {
            long shortfallNanos = attempt(tokens);
            if (shortfallNanos == 0) {
                admitted.increment();
                return true;
            }

            long remaining = waitDeadline - System.nanoTime();
            if (waitBudgetNanos == 0 || remaining <= 0) {
                rejected.increment();
                log.debug("Bucket {}: rejected request for {} tokens", name, tokens);
                return false;
            }

            long pause = Math.max(MIN_WAIT_STEP_NANOS, Math.min(shortfallNanos, Math.min(remaining, MAX_WAIT_STEP_NANOS)));
            try {
                TimeUnit.NANOSECONDS.sleep(pause);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                rejected.increment();
                log.debug("Bucket {}: interrupted while waiting for {} tokens", name, tokens);
                return false;
            }
        }
    }

    /**
     * Return tokens that were taken but never used, capped at capacity.
     */
    public void refund(int tokens) {
        if (tokens < 1) {
            return;
        }
        state.updateAndGet(current -> current.refill(ratePerSecond, capacity, clock.instant()).give(tokens, capacity));
        log.debug("Bucket {}: refunded {} tokens", name, tokens);
    }

    /**
     * Tokens available right now, including accrued refill. Does not modify the bucket.
     */
    public double availableTokens() {
        return state.get().refill(ratePerSecond, capacity, clock.instant()).tokens();
    }

    /**
     * Refill the bucket to full capacity.
     */
    public void reset() {
        state.set(BucketState.full(capacity, clock.instant()));
        log.info("Bucket {} reset to full capacity", name);
    }

    public RateLimiterStatistics statistics() {
        return RateLimiterStatistics.builder()
                .availableTokens(availableTokens())
                .capacity(capacity)
                .ratePerSecond(ratePerSecond)
                .admitted(admitted.sum())
                .rejected(rejected.sum())
                .build();
    }

    public int getCapacity() {
        return capacity;
    }

    /**
     * One atomic check-and-decrement.
     *
     * @return 0 if the tokens were taken, otherwise the estimated nanoseconds until enough tokens accrue
     */
    private long attempt(int tokens) {
        while (true) {
            BucketState current = state.get();
            BucketState refilled = current.refill(ratePerSecond, capacity, clock.instant());

            if (refilled.tokens() >= tokens) {
                if (state.compareAndSet(current, refilled.take(tokens))) {
                    return 0;
                }
                continue;
            }

            double missing = tokens - refilled.tokens();
            long shortfall = (long) Math.ceil(missing / ratePerSecond * 1_000_000_000.0);
            return Math.max(1, shortfall);
        }
    }
}
