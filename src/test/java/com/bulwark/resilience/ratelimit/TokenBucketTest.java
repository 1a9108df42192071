package com.bulwark.resilience.ratelimit;

import com.bulwark.model.dto.RateLimiterStatistics;
import com.bulwark.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("TokenBucket")
class TokenBucketTest {

    private MutableClock clock;
    private TokenBucket bucket;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        bucket = new TokenBucket("test", RateLimitSettings.builder()
                .ratePerSecond(2.0)
                .capacity(10)
                .build(), clock);
    }

    @Nested
    @DisplayName("Consumption")
    class Consumption {

        @Test
        @DisplayName("Starts full and admits up to capacity")
        void admitsUpToCapacity() {
            for (int i = 0; i < 10; i++) {
                assertTrue(bucket.tryConsume(1), "call " + i + " should be admitted");
            }
            assertFalse(bucket.tryConsume(1));
            assertEquals(0.0, bucket.availableTokens(), 1e-9);
        }

        @Test
        @DisplayName("Rejects requests larger than capacity without touching the bucket")
        void rejectsAboveCapacity() {
            assertFalse(bucket.tryAcquire(11, Duration.ofSeconds(5)));
            assertEquals(10.0, bucket.availableTokens(), 1e-9);
        }

        @Test
        @DisplayName("Rejects non-positive token counts")
        void rejectsNonPositiveCounts() {
            assertThrows(IllegalArgumentException.class, () -> bucket.tryConsume(0));
        }

        @Test
        @DisplayName("Multi-token requests are all or nothing")
        void allOrNothing() {
            assertTrue(bucket.tryConsume(8));
            assertFalse(bucket.tryConsume(3));
            assertEquals(2.0, bucket.availableTokens(), 1e-9);
        }
    }

    @Nested
    @DisplayName("Refill")
    class Refill {

        @Test
        @DisplayName("Refills at the configured rate")
        void refillsAtRate() {
            assertTrue(bucket.tryConsume(10));

            clock.advance(Duration.ofMillis(1500));

            assertEquals(3.0, bucket.availableTokens(), 1e-9);
            assertTrue(bucket.tryConsume(3));
            assertFalse(bucket.tryConsume(1));
        }

        @Test
        @DisplayName("Is full again after capacity / rate seconds")
        void fullAfterCapacityOverRate() {
            assertTrue(bucket.tryConsume(10));

            clock.advanceSeconds(5);

            assertEquals(10.0, bucket.availableTokens(), 1e-9);
        }

        @Test
        @DisplayName("Never exceeds capacity")
        void neverExceedsCapacity() {
            clock.advanceSeconds(3600);
            assertEquals(10.0, bucket.availableTokens(), 1e-9);
        }

        @Test
        @DisplayName("Admitted calls never exceed capacity plus refill over a window")
        void conservation() {
            int admitted = 0;
            for (int second = 0; second < 20; second++) {
                for (int i = 0; i < 10; i++) {
                    if (bucket.tryConsume(1)) {
                        admitted++;
                    }
                }
                clock.advance(Duration.ofMillis(250));
            }
            // 20 steps of 250ms = 5s at 2 tokens/s
            assertTrue(admitted <= 10 + 10, "admitted " + admitted);
            assertTrue(admitted >= 10);
        }
    }

    @Nested
    @DisplayName("Refund and reset")
    class RefundAndReset {

        @Test
        @DisplayName("Refund returns tokens, capped at capacity")
        void refund() {
            assertTrue(bucket.tryConsume(4));
            bucket.refund(2);
            assertEquals(8.0, bucket.availableTokens(), 1e-9);

            bucket.refund(100);
            assertEquals(10.0, bucket.availableTokens(), 1e-9);
        }

        @Test
        @DisplayName("Reset refills to capacity")
        void reset() {
            assertTrue(bucket.tryConsume(10));
            bucket.reset();
            assertEquals(10.0, bucket.availableTokens(), 1e-9);
        }

        @Test
        @DisplayName("Statistics count admitted and rejected calls")
        void statistics() {
            bucket.tryConsume(10);
            bucket.tryConsume(1);

            RateLimiterStatistics stats = bucket.statistics();
            assertEquals(1, stats.getAdmitted());
            assertEquals(1, stats.getRejected());
            assertEquals(10, stats.getCapacity());
            assertEquals(2.0, stats.getRatePerSecond(), 1e-9);
        }
    }

    @Nested
    @DisplayName("Waiting")
    class Waiting {

        @Test
        @DisplayName("Waits for refill within the timeout")
        void waitsForRefill() {
            TokenBucket realTime = new TokenBucket("real", RateLimitSettings.builder()
                    .ratePerSecond(20.0)
                    .capacity(1)
                    .build(), Clock.systemUTC());
            assertTrue(realTime.tryConsume(1));

            long start = System.nanoTime();
            assertTrue(realTime.tryAcquire(1, Duration.ofSeconds(2)));
            long waitedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
            assertTrue(waitedMillis < 2000, "waited " + waitedMillis + "ms");
        }

        @Test
        @DisplayName("Gives up when the timeout elapses first")
        void timesOut() {
            TokenBucket slow = new TokenBucket("slow", RateLimitSettings.builder()
                    .ratePerSecond(0.1)
                    .capacity(1)
                    .build(), Clock.systemUTC());
            assertTrue(slow.tryConsume(1));

            assertFalse(slow.tryAcquire(1, Duration.ofMillis(50)));
        }
    }

    @Test
    @DisplayName("Concurrent callers never take more than capacity")
    void concurrentCallers() throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Integer>> futures = new ArrayList<>();
        try {
            for (int t = 0; t < 8; t++) {
                futures.add(executor.submit(() -> {
                    start.await();
                    int taken = 0;
                    for (int i = 0; i < 50; i++) {
                        if (bucket.tryConsume(1)) {
                            taken++;
                        }
                    }
                    return taken;
                }));
            }
            start.countDown();

            int total = 0;
            for (Future<Integer> future : futures) {
                total += future.get(10, TimeUnit.SECONDS);
            }
            assertEquals(10, total);
        } finally {
            executor.shutdownNow();
        }
    }
}
