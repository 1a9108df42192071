package com.bulwark.resilience.ratelimit;

import com.bulwark.exception.UnknownProviderException;
import com.bulwark.model.ProviderKey;
import com.bulwark.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RateLimiterTest {

    private final ProviderKey openai = ProviderKey.of("openai");
    private final ProviderKey ollama = ProviderKey.of("ollama");
    private RateLimiter rateLimiter;

    @BeforeEach
    void setUp() {
        MutableClock clock = new MutableClock();
        rateLimiter = new RateLimiter(Map.of(
                openai, new TokenBucket("openai", RateLimitSettings.builder().ratePerSecond(1.0).capacity(2).build(), clock),
                ollama, new TokenBucket("ollama", RateLimitSettings.builder().ratePerSecond(1.0).capacity(5).build(), clock)));
    }

    @Test
    void bucketsAreIndependentPerProvider() {
        assertTrue(rateLimiter.tryAcquire(openai, 2, Duration.ZERO));
        assertFalse(rateLimiter.tryAcquire(openai, 1, Duration.ZERO));

        assertTrue(rateLimiter.tryAcquire(ollama, 5, Duration.ZERO));
    }

    @Test
    void refundAndResetTargetOneProvider() {
        assertTrue(rateLimiter.tryAcquire(openai, 2, Duration.ZERO));
        rateLimiter.refund(openai, 1);
        assertTrue(rateLimiter.tryAcquire(openai, 1, Duration.ZERO));

        rateLimiter.reset(openai);
        assertEquals(2.0, rateLimiter.statistics(openai).getAvailableTokens(), 1e-9);
        assertEquals(2, rateLimiter.capacity(openai));
    }

    @Test
    void unknownProviderIsRejected() {
        ProviderKey missing = ProviderKey.of("missing");
        UnknownProviderException e = assertThrows(UnknownProviderException.class,
                () -> rateLimiter.tryAcquire(missing, 1, Duration.ZERO));
        assertEquals(missing, e.getProviderKey());
    }
}
