package com.bulwark.resilience.ratelimit;

import com.bulwark.exception.UnknownProviderException;
import com.bulwark.model.ProviderKey;
import com.bulwark.model.dto.RateLimiterStatistics;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Map;

/**
 * One token bucket per provider key.
 * Gates how many calls may start per unit of time, independently of pool state.
 */
@Slf4j
public class RateLimiter {

    private final Map<ProviderKey, TokenBucket> buckets;

    public RateLimiter(Map<ProviderKey, TokenBucket> buckets) {
        this.buckets = Map.copyOf(buckets);
    }

    /**
     * Take tokens from the provider's bucket, waiting up to {@code timeout} for them.
     *
     * @return true if the tokens were taken
     * @throws UnknownProviderException if no bucket exists for the key
     */
    public boolean tryAcquire(ProviderKey key, int tokens, Duration timeout) {
        boolean acquired = bucket(key).tryAcquire(tokens, timeout);
        if (!acquired) {
            log.warn("Rate limit reached for provider {} ({} tokens requested)", key, tokens);
        }
        return acquired;
    }

    public void refund(ProviderKey key, int tokens) {
        bucket(key).refund(tokens);
    }

    public int capacity(ProviderKey key) {
        return bucket(key).getCapacity();
    }

    public void reset(ProviderKey key) {
        bucket(key).reset();
    }

    public RateLimiterStatistics statistics(ProviderKey key) {
        return bucket(key).statistics();
    }

    private TokenBucket bucket(ProviderKey key) {
        TokenBucket bucket = buckets.get(key);
        if (bucket == null) {
            throw new UnknownProviderException(key);
        }
        return bucket;
    }
}
