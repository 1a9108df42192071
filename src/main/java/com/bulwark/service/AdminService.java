package com.bulwark.service;

import com.bulwark.cache.RequestFingerprint;
import com.bulwark.model.ProviderKey;
import com.bulwark.resilience.breaker.CircuitState;
import com.bulwark.resilience.ratelimit.RateLimiter;
import lombok.extern.slf4j.Slf4j;

/**
 * Operator controls over per-provider breakers, buckets and caches.
 */
@Slf4j
public class AdminService {

    private final ProviderRegistry registry;
    private final RateLimiter rateLimiter;

    public AdminService(ProviderRegistry registry, RateLimiter rateLimiter) {
        this.registry = registry;
        this.rateLimiter = rateLimiter;
    }

    public CircuitState forceOpen(ProviderKey key) {
        log.info("Operator forcing circuit of {} open", key);
        ProviderContext context = registry.require(key);
        context.getBreaker().forceOpen();
        return context.getBreaker().getState();
    }

    public CircuitState forceClosed(ProviderKey key) {
        log.info("Operator forcing circuit of {} closed", key);
        ProviderContext context = registry.require(key);
        context.getBreaker().forceClosed();
        return context.getBreaker().getState();
    }

    public CircuitState resetBreaker(ProviderKey key) {
        ProviderContext context = registry.require(key);
        context.getBreaker().reset();
        return context.getBreaker().getState();
    }

    public void resetRateLimiter(ProviderKey key) {
        registry.require(key);
        rateLimiter.reset(key);
    }

    /**
     * @return number of entries removed
     */
    public int clearCache(ProviderKey key) {
        return registry.require(key).getCache().clear();
    }

    /**
     * Clear every provider's cache.
     *
     * @return number of entries removed
     */
    public int clearAllCaches() {
        return registry.all().stream()
                .mapToInt(context -> context.getCache().clear())
                .sum();
    }

    public int purgeExpired(ProviderKey key) {
        return registry.require(key).getCache().purgeExpired();
    }

    public boolean invalidate(ProviderKey key, RequestFingerprint fingerprint) {
        boolean removed = registry.require(key).getCache().invalidate(fingerprint);
        log.info("Invalidated cache entry {} on {}: {}", fingerprint.shortValue(), key, removed);
        return removed;
    }
}
