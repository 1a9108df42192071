package com.bulwark.service;

import com.bulwark.cache.ResponseCache;
import com.bulwark.config.ProviderSettings;
import com.bulwark.model.ProviderKey;
import com.bulwark.resilience.breaker.CircuitBreaker;
import com.bulwark.resilience.ratelimit.TokenBucket;
import com.bulwark.tokens.UsageTracker;
import lombok.Builder;
import lombok.Value;

/**
 * Everything owned by one provider key.
 */
@Value
@Builder
public class ProviderContext {

    ProviderSettings settings;
    TokenBucket bucket;
    CircuitBreaker breaker;
    ResponseCache cache;
    UsageTracker usage;

    public ProviderKey getKey() {
        return settings.getKey();
    }
}
