package com.bulwark.config;

import com.bulwark.cache.CacheSettings;
import com.bulwark.model.HostKey;
import com.bulwark.model.ProviderKey;
import com.bulwark.model.ProviderType;
import com.bulwark.resilience.breaker.CircuitBreakerSettings;
import com.bulwark.resilience.ratelimit.RateLimitSettings;
import com.bulwark.resilience.ratelimit.RateLimitUnit;
import com.bulwark.tokens.TokenCounterSettings;
import lombok.Builder;
import lombok.ToString;
import lombok.Value;

import java.time.Duration;

/**
 * Validated, defaults-applied settings of one provider key.
 */
@Value
@Builder
public class ProviderSettings {

    ProviderKey key;
    ProviderType type;

    /**
     * Base URL without trailing slash.
     */
    String baseUrl;

    HostKey hostKey;

    @ToString.Exclude
    String apiKey;

    int maxConnectionsPerHost;
    Duration idleTimeout;
    RateLimitSettings rateLimit;
    RateLimitUnit rateLimitUnit;
    CircuitBreakerSettings circuitBreaker;
    CacheSettings cache;
    TokenCounterSettings tokenCounter;

    public boolean hasApiKey() {
        return apiKey != null && !apiKey.isBlank();
    }

    public String endpoint(String path) {
        return baseUrl + path;
    }
}
