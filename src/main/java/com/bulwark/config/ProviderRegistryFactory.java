package com.bulwark.config;

import com.bulwark.cache.CacheSettings;
import com.bulwark.cache.ResponseCache;
import com.bulwark.model.HostKey;
import com.bulwark.model.ProviderKey;
import com.bulwark.model.ProviderType;
import com.bulwark.resilience.breaker.CircuitBreaker;
import com.bulwark.resilience.breaker.CircuitBreakerSettings;
import com.bulwark.resilience.pool.PoolSettings;
import com.bulwark.resilience.ratelimit.RateLimitSettings;
import com.bulwark.resilience.ratelimit.RateLimitUnit;
import com.bulwark.resilience.ratelimit.TokenBucket;
import com.bulwark.service.ClientSettings;
import com.bulwark.service.ProviderContext;
import com.bulwark.service.ProviderRegistry;
import com.bulwark.tokens.TokenCounterSettings;
import com.bulwark.tokens.UsageTracker;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Turns bound properties into validated settings and the provider registry.
 * Any invalid value aborts startup with an {@link IllegalArgumentException} naming the provider.
 */
@Slf4j
public class ProviderRegistryFactory {

    private final BulwarkProperties properties;

    public ProviderRegistryFactory(BulwarkProperties properties) {
        this.properties = properties;
    }

    public ProviderRegistry createRegistry(Clock clock) {
        List<ProviderContext> contexts = new ArrayList<>();
        for (ProviderSettings settings : resolveProviders()) {
            String name = settings.getKey().getName();
            contexts.add(ProviderContext.builder()
                    .settings(settings)
                    .bucket(new TokenBucket(name, settings.getRateLimit(), clock))
                    .breaker(new CircuitBreaker(name, settings.getCircuitBreaker(), clock))
                    .cache(new ResponseCache(name, settings.getCache(), clock))
                    .usage(new UsageTracker())
                    .build());
        }
        ProviderRegistry registry = new ProviderRegistry(contexts);
        log.info("Provider registry built with {} providers: {}", registry.size(), properties.getProviders().keySet());
        return registry;
    }

    public List<ProviderSettings> resolveProviders() {
        List<ProviderSettings> resolved = new ArrayList<>();
        for (Map.Entry<String, BulwarkProperties.ProviderConfig> entry : properties.getProviders().entrySet()) {
            try {
                resolved.add(resolve(ProviderKey.of(entry.getKey()), entry.getValue()));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Invalid configuration for provider '" + entry.getKey() + "': "
                        + e.getMessage(), e);
            }
        }
        return resolved;
    }

    ProviderSettings resolve(ProviderKey key, BulwarkProperties.ProviderConfig config) {
        if (config.getType() == null) {
            throw new IllegalArgumentException("type must be set");
        }
        if (config.getBaseUrl() == null || config.getBaseUrl().isBlank()) {
            throw new IllegalArgumentException("base-url must be set");
        }
        String baseUrl = stripTrailingSlash(config.getBaseUrl().trim());
        HostKey hostKey = HostKey.fromUrl(baseUrl);

        BulwarkProperties.PoolConfig pool = properties.getPool();
        int maxPerHost = valueOr(config.getMaxConnectionsPerHost(), pool.getMaxConnectionsPerHost());
        if (maxPerHost <= 0) {
            throw new IllegalArgumentException("max-connections-per-host must be positive, got " + maxPerHost);
        }
        if (config.getMaxTotalConnections() != null && config.getMaxTotalConnections() <= 0) {
            throw new IllegalArgumentException("max-total-connections must be positive, got " + config.getMaxTotalConnections());
        }

        ProviderType type = config.getType();
        RateLimitSettings rateLimit = RateLimitSettings.builder()
                .ratePerSecond(valueOr(config.getRateLimitPerSecond(), type.getDefaultRatePerSecond()))
                .capacity(valueOr(config.getBurstCapacity(), type.getDefaultBurstCapacity()))
                .build();
        rateLimit.validate();

        CircuitBreakerSettings breaker = CircuitBreakerSettings.builder()
                .failureThreshold(valueOr(config.getFailureThreshold(), type.getDefaultFailureThreshold()))
                .successThreshold(valueOr(config.getSuccessThreshold(), CircuitBreakerSettings.DEFAULT_SUCCESS_THRESHOLD))
                .recoveryTimeout(valueOr(config.getRecoveryTimeout(), type.getDefaultRecoveryTimeout()))
                .failureResetTimeout(valueOr(config.getFailureResetTimeout(), CircuitBreakerSettings.DEFAULT_FAILURE_RESET_TIMEOUT))
                .halfOpenMaxCalls(config.getHalfOpenMaxCalls())
                .build();
        breaker.validate();

        BulwarkProperties.CacheConfig cacheDefaults = properties.getCache();
        CacheSettings cache = CacheSettings.builder()
                .mode(valueOr(config.getCacheMode(), cacheDefaults.getMode()))
                .defaultTtl(valueOr(config.getDefaultTtl(), cacheDefaults.getDefaultTtl()))
                .minTtl(cacheDefaults.getMinTtl())
                .maxTtl(cacheDefaults.getMaxTtl())
                .maxEntries(valueOr(config.getMaxCacheEntries(), cacheDefaults.getMaxEntries()))
                .compressionThresholdBytes(valueOr(config.getCompressionThresholdBytes(), cacheDefaults.getCompressionThresholdBytes()))
                .maxPayloadBytes(cacheDefaults.getMaxPayloadBytes())
                .deterministicTemperature(cacheDefaults.getDeterministicTemperature())
                .cacheableModels(config.getCacheableModels())
                .excludedPatterns(List.copyOf(cacheDefaults.getExcludedPatterns()))
                .build();
        cache.validate();

        TokenCounterSettings tokenCounter = TokenCounterSettings.builder()
                .providerType(config.getType())
                .charsPerToken(config.getCharsPerToken())
                .contextWindow(config.getContextWindow())
                .pricePer1kTokens(config.getPricePer1kTokens())
                .build();
        tokenCounter.validate();

        return ProviderSettings.builder()
                .key(key)
                .type(config.getType())
                .baseUrl(baseUrl)
                .hostKey(hostKey)
                .apiKey(config.getApiKey())
                .maxConnectionsPerHost(maxPerHost)
                .idleTimeout(valueOr(config.getIdleTimeout(), pool.getIdleTimeout()))
                .rateLimit(rateLimit)
                .rateLimitUnit(valueOr(config.getRateLimitUnit(), RateLimitUnit.REQUESTS))
                .circuitBreaker(breaker)
                .cache(cache)
                .tokenCounter(tokenCounter)
                .build();
    }

    /**
     * Pool-wide settings. Without an explicit {@code bulwark.pool.max-total-connections}, the smallest
     * provider-level value applies, else 100.
     */
    public PoolSettings poolSettings() {
        BulwarkProperties.PoolConfig pool = properties.getPool();
        Integer maxTotal = pool.getMaxTotalConnections();
        if (maxTotal == null) {
            maxTotal = properties.getProviders().values().stream()
                    .map(BulwarkProperties.ProviderConfig::getMaxTotalConnections)
                    .filter(Objects::nonNull)
                    .min(Integer::compare)
                    .orElse(null);
        }

        PoolSettings.PoolSettingsBuilder builder = PoolSettings.builder()
                .maxConnectionsPerHost(pool.getMaxConnectionsPerHost())
                .idleTimeout(pool.getIdleTimeout())
                .reaperInterval(pool.getReaperInterval())
                .dnsCacheTtl(pool.getDnsCacheTtl())
                .connectTimeout(pool.getConnectTimeout());
        if (maxTotal != null) {
            builder.maxTotalConnections(maxTotal);
        }
        PoolSettings settings = builder.build();
        settings.validate();
        return settings;
    }

    public ClientSettings clientSettings() {
        BulwarkProperties.ClientConfig client = properties.getClient();
        ClientSettings settings = ClientSettings.builder()
                .defaultTimeout(client.getDefaultTimeout())
                .rateLimitWait(client.getRateLimitWait())
                .poolAcquireTimeout(client.getPoolAcquireTimeout())
                .build();
        settings.validate();
        return settings;
    }

    private static String stripTrailingSlash(String url) {
        String result = url;
        while (result.endsWith("/")) {
            result = result.substring(0, result.length() - 1);
        }
        return result;
    }

    private static <T> T valueOr(T value, T fallback) {
        return value != null ? value : fallback;
    }
}
