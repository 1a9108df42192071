package com.bulwark.service;

import com.bulwark.config.ProviderSettings;
import com.bulwark.model.ProviderKey;
import com.bulwark.model.dto.ProviderStatistics;
import com.bulwark.resilience.pool.ConnectionPool;
import com.bulwark.resilience.ratelimit.RateLimiter;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Read-only snapshots of every per-provider counter, for external monitoring.
 */
public class StatisticsService {

    private final ProviderRegistry registry;
    private final RateLimiter rateLimiter;
    private final ConnectionPool connectionPool;

    public StatisticsService(ProviderRegistry registry, RateLimiter rateLimiter, ConnectionPool connectionPool) {
        this.registry = registry;
        this.rateLimiter = rateLimiter;
        this.connectionPool = connectionPool;
    }

    public List<ProviderStatistics> all() {
        return registry.all().stream()
                .map(this::snapshot)
                .collect(Collectors.toList());
    }

    /**
     * @throws com.bulwark.exception.UnknownProviderException if the key is not configured
     */
    public ProviderStatistics forProvider(ProviderKey key) {
        return snapshot(registry.require(key));
    }

    private ProviderStatistics snapshot(ProviderContext context) {
        ProviderSettings settings = context.getSettings();
        return ProviderStatistics.builder()
                .provider(settings.getKey().getName())
                .type(settings.getType().name())
                .baseUrl(settings.getBaseUrl())
                .pool(connectionPool.statistics(settings.getHostKey()))
                .rateLimiter(rateLimiter.statistics(settings.getKey()))
                .circuitBreaker(context.getBreaker().statistics())
                .cache(context.getCache().statistics())
                .usage(context.getUsage().statistics())
                .build();
    }
}
