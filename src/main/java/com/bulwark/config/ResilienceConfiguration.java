package com.bulwark.config;

import com.bulwark.cache.CachePolicy;
import com.bulwark.cache.RequestFingerprinter;
import com.bulwark.model.ProviderType;
import com.bulwark.provider.ChatProvider;
import com.bulwark.resilience.pool.ConnectionPool;
import com.bulwark.resilience.pool.PoolSettings;
import com.bulwark.resilience.pool.ReactorNettySessionFactory;
import com.bulwark.resilience.pool.SessionFactory;
import com.bulwark.resilience.ratelimit.RateLimiter;
import com.bulwark.service.AdminService;
import com.bulwark.service.ClientSettings;
import com.bulwark.service.FailureClassifier;
import com.bulwark.service.ProviderContext;
import com.bulwark.service.ProviderRegistry;
import com.bulwark.service.ProviderService;
import com.bulwark.service.ResilientClient;
import com.bulwark.service.StatisticsService;
import com.bulwark.tokens.TokenCounter;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Clock;
import java.util.List;

/**
 * Wires the per-provider resilience components from {@link BulwarkProperties}.
 */
@Slf4j
@Configuration
public class ResilienceConfiguration {

    private final ProviderRegistryFactory registryFactory;

    public ResilienceConfiguration(BulwarkProperties properties) {
        this.registryFactory = new ProviderRegistryFactory(properties);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ProviderRegistry providerRegistry(Clock clock) {
        return registryFactory.createRegistry(clock);
    }

    @Bean
    public PoolSettings poolSettings() {
        return registryFactory.poolSettings();
    }

    @Bean
    public SessionFactory sessionFactory(PoolSettings poolSettings, WebClient.Builder webClientBuilder) {
        return new ReactorNettySessionFactory(poolSettings, webClientBuilder);
    }

    @Bean(initMethod = "start", destroyMethod = "stop")
    public ConnectionPool connectionPool(PoolSettings poolSettings, SessionFactory sessionFactory,
                                         ProviderRegistry registry, Clock clock) {
        ConnectionPool pool = new ConnectionPool(poolSettings, sessionFactory, clock);
        for (ProviderContext context : registry.all()) {
            pool.registerHost(context.getSettings().getHostKey(),
                    context.getSettings().getMaxConnectionsPerHost(),
                    context.getSettings().getIdleTimeout());
        }
        log.info("Connection pool configured: maxTotal={}, maxPerHost={}, idleTimeout={}",
                poolSettings.getMaxTotalConnections(), poolSettings.getMaxConnectionsPerHost(),
                poolSettings.getIdleTimeout());
        return pool;
    }

    @Bean
    public RateLimiter rateLimiter(ProviderRegistry registry) {
        return new RateLimiter(registry.buckets());
    }

    @Bean
    public ProviderService providerService(List<ChatProvider> providers, ProviderRegistry registry) {
        ProviderService service = new ProviderService(providers);
        for (ProviderContext context : registry.all()) {
            ProviderType type = context.getSettings().getType();
            if (!service.supports(type)) {
                throw new IllegalStateException("Provider '" + context.getKey() + "' uses type " + type
                        + " but no adapter is available for it");
            }
        }
        return service;
    }

    @Bean
    public RequestFingerprinter requestFingerprinter(ObjectMapper objectMapper) {
        return new RequestFingerprinter(objectMapper);
    }

    @Bean
    public CachePolicy cachePolicy() {
        return new CachePolicy();
    }

    @Bean
    public TokenCounter tokenCounter() {
        return new TokenCounter();
    }

    @Bean
    public FailureClassifier failureClassifier() {
        return new FailureClassifier();
    }

    @Bean
    public ClientSettings clientSettings() {
        return registryFactory.clientSettings();
    }

    @Bean
    public ResilientClient resilientClient(ProviderRegistry registry, RateLimiter rateLimiter,
                                           ConnectionPool connectionPool, ProviderService providerService,
                                           RequestFingerprinter fingerprinter, CachePolicy cachePolicy,
                                           TokenCounter tokenCounter, FailureClassifier failureClassifier,
                                           ObjectMapper objectMapper, ClientSettings clientSettings) {
        return new ResilientClient(registry, rateLimiter, connectionPool, providerService, fingerprinter,
                cachePolicy, tokenCounter, failureClassifier, objectMapper, clientSettings);
    }

    @Bean
    public StatisticsService statisticsService(ProviderRegistry registry, RateLimiter rateLimiter,
                                               ConnectionPool connectionPool) {
        return new StatisticsService(registry, rateLimiter, connectionPool);
    }

    @Bean
    public AdminService adminService(ProviderRegistry registry, RateLimiter rateLimiter) {
        return new AdminService(registry, rateLimiter);
    }
}
