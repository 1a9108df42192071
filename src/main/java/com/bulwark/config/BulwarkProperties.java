package com.bulwark.config;

import com.bulwark.cache.CacheMode;
import com.bulwark.cache.CacheSettings;
import com.bulwark.model.ProviderType;
import com.bulwark.resilience.ratelimit.RateLimitUnit;
import lombok.Data;
import lombok.ToString;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration properties for Bulwark.
 * Provider fields left unset fall back to the defaults of the matching settings class.
 */
@Data
@Component
@ConfigurationProperties(prefix = "bulwark")
public class BulwarkProperties {

    private Map<String, ProviderConfig> providers = new LinkedHashMap<>();
    private PoolConfig pool = new PoolConfig();
    private ClientConfig client = new ClientConfig();
    private CacheConfig cache = new CacheConfig();

    @Data
    public static class ProviderConfig {
        private ProviderType type = ProviderType.OPENAI;
        private String baseUrl;

        @ToString.Exclude
        private String apiKey;

        private Integer maxConnectionsPerHost;

        /**
         * Pool-wide bound; the smallest configured value wins unless {@code bulwark.pool} sets one.
         */
        private Integer maxTotalConnections;

        private Duration idleTimeout;
        private Double rateLimitPerSecond;
        private Integer burstCapacity;
        private RateLimitUnit rateLimitUnit = RateLimitUnit.REQUESTS;
        private Integer failureThreshold;
        private Integer successThreshold;
        private Duration recoveryTimeout;
        private Duration failureResetTimeout;
        private Integer halfOpenMaxCalls;
        private CacheMode cacheMode;
        private Duration defaultTtl;
        private Integer maxCacheEntries;
        private Integer compressionThresholdBytes;
        private List<String> cacheableModels = new ArrayList<>();
        private Double charsPerToken;
        private Integer contextWindow;
        private Map<String, Double> pricePer1kTokens = new LinkedHashMap<>();
    }

    @Data
    public static class PoolConfig {
        private Integer maxTotalConnections;
        private int maxConnectionsPerHost = 20;
        private Duration idleTimeout = Duration.ofSeconds(300);
        private Duration reaperInterval = Duration.ofSeconds(60);
        private Duration dnsCacheTtl = Duration.ofSeconds(300);
        private Duration connectTimeout = Duration.ofSeconds(30);
    }

    @Data
    public static class ClientConfig {
        private Duration defaultTimeout = Duration.ofSeconds(60);
        private Duration rateLimitWait = Duration.ofSeconds(5);
        private Duration poolAcquireTimeout = Duration.ofSeconds(10);
    }

    /**
     * Defaults shared by every provider cache.
     */
    @Data
    public static class CacheConfig {
        private CacheMode mode = CacheMode.SELECTIVE;
        private Duration defaultTtl = Duration.ofSeconds(300);
        private Duration minTtl = Duration.ofSeconds(30);
        private Duration maxTtl = Duration.ofSeconds(3600);
        private int maxEntries = 1000;
        private int compressionThresholdBytes = 1024;
        private int maxPayloadBytes = 1024 * 1024;
        private double deterministicTemperature = 0.3;
        private List<String> excludedPatterns = new ArrayList<>(CacheSettings.DEFAULT_EXCLUDED_PATTERNS);
    }
}
