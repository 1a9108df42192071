package com.bulwark.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Every statistic for one provider key, for external monitoring.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProviderStatistics {

    private String provider;
    private String type;
    private String baseUrl;
    private PoolStatistics pool;
    private RateLimiterStatistics rateLimiter;
    private CircuitBreakerStatistics circuitBreaker;
    private CacheStatistics cache;
    private UsageStatistics usage;
}
