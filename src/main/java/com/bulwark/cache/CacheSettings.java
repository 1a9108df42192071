package com.bulwark.cache;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Duration;
import java.util.List;

/**
 * Cache parameters for one provider.
 */
@Value
@Builder(toBuilder = true)
public class CacheSettings {

    public static final List<String> DEFAULT_EXCLUDED_PATTERNS = List.of("password", "secret", "api_key", "private key");

    @Builder.Default
    CacheMode mode = CacheMode.SELECTIVE;

    @Builder.Default
    Duration defaultTtl = Duration.ofSeconds(300);

    @Builder.Default
    Duration minTtl = Duration.ofSeconds(30);

    @Builder.Default
    Duration maxTtl = Duration.ofSeconds(3600);

    @Builder.Default
    int maxEntries = 1000;

    /**
     * Payloads of at least this many bytes are compressed.
     */
    @Builder.Default
    int compressionThresholdBytes = 1024;

    /**
     * Larger payloads are never stored.
     */
    @Builder.Default
    int maxPayloadBytes = 1024 * 1024;

    /**
     * Requests at or below this temperature are deterministic.
     */
    @Builder.Default
    double deterministicTemperature = 0.3;

    /**
     * Models eligible in selective mode. Empty means every model.
     */
    @Singular
    List<String> cacheableModels;

    /**
     * Case-insensitive substrings that keep a request out of the cache.
     */
    @Builder.Default
    List<String> excludedPatterns = DEFAULT_EXCLUDED_PATTERNS;

    public void validate() {
        if (mode == null) {
            throw new IllegalArgumentException("cache mode must be set");
        }
        requirePositive("defaultTtl", defaultTtl);
        requirePositive("minTtl", minTtl);
        requirePositive("maxTtl", maxTtl);
        if (minTtl.compareTo(maxTtl) > 0) {
            throw new IllegalArgumentException("minTtl " + minTtl + " exceeds maxTtl " + maxTtl);
        }
        if (maxEntries <= 0) {
            throw new IllegalArgumentException("maxEntries must be positive, got " + maxEntries);
        }
        if (compressionThresholdBytes < 0) {
            throw new IllegalArgumentException("compressionThresholdBytes must not be negative, got " + compressionThresholdBytes);
        }
        if (maxPayloadBytes <= 0) {
            throw new IllegalArgumentException("maxPayloadBytes must be positive, got " + maxPayloadBytes);
        }
    }

    private static void requirePositive(String field, Duration value) {
        if (value == null || value.isNegative() || value.isZero()) {
            throw new IllegalArgumentException(field + " must be positive, got " + value);
        }
    }
}
