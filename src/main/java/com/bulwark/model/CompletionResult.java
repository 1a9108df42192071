package com.bulwark.model;

import com.bulwark.cache.RequestFingerprint;
import com.bulwark.tokens.TokenEstimate;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Outcome of a successful call, either served from cache or from the provider.
 */
@Value
@Builder
public class CompletionResult {

    ProviderKey providerKey;
    RequestFingerprint fingerprint;
    ChatCompletionResponse response;
    boolean cacheHit;

    /**
     * Age of the cached entry, only set for cache hits.
     */
    Duration cacheAge;

    TokenEstimate tokenEstimate;
    Duration latency;
}
