package com.bulwark.model;

import lombok.Builder;
import lombok.Value;

/**
 * Per-request overrides of cache behavior.
 *
 * Allows a caller to:
 * - Bypass the cache lookup (always reach the provider)
 * - Prevent storage of the response (sensitive queries)
 */
@Value
@Builder
public class CacheControlContext {

    /**
     * Whether to bypass cache lookup entirely.
     */
    @Builder.Default
    boolean bypass = false;

    /**
     * Whether to store the response in cache.
     */
    @Builder.Default
    boolean store = true;

    /**
     * Create default context (no overrides).
     */
    public static CacheControlContext defaults() {
        return CacheControlContext.builder().build();
    }

    public boolean shouldLookup() {
        return !bypass;
    }

    public boolean shouldStore() {
        return store;
    }
}
