package com.bulwark.controller;

/**
 * HTTP headers for per-request cache control and response provenance.
 */
public final class BulwarkHeaders {

    // ========== Request Control Headers ==========

    /**
     * Bypass cache lookup (always forward to provider).
     * Example: x-cache-bypass: true
     */
    public static final String CACHE_BYPASS = "x-cache-bypass";

    /**
     * Control whether the response may be cached.
     * Example: x-cache-store: false
     */
    public static final String CACHE_STORE = "x-cache-store";

    /**
     * End-to-end deadline in milliseconds for this request.
     */
    public static final String TIMEOUT_MS = "x-timeout-ms";

    // ========== Response Provenance Headers ==========

    public static final String CACHE_HIT = "x-cache-hit";

    /**
     * Age of the cached entry in seconds. Only present for cache hits.
     */
    public static final String CACHE_AGE = "x-cache-age";

    public static final String PROVIDER = "x-provider";

    public static final String ESTIMATED_TOKENS = "x-estimated-tokens";

    public static final String FINGERPRINT = "x-request-fingerprint";

    private BulwarkHeaders() {
    }
}
