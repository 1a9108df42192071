package com.bulwark.cache;

import lombok.Value;

import java.time.Duration;

/**
 * Whether one request may be served from and stored into the cache, and for how long.
 */
@Value
public class CacheDecision {

    boolean lookup;
    boolean store;

    /**
     * Time to live of a stored response. {@code null} when nothing is stored.
     */
    Duration ttl;

    /**
     * Short human-readable reason, for debug logging.
     */
    String reason;

    static CacheDecision skip(String reason) {
        return new CacheDecision(false, false, null, reason);
    }
}
