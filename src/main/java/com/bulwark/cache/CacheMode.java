package com.bulwark.cache;

/**
 * How eagerly a provider's responses are cached.
 */
public enum CacheMode {

    /**
     * Cache every non-streaming request; non-deterministic ones with the minimum TTL.
     */
    AGGRESSIVE,

    /**
     * Cache deterministic requests only.
     */
    CONSERVATIVE,

    /**
     * Cache requests for allow-listed models; deterministic ones with the longer TTL.
     */
    SELECTIVE,

    /**
     * Never look up or store.
     */
    DISABLED
}
