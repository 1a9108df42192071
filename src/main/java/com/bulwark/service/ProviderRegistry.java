package com.bulwark.service;

import com.bulwark.exception.UnknownProviderException;
import com.bulwark.model.ProviderKey;
import com.bulwark.resilience.ratelimit.TokenBucket;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable map from provider key to its per-provider state, built once at startup.
 */
public class ProviderRegistry {

    private final Map<ProviderKey, ProviderContext> providers;

    public ProviderRegistry(Collection<ProviderContext> contexts) {
        Map<ProviderKey, ProviderContext> byKey = new LinkedHashMap<>();
        for (ProviderContext context : contexts) {
            if (byKey.putIfAbsent(context.getKey(), context) != null) {
                throw new IllegalArgumentException("Duplicate provider key: " + context.getKey());
            }
        }
        this.providers = Collections.unmodifiableMap(byKey);
    }

    /**
     * @throws UnknownProviderException if the key is not configured
     */
    public ProviderContext require(ProviderKey key) {
        ProviderContext context = providers.get(key);
        if (context == null) {
            throw new UnknownProviderException(key);
        }
        return context;
    }

    public Optional<ProviderContext> find(ProviderKey key) {
        return Optional.ofNullable(providers.get(key));
    }

    public Collection<ProviderContext> all() {
        return providers.values();
    }

    public Map<ProviderKey, TokenBucket> buckets() {
        Map<ProviderKey, TokenBucket> buckets = new LinkedHashMap<>();
        providers.forEach((key, context) -> buckets.put(key, context.getBucket()));
        return buckets;
    }

    public int size() {
        return providers.size();
    }
}
