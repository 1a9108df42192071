package com.bulwark.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Identifies one configured upstream provider (provider + base URL combination).
 * All per-provider state is keyed by it.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ProviderKey {

    String name;

    public static ProviderKey of(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Provider key must not be blank");
        }
        return new ProviderKey(name.trim());
    }

    @Override
    public String toString() {
        return name;
    }
}
