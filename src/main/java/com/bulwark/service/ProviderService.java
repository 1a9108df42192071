package com.bulwark.service;

import com.bulwark.model.ProviderType;
import com.bulwark.provider.ChatProvider;
import lombok.extern.slf4j.Slf4j;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Looks up the wire adapter for a provider type.
 */
@Slf4j
public class ProviderService {

    private final Map<ProviderType, ChatProvider> providers = new EnumMap<>(ProviderType.class);

    public ProviderService(List<ChatProvider> providers) {
        for (ChatProvider provider : providers) {
            if (this.providers.putIfAbsent(provider.getType(), provider) != null) {
                throw new IllegalStateException("Two adapters registered for provider type " + provider.getType());
            }
        }
        log.info("Initialized ProviderService with {} adapters: {}", this.providers.size(), this.providers.keySet());
    }

    /**
     * @throws IllegalStateException if no adapter speaks the given protocol
     */
    public ChatProvider getProvider(ProviderType type) {
        ChatProvider provider = providers.get(type);
        if (provider == null) {
            throw new IllegalStateException("No adapter registered for provider type " + type);
        }
        return provider;
    }

    public boolean supports(ProviderType type) {
        return providers.containsKey(type);
    }
}
