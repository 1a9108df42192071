package com.bulwark.cache;

import com.bulwark.model.CacheControlContext;
import com.bulwark.model.CompletionRequest;
import com.bulwark.model.Message;

import java.time.Duration;
import java.util.List;
import java.util.Locale;

/**
 * Decides cacheability and TTL of a request from the provider's cache mode.
 *
 * <p>Deterministic requests (temperature set and at most the configured threshold) live longer:
 * twice the default TTL at temperature 0.1 or below, one and a half times above. Every TTL is
 * clamped to [min TTL, max TTL]. Streaming requests and requests mentioning an excluded
 * pattern are never cached.
 */
public class CachePolicy {

    private static final double NEAR_ZERO_TEMPERATURE = 0.1;

    public CacheDecision decide(CompletionRequest request, CacheSettings settings) {
        if (settings.getMode() == CacheMode.DISABLED) {
            return CacheDecision.skip("caching disabled");
        }
        if (request.isStream()) {
            return CacheDecision.skip("streaming request");
        }
        if (containsExcludedPattern(request.getMessages(), settings.getExcludedPatterns())) {
            return CacheDecision.skip("sensitive content");
        }

        Double temperature = request.getSampling().getTemperature();
        boolean deterministic = temperature != null && temperature <= settings.getDeterministicTemperature();

        Duration ttl;
        switch (settings.getMode()) {
            case AGGRESSIVE:
                ttl = deterministic ? deterministicTtl(temperature, settings) : settings.getMinTtl();
                break;
            case CONSERVATIVE:
                if (!deterministic) {
                    return CacheDecision.skip("non-deterministic request");
                }
                ttl = clamp(settings.getDefaultTtl(), settings);
                break;
            case SELECTIVE:
                if (!isCacheableModel(request.getModel(), settings.getCacheableModels())) {
                    return CacheDecision.skip("model not cacheable");
                }
                ttl = deterministic ? deterministicTtl(temperature, settings) : settings.getMinTtl();
                break;
            default:
                throw new IllegalStateException("Unhandled cache mode " + settings.getMode());
        }

        CacheControlContext control = request.getCacheControl();
        return new CacheDecision(
                control.shouldLookup(),
                control.shouldStore(),
                control.shouldStore() ? ttl : null,
                deterministic ? "deterministic" : "non-deterministic");
    }

    private Duration deterministicTtl(double temperature, CacheSettings settings) {
        long defaultMillis = settings.getDefaultTtl().toMillis();
        long millis = temperature <= NEAR_ZERO_TEMPERATURE ? defaultMillis * 2 : defaultMillis * 3 / 2;
        return clamp(Duration.ofMillis(millis), settings);
    }

    private Duration clamp(Duration ttl, CacheSettings settings) {
        if (ttl.compareTo(settings.getMinTtl()) < 0) {
            return settings.getMinTtl();
        }
        if (ttl.compareTo(settings.getMaxTtl()) > 0) {
            return settings.getMaxTtl();
        }
        return ttl;
    }

    private boolean isCacheableModel(String model, List<String> cacheableModels) {
        if (cacheableModels == null || cacheableModels.isEmpty()) {
            return true;
        }
        if (model == null) {
            return false;
        }
        String normalized = model.toLowerCase(Locale.ROOT);
        return cacheableModels.stream()
                .map(candidate -> candidate.toLowerCase(Locale.ROOT))
                .anyMatch(normalized::startsWith);
    }

    private boolean containsExcludedPattern(List<Message> messages, List<String> patterns) {
        if (patterns == null || patterns.isEmpty()) {
            return false;
        }
        for (Message message : messages) {
            if (message.getContent() == null) {
                continue;
            }
            String content = message.getContent().toLowerCase(Locale.ROOT);
            for (String pattern : patterns) {
                if (content.contains(pattern.toLowerCase(Locale.ROOT))) {
                    return true;
                }
            }
        }
        return false;
    }
}
