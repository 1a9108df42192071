package com.bulwark.controller;

import com.bulwark.model.CacheControlContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Parses cache control headers from HTTP requests.
 *
 * Allows clients to control cache behavior per request:
 * - x-cache-bypass: Skip cache lookup
 * - x-cache-store: Control response storage
 */
@Slf4j
@Component
public class CacheControlParser {

    /**
     * Parse cache control context from HTTP headers.
     *
     * @param headers HTTP request headers
     * @return parsed cache control context (never null)
     */
    public CacheControlContext parse(HttpHeaders headers) {
        CacheControlContext.CacheControlContextBuilder builder = CacheControlContext.builder();

        String bypass = headers.getFirst(BulwarkHeaders.CACHE_BYPASS);
        if (bypass != null) {
            builder.bypass(parseBoolean(bypass, false));
        }

        String store = headers.getFirst(BulwarkHeaders.CACHE_STORE);
        if (store != null) {
            builder.store(parseBoolean(store, true));
        }

        CacheControlContext context = builder.build();
        if (context.isBypass() || !context.isStore()) {
            log.debug("Cache control override: bypass={}, store={}", context.isBypass(), context.isStore());
        }
        return context;
    }

    /**
     * Parse boolean from string.
     * Accepts: true/false, 1/0, yes/no, on/off (case-insensitive)
     */
    boolean parseBoolean(String value, boolean defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }

        String normalized = value.trim().toLowerCase(Locale.ROOT);

        return switch (normalized) {
            case "true", "1", "yes", "on" -> true;
            case "false", "0", "no", "off" -> false;
            default -> {
                log.warn("Invalid boolean value: {}, using default: {}", value, defaultValue);
                yield defaultValue;
            }
        };
    }
}
