package com.bulwark.tokens;

import com.bulwark.model.ProviderType;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

/**
 * Per-provider calibration of the token counter.
 */
@Value
@Builder
public class TokenCounterSettings {

    public static final String DEFAULT_PRICE_KEY = "default";

    @Builder.Default
    ProviderType providerType = ProviderType.OPENAI;

    /**
     * Characters per token. {@code null} selects the provider type's default.
     */
    Double charsPerToken;

    /**
     * Context window for every model of the provider. {@code null} selects the per-model table.
     */
    Integer contextWindow;

    /**
     * Price per 1000 tokens keyed by model name prefix, with an optional {@code default} entry.
     */
    @Singular("price")
    Map<String, Double> pricePer1kTokens;

    public double effectiveCharsPerToken() {
        return charsPerToken != null ? charsPerToken : providerType.getDefaultCharsPerToken();
    }

    public void validate() {
        if (charsPerToken != null && !(charsPerToken > 0)) {
            throw new IllegalArgumentException("charsPerToken must be positive, got " + charsPerToken);
        }
        if (contextWindow != null && contextWindow <= 0) {
            throw new IllegalArgumentException("contextWindow must be positive, got " + contextWindow);
        }
        pricePer1kTokens.forEach((model, price) -> {
            if (price == null || price < 0) {
                throw new IllegalArgumentException("price for " + model + " must not be negative, got " + price);
            }
        });
    }
}
