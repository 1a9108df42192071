package com.bulwark.tokens;

import com.bulwark.model.Message;
import com.bulwark.model.ProviderType;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Estimates request size and cost from character counts.
 *
 * <p>Tokens are the summed content length divided by the provider's characters-per-token
 * ratio, rounded up, plus a formatting overhead for every message and an extra one for
 * system messages. Stateless.
 */
public class TokenCounter {

    private static final Map<String, Integer> MODEL_CONTEXT_WINDOWS = Map.ofEntries(
            Map.entry("gpt-4o", 128_000),
            Map.entry("gpt-4-turbo", 128_000),
            Map.entry("gpt-4-32k", 32_768),
            Map.entry("gpt-4", 8_192),
            Map.entry("gpt-3.5-turbo", 16_385),
            Map.entry("claude", 200_000),
            Map.entry("llama3", 8_192),
            Map.entry("llama2", 4_096),
            Map.entry("codellama", 16_384),
            Map.entry("mistral", 32_768),
            Map.entry("mixtral", 32_768),
            Map.entry("gemma", 8_192)
    );

    public TokenEstimate estimate(TokenCounterSettings settings, List<Message> messages, String model) {
        int tokens = countTokens(settings, messages);
        return TokenEstimate.builder()
                .tokenCount(tokens)
                .estimatedCost(tokens / 1000.0 * pricePer1k(settings.getPricePer1kTokens(), model))
                .contextWindow(settings.getContextWindow() != null
                        ? settings.getContextWindow()
                        : longestPrefixMatch(MODEL_CONTEXT_WINDOWS, model))
                .build();
    }

    public int countTokens(TokenCounterSettings settings, List<Message> messages) {
        if (messages == null || messages.isEmpty()) {
            return 0;
        }
        ProviderType type = settings.getProviderType();

        long characters = 0;
        int overhead = 0;
        for (Message message : messages) {
            if (message.getContent() != null) {
                characters += message.getContent().length();
            }
            overhead += type.getMessageOverheadTokens();
            if (message.isSystem()) {
                overhead += type.getSystemOverheadTokens();
            }
        }

        long contentTokens = (long) Math.ceil(characters / settings.effectiveCharsPerToken());
        return (int) Math.min(Integer.MAX_VALUE, contentTokens + overhead);
    }

    /**
     * Price per 1000 tokens: longest matching model prefix, then the default entry, else free.
     */
    double pricePer1k(Map<String, Double> prices, String model) {
        Double price = longestPrefixMatch(prices, model);
        if (price != null) {
            return price;
        }
        return prices.getOrDefault(TokenCounterSettings.DEFAULT_PRICE_KEY, 0.0);
    }

    private static <T> T longestPrefixMatch(Map<String, T> table, String model) {
        if (model == null || table.isEmpty()) {
            return null;
        }
        String normalized = model.toLowerCase(Locale.ROOT);
        String best = null;
        for (String prefix : table.keySet()) {
            if (prefix.equals(TokenCounterSettings.DEFAULT_PRICE_KEY)) {
                continue;
            }
            if (normalized.startsWith(prefix.toLowerCase(Locale.ROOT))
                    && (best == null || prefix.length() > best.length())) {
                best = prefix;
            }
        }
        return best == null ? null : table.get(best);
    }
}
