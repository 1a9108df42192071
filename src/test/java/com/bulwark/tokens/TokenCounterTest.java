package com.bulwark.tokens;

import com.bulwark.model.Message;
import com.bulwark.model.ProviderType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("TokenCounter")
class TokenCounterTest {

    private final TokenCounter counter = new TokenCounter();

    private static TokenCounterSettings settings(ProviderType type) {
        return TokenCounterSettings.builder().providerType(type).build();
    }

    @Test
    @DisplayName("Empty input costs nothing")
    void emptyInput() {
        assertEquals(0, counter.countTokens(settings(ProviderType.OPENAI), List.of()));
        assertEquals(0, counter.estimate(settings(ProviderType.OPENAI), List.of(), "gpt-4o").getTokenCount());
    }

    @Test
    @DisplayName("Content is divided by chars per token and rounded up, plus message overhead")
    void openAiCount() {
        // 10 chars / 4.0 -> 3, plus 4 per message
        List<Message> messages = List.of(Message.of("user", "0123456789"));
        assertEquals(7, counter.countTokens(settings(ProviderType.OPENAI), messages));
    }

    @Test
    @DisplayName("System messages carry extra overhead")
    void systemOverhead() {
        List<Message> messages = List.of(
                Message.of("system", "abcd"),
                Message.of("user", "abcd"));
        // 8 chars / 4.0 -> 2, 2 * 4 message overhead, 10 system overhead
        assertEquals(20, counter.countTokens(settings(ProviderType.OPENAI), messages));
    }

    @Test
    @DisplayName("Each provider type uses its own ratio")
    void providerRatios() {
        List<Message> messages = List.of(Message.of("user", "x".repeat(37)));
        // 37 / 3.7 -> 10, plus 3
        assertEquals(13, counter.countTokens(settings(ProviderType.OLLAMA), messages));

        TokenCounterSettings custom = TokenCounterSettings.builder()
                .providerType(ProviderType.ANTHROPIC)
                .charsPerToken(2.0)
                .build();
        // 37 / 2.0 -> 19, plus 4
        assertEquals(23, counter.countTokens(custom, messages));
    }

    @Test
    @DisplayName("Cost uses the longest matching model price, then the default")
    void pricing() {
        TokenCounterSettings priced = TokenCounterSettings.builder()
                .providerType(ProviderType.OPENAI)
                .price("gpt-4o", 0.005)
                .price("gpt-4o-mini", 0.0002)
                .price("default", 0.002)
                .build();
        // 3984 / 4.0 + 4 = 1000 tokens
        List<Message> thousand = List.of(Message.of("user", "x".repeat(3984)));
        List<Message> larger = List.of(Message.of("user", "x".repeat(3996)));

        assertEquals(1000, counter.countTokens(priced, thousand));
        assertEquals(0.0002, counter.estimate(priced, thousand, "gpt-4o-mini-2024").getEstimatedCost(), 1e-12);
        assertEquals(0.005, counter.estimate(priced, thousand, "gpt-4o").getEstimatedCost(), 1e-12);
        assertEquals(0.002, counter.estimate(priced, thousand, "o1-preview").getEstimatedCost(), 1e-12);
        assertTrue(counter.estimate(priced, larger, "gpt-4o").getEstimatedCost() > 0.005);
    }

    @Test
    @DisplayName("Unknown models without a default price are free")
    void noPrice() {
        assertEquals(0.0, counter.pricePer1k(Map.of(), "anything"), 0.0);
    }

    @Test
    @DisplayName("Context window comes from configuration or the model table")
    void contextWindow() {
        List<Message> messages = List.of(Message.of("user", "hello"));

        assertEquals(128_000, counter.estimate(settings(ProviderType.OPENAI), messages, "gpt-4o-mini").getContextWindow());
        assertEquals(8_192, counter.estimate(settings(ProviderType.OPENAI), messages, "gpt-4-0613").getContextWindow());
        assertNull(counter.estimate(settings(ProviderType.OPENAI), messages, "unknown-model").getContextWindow());

        TokenCounterSettings tiny = TokenCounterSettings.builder().contextWindow(2).build();
        TokenEstimate estimate = counter.estimate(tiny, messages, "gpt-4o");
        assertEquals(2, estimate.getContextWindow());
        assertTrue(estimate.exceedsContextWindow());
    }
}
