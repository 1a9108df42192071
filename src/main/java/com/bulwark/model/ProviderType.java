package com.bulwark.model;

import java.time.Duration;

/**
 * Wire protocol family of a provider endpoint.
 *
 * Each family carries the defaults used when a provider entry does not override them:
 * empirical characters-per-token ratios and message formatting overheads for the token counter,
 * plus rate-limit and breaker thresholds. Cloud APIs get tighter breakers; a local Ollama server
 * has no external quota and recovers quickly.
 */
public enum ProviderType {

    /**
     * OpenAI chat completions API and compatible servers (vLLM, LM Studio, Perplexity).
     */
    OPENAI(4.0, 4, 10, 60.0, 100, 3, Duration.ofSeconds(30)),

    /**
     * Anthropic Messages API.
     */
    ANTHROPIC(4.0, 4, 10, 20.0, 40, 3, Duration.ofSeconds(30)),

    /**
     * Ollama native chat API.
     */
    OLLAMA(3.7, 3, 3, 10.0, 20, 5, Duration.ofSeconds(10));

    private final double defaultCharsPerToken;
    private final int messageOverheadTokens;
    private final int systemOverheadTokens;
    private final double defaultRatePerSecond;
    private final int defaultBurstCapacity;
    private final int defaultFailureThreshold;
    private final Duration defaultRecoveryTimeout;

    ProviderType(double defaultCharsPerToken, int messageOverheadTokens, int systemOverheadTokens,
                 double defaultRatePerSecond, int defaultBurstCapacity,
                 int defaultFailureThreshold, Duration defaultRecoveryTimeout) {
        this.defaultCharsPerToken = defaultCharsPerToken;
        this.messageOverheadTokens = messageOverheadTokens;
        this.systemOverheadTokens = systemOverheadTokens;
        this.defaultRatePerSecond = defaultRatePerSecond;
        this.defaultBurstCapacity = defaultBurstCapacity;
        this.defaultFailureThreshold = defaultFailureThreshold;
        this.defaultRecoveryTimeout = defaultRecoveryTimeout;
    }

    public double getDefaultCharsPerToken() {
        return defaultCharsPerToken;
    }

    public int getMessageOverheadTokens() {
        return messageOverheadTokens;
    }

    public int getSystemOverheadTokens() {
        return systemOverheadTokens;
    }

    public double getDefaultRatePerSecond() {
        return defaultRatePerSecond;
    }

    public int getDefaultBurstCapacity() {
        return defaultBurstCapacity;
    }

    public int getDefaultFailureThreshold() {
        return defaultFailureThreshold;
    }

    public Duration getDefaultRecoveryTimeout() {
        return defaultRecoveryTimeout;
    }
}
