package com.bulwark.tokens;

import com.bulwark.model.Usage;
import com.bulwark.model.dto.UsageStatistics;

import java.util.concurrent.atomic.DoubleAdder;
import java.util.concurrent.atomic.LongAdder;

/**
 * Cumulative token and cost figures of one provider. Reporting only.
 */
public class UsageTracker {

    private final LongAdder calls = new LongAdder();
    private final LongAdder cacheHits = new LongAdder();
    private final LongAdder estimatedTokens = new LongAdder();
    private final DoubleAdder estimatedCost = new DoubleAdder();
    private final LongAdder reportedPromptTokens = new LongAdder();
    private final LongAdder reportedCompletionTokens = new LongAdder();
    private final LongAdder tokensSaved = new LongAdder();

    /**
     * A call that reached the provider and succeeded.
     *
     * @param usage token usage reported by the provider, may be {@code null}
     */
    public void recordCall(TokenEstimate estimate, Usage usage) {
        calls.increment();
        estimatedTokens.add(estimate.getTokenCount());
        estimatedCost.add(estimate.getEstimatedCost());
        if (usage != null) {
            if (usage.getPromptTokens() != null) {
                reportedPromptTokens.add(usage.getPromptTokens());
            }
            if (usage.getCompletionTokens() != null) {
                reportedCompletionTokens.add(usage.getCompletionTokens());
            }
        }
    }

    public void recordCacheHit(TokenEstimate estimate) {
        cacheHits.increment();
        tokensSaved.add(estimate.getTokenCount());
    }

    public UsageStatistics statistics() {
        return UsageStatistics.builder()
                .calls(calls.sum())
                .cacheHits(cacheHits.sum())
                .estimatedTokens(estimatedTokens.sum())
                .estimatedCost(estimatedCost.sum())
                .reportedPromptTokens(reportedPromptTokens.sum())
                .reportedCompletionTokens(reportedCompletionTokens.sum())
                .tokensSaved(tokensSaved.sum())
                .build();
    }
}
