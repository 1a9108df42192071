package com.bulwark.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Cumulative token and cost figures for one provider.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UsageStatistics {

    private long calls;
    private long cacheHits;
    private long estimatedTokens;
    private double estimatedCost;

    /**
     * Token totals as reported by the provider in its responses.
     */
    private long reportedPromptTokens;
    private long reportedCompletionTokens;

    /**
     * Estimated tokens not sent upstream thanks to cache hits.
     */
    private long tokensSaved;
}
