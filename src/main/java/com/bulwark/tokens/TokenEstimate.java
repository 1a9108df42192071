package com.bulwark.tokens;

import lombok.Builder;
import lombok.Value;

/**
 * Estimated size and cost of a request.
 */
@Value
@Builder
public class TokenEstimate {

    int tokenCount;

    /**
     * Estimated price in the currency of the configured price table.
     */
    double estimatedCost;

    /**
     * Context window of the model, {@code null} when unknown.
     */
    Integer contextWindow;

    public boolean exceedsContextWindow() {
        return contextWindow != null && tokenCount > contextWindow;
    }
}
