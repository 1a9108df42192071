package com.bulwark.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Snapshot of one provider's token bucket.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RateLimiterStatistics {

    private double availableTokens;
    private int capacity;
    private double ratePerSecond;

    /**
     * Acquisitions that obtained their tokens.
     */
    private long admitted;

    /**
     * Acquisitions that gave up, including requests above capacity.
     */
    private long rejected;
}
