package com.bulwark.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Snapshot of the pooled connections to one host.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PoolStatistics {

    private String host;
    private int maxConnections;
    private int inUse;
    private int idle;
    private long created;
    private long discarded;
    private long reaped;

    /**
     * Acquisitions that timed out waiting for a connection.
     */
    private long exhausted;
}
