package com.bulwark.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Snapshot of one provider's response cache.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CacheStatistics {

    private String mode;
    private long hits;
    private long misses;

    /**
     * Hit rate (0.0-1.0), 0 when no lookup happened yet.
     */
    private double hitRate;

    private int entries;
    private int maxEntries;

    /**
     * Bytes held by stored payloads, after compression.
     */
    private long storedBytes;

    /**
     * Bytes the stored payloads would take uncompressed.
     */
    private long originalBytes;

    private long evictions;
    private long expirations;
    private long compressedEntries;
}
