package com.bulwark.cache;

import lombok.AccessLevel;
import lombok.Getter;

import java.time.Duration;
import java.time.Instant;

/**
 * One stored response. Hit bookkeeping is guarded by the owning cache's lock.
 */
@Getter
public class CacheEntry {

    private final RequestFingerprint fingerprint;

    @Getter(AccessLevel.NONE)
    private final byte[] stored;

    private final boolean compressed;
    private final int originalSize;
    private final Instant createdAt;
    private final Duration ttl;
    private long hitCount;
    private Instant lastAccessedAt;

    CacheEntry(RequestFingerprint fingerprint, PayloadCodec.Encoded encoded, int originalSize, Instant createdAt, Duration ttl) {
        this.fingerprint = fingerprint;
        this.stored = encoded.bytes();
        this.compressed = encoded.compressed();
        this.originalSize = originalSize;
        this.createdAt = createdAt;
        this.ttl = ttl;
        this.lastAccessedAt = createdAt;
    }

    public int getStoredSize() {
        return stored.length;
    }

    public Instant getExpiresAt() {
        return createdAt.plus(ttl);
    }

    public boolean isExpired(Instant now) {
        return !now.isBefore(getExpiresAt());
    }

    public Duration age(Instant now) {
        return Duration.between(createdAt, now);
    }

    byte[] storedBytes() {
        return stored;
    }

    void recordHit(Instant now) {
        hitCount++;
        lastAccessedAt = now;
    }
}
