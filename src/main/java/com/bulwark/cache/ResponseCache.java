package com.bulwark.cache;

import com.bulwark.model.dto.CacheStatistics;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * LRU response cache with per-entry TTL for one provider.
 *
 * <p>Entries are kept in access order and the least recently used entry is evicted once the
 * cache holds more than {@code maxEntries}. Expired entries are dropped when read and by
 * {@link #purgeExpired()}. A short lock serializes reads and writes; compression and
 * decompression happen outside it. The last write for a fingerprint wins.
 */
@Slf4j
public class ResponseCache {

    private final String name;
    private final CacheSettings settings;
    private final PayloadCodec codec;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();
    private final LinkedHashMap<RequestFingerprint, CacheEntry> entries;

    private long hits;
    private long misses;
    private long evictions;
    private long expirations;

    public ResponseCache(String name, CacheSettings settings, Clock clock) {
        settings.validate();
        this.name = name;
        this.settings = settings;
        this.codec = new PayloadCodec(settings.getCompressionThresholdBytes());
        this.clock = clock;
        this.entries = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<RequestFingerprint, CacheEntry> eldest) {
                if (size() > ResponseCache.this.settings.getMaxEntries()) {
                    evictions++;
                    log.debug("Cache {}: evicted {}", ResponseCache.this.name, eldest.getKey().shortValue());
                    return true;
                }
                return false;
            }
        };
    }

    /**
     * Look up a live entry and mark it most recently used.
     */
    public Optional<CachedPayload> get(RequestFingerprint fingerprint) {
        Instant now = clock.instant();
        CacheEntry entry;
        long hitCount;

        lock.lock();
        try {
            entry = entries.get(fingerprint);
            if (entry != null && entry.isExpired(now)) {
                entries.remove(fingerprint);
                expirations++;
                entry = null;
            }
            if (entry == null) {
                misses++;
                return Optional.empty();
            }
            entry.recordHit(now);
            hitCount = entry.getHitCount();
            hits++;
        } finally {
            lock.unlock();
        }

        byte[] payload = codec.decode(entry.storedBytes(), entry.isCompressed());
        return Optional.of(new CachedPayload(fingerprint, payload, entry.age(now), hitCount));
    }

    /**
     * Store a payload, replacing any entry for the same fingerprint.
     *
     * @return false if the payload is too large to cache
     */
    public boolean put(RequestFingerprint fingerprint, byte[] payload, Duration ttl) {
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("ttl must be positive, got " + ttl);
        }
        if (payload.length > settings.getMaxPayloadBytes()) {
            log.debug("Cache {}: payload of {} bytes exceeds limit, not stored", name, payload.length);
            return false;
        }

        PayloadCodec.Encoded encoded = codec.encode(payload);
        CacheEntry entry = new CacheEntry(fingerprint, encoded, payload.length, clock.instant(), ttl);

        lock.lock();
        try {
            entries.put(fingerprint, entry);
        } finally {
            lock.unlock();
        }
        log.debug("Cache {}: stored {} ({} bytes, compressed={}, ttl={})",
                name, fingerprint.shortValue(), encoded.bytes().length, encoded.compressed(), ttl);
        return true;
    }

    public boolean invalidate(RequestFingerprint fingerprint) {
        lock.lock();
        try {
            return entries.remove(fingerprint) != null;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Remove every entry.
     *
     * @return number of entries removed
     */
    public int clear() {
        int removed;
        lock.lock();
        try {
            removed = entries.size();
            entries.clear();
        } finally {
            lock.unlock();
        }
        log.info("Cache {} cleared, {} entries removed", name, removed);
        return removed;
    }

    /**
     * Remove every expired entry.
     *
     * @return number of entries removed
     */
    public int purgeExpired() {
        Instant now = clock.instant();
        int removed = 0;
        lock.lock();
        try {
            Iterator<CacheEntry> iterator = entries.values().iterator();
            while (iterator.hasNext()) {
                if (iterator.next().isExpired(now)) {
                    iterator.remove();
                    removed++;
                }
            }
            expirations += removed;
        } finally {
            lock.unlock();
        }
        if (removed > 0) {
            log.debug("Cache {}: purged {} expired entries", name, removed);
        }
        return removed;
    }

    public int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    public CacheSettings getSettings() {
        return settings;
    }

    public CacheStatistics statistics() {
        lock.lock();
        try {
            long storedBytes = 0;
            long originalBytes = 0;
            long compressedEntries = 0;
            for (CacheEntry entry : entries.values()) {
                storedBytes += entry.getStoredSize();
                originalBytes += entry.getOriginalSize();
                if (entry.isCompressed()) {
                    compressedEntries++;
                }
            }
            long lookups = hits + misses;
            return CacheStatistics.builder()
                    .mode(settings.getMode().name())
                    .hits(hits)
                    .misses(misses)
                    .hitRate(lookups == 0 ? 0.0 : (double) hits / lookups)
                    .entries(entries.size())
                    .maxEntries(settings.getMaxEntries())
                    .storedBytes(storedBytes)
                    .originalBytes(originalBytes)
                    .evictions(evictions)
                    .expirations(expirations)
                    .compressedEntries(compressedEntries)
                    .build();
        } finally {
            lock.unlock();
        }
    }
}
