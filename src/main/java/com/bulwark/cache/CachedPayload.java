package com.bulwark.cache;

import lombok.Value;

import java.time.Duration;

/**
 * A cache hit as seen by readers: the decompressed payload and its age.
 */
@Value
public class CachedPayload {

    RequestFingerprint fingerprint;
    byte[] payload;
    Duration age;
    long hitCount;
}
