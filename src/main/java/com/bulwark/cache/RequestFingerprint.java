package com.bulwark.cache;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Stable digest of a request's output-affecting fields. Equal fingerprints mean
 * interchangeable responses.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class RequestFingerprint {

    /**
     * SHA-256 hex digest (64 lowercase hex chars).
     */
    String value;

    public static RequestFingerprint of(String value) {
        if (value == null || !value.matches("[0-9a-f]{64}")) {
            throw new IllegalArgumentException("Fingerprint must be 64 lowercase hex characters");
        }
        return new RequestFingerprint(value);
    }

    public String shortValue() {
        return value.substring(0, 12);
    }

    @Override
    public String toString() {
        return value;
    }
}
