package com.bulwark.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Duration;
import java.util.List;
import java.util.UUID;

/**
 * One logical completion call as handed over by the orchestration layer.
 */
@Value
@Builder(toBuilder = true)
public class CompletionRequest {

    /**
     * Caller-side correlation id. Not part of the fingerprint.
     */
    @Builder.Default
    String requestId = UUID.randomUUID().toString();

    ProviderKey providerKey;

    String model;

    @Singular
    List<Message> messages;

    @Builder.Default
    SamplingParameters sampling = SamplingParameters.defaults();

    /**
     * Caller asked for incremental delivery. Such responses are never cached.
     */
    boolean stream;

    /**
     * End-to-end deadline for the call, measured from the moment the client starts it.
     * {@code null} selects the configured default.
     */
    Duration timeout;

    @Builder.Default
    CacheControlContext cacheControl = CacheControlContext.defaults();
}
