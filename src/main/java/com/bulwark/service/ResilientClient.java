package com.bulwark.service;

import com.bulwark.cache.CacheDecision;
import com.bulwark.cache.CachePolicy;
import com.bulwark.cache.CachedPayload;
import com.bulwark.cache.RequestFingerprint;
import com.bulwark.cache.RequestFingerprinter;
import com.bulwark.config.ProviderSettings;
import com.bulwark.exception.CircuitOpenException;
import com.bulwark.exception.ClientErrorException;
import com.bulwark.exception.DeadlineExceededException;
import com.bulwark.exception.FailureStage;
import com.bulwark.exception.PoolExhaustedException;
import com.bulwark.exception.RateLimitedException;
import com.bulwark.model.ChatCompletionResponse;
import com.bulwark.model.CompletionRequest;
import com.bulwark.model.CompletionResult;
import com.bulwark.model.ProviderKey;
import com.bulwark.provider.ProviderProtocolException;
import com.bulwark.resilience.breaker.CircuitBreaker;
import com.bulwark.resilience.pool.ConnectionLease;
import com.bulwark.resilience.pool.ConnectionPool;
import com.bulwark.resilience.ratelimit.RateLimitUnit;
import com.bulwark.resilience.ratelimit.RateLimiter;
import com.bulwark.tokens.TokenCounter;
import com.bulwark.tokens.TokenEstimate;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.io.IOException;
import java.time.Duration;
import java.util.Optional;

/**
 * Single entry point for provider calls. Composes, in order: cache lookup, rate limiting,
 * circuit breaking, connection pooling and the provider call, all under one end-to-end deadline.
 *
 * <p>A cache hit returns before any token or breaker permission is taken. A rate-limit token drawn
 * for a call that never reached the network is refunded. Every failure surfaces as a typed
 * {@link com.bulwark.exception.ResilienceException} naming the stage that produced it.
 */
@Slf4j
public class ResilientClient {

    private final ProviderRegistry registry;
    private final RateLimiter rateLimiter;
    private final ConnectionPool connectionPool;
    private final ProviderService providerService;
    private final RequestFingerprinter fingerprinter;
    private final CachePolicy cachePolicy;
    private final TokenCounter tokenCounter;
    private final FailureClassifier failureClassifier;
    private final ObjectMapper objectMapper;
    private final ClientSettings settings;

    public ResilientClient(
            ProviderRegistry registry,
            RateLimiter rateLimiter,
            ConnectionPool connectionPool,
            ProviderService providerService,
            RequestFingerprinter fingerprinter,
            CachePolicy cachePolicy,
            TokenCounter tokenCounter,
            FailureClassifier failureClassifier,
            ObjectMapper objectMapper,
            ClientSettings settings) {
        settings.validate();
        this.registry = registry;
        this.rateLimiter = rateLimiter;
        this.connectionPool = connectionPool;
        this.providerService = providerService;
        this.fingerprinter = fingerprinter;
        this.cachePolicy = cachePolicy;
        this.tokenCounter = tokenCounter;
        this.failureClassifier = failureClassifier;
        this.objectMapper = objectMapper;
        this.settings = settings;
    }

    /**
     * Run one call through the resilience pipeline, blocking the calling thread.
     *
     * @throws com.bulwark.exception.ResilienceException on any failure
     */
    public CompletionResult complete(CompletionRequest request) {
        long startNanos = System.nanoTime();
        ProviderContext context = registry.require(request.getProviderKey());
        ProviderSettings provider = context.getSettings();
        ProviderKey key = provider.getKey();

        Duration timeout = request.getTimeout() != null ? request.getTimeout() : settings.getDefaultTimeout();
        long deadlineNanos = startNanos + timeout.toNanos();

        RequestFingerprint fingerprint = fingerprinter.fingerprint(request);
        TokenEstimate estimate = tokenCounter.estimate(provider.getTokenCounter(), request.getMessages(), request.getModel());
        if (estimate.exceedsContextWindow()) {
            log.debug("Request {} for {} estimated at {} tokens, above the {} token context window",
                    request.getRequestId(), key, estimate.getTokenCount(), estimate.getContextWindow());
        }

        CacheDecision decision = cachePolicy.decide(request, provider.getCache());
        if (decision.isLookup()) {
            Optional<CompletionResult> cached = lookup(context, fingerprint, estimate, startNanos);
            if (cached.isPresent()) {
                return cached.get();
            }
        }

        int permits = acquireRateLimit(context, estimate, deadlineNanos);

        CircuitBreaker breaker = context.getBreaker();
        Optional<CircuitBreaker.Permit> permit = breaker.tryAcquirePermission();
        if (permit.isEmpty()) {
            rateLimiter.refund(key, permits);
            log.warn("Circuit for provider {} is {}, rejecting request {}", key, breaker.getState(), request.getRequestId());
            throw new CircuitOpenException(key, "Circuit breaker for provider " + key + " is open");
        }

        ChatCompletionResponse response = invoke(context, request, permits, permit.get(), deadlineNanos);

        if (decision.isStore()) {
            store(context, fingerprint, response, decision.getTtl());
        }
        context.getUsage().recordCall(estimate, response.getUsage());

        Duration latency = Duration.ofNanos(System.nanoTime() - startNanos);
        log.debug("Request {} served by {} in {} ms", request.getRequestId(), key, latency.toMillis());
        return CompletionResult.builder()
                .providerKey(key)
                .fingerprint(fingerprint)
                .response(response)
                .cacheHit(false)
                .tokenEstimate(estimate)
                .latency(latency)
                .build();
    }

    /**
     * Reactive wrapper around {@link #complete(CompletionRequest)}; the blocking work runs on the bounded elastic scheduler.
     */
    public Mono<CompletionResult> completeAsync(CompletionRequest request) {
        return Mono.fromCallable(() -> complete(request))
                .subscribeOn(Schedulers.boundedElastic());
    }

    private Optional<CompletionResult> lookup(ProviderContext context, RequestFingerprint fingerprint,
                                              TokenEstimate estimate, long startNanos) {
        Optional<CachedPayload> hit = context.getCache().get(fingerprint);
        if (hit.isEmpty()) {
            log.debug("Cache miss for {} on {}", fingerprint.shortValue(), context.getKey());
            return Optional.empty();
        }

        ChatCompletionResponse response;
        try {
            response = objectMapper.readValue(hit.get().getPayload(), ChatCompletionResponse.class);
        } catch (IOException e) {
            log.warn("Dropping unreadable cache entry {} on {}", fingerprint.shortValue(), context.getKey(), e);
            context.getCache().invalidate(fingerprint);
            return Optional.empty();
        }

        context.getUsage().recordCacheHit(estimate);
        log.debug("Cache hit for {} on {} (age {}s)", fingerprint.shortValue(), context.getKey(),
                hit.get().getAge().toSeconds());

        return Optional.of(CompletionResult.builder()
                .providerKey(context.getKey())
                .fingerprint(fingerprint)
                .response(response.toBuilder().cached(true).build())
                .cacheHit(true)
                .cacheAge(hit.get().getAge())
                .tokenEstimate(estimate)
                .latency(Duration.ofNanos(System.nanoTime() - startNanos))
                .build());
    }

    /**
     * @return number of tokens drawn from the bucket
     */
    private int acquireRateLimit(ProviderContext context, TokenEstimate estimate, long deadlineNanos) {
        ProviderKey key = context.getKey();
        int permits = context.getSettings().getRateLimitUnit() == RateLimitUnit.TOKENS
                ? Math.max(1, estimate.getTokenCount())
                : 1;

        if (permits > rateLimiter.capacity(key)) {
            throw new ClientErrorException(key, FailureStage.RATE_LIMIT, null,
                    "Request needs " + permits + " tokens, above the burst capacity of provider " + key, null);
        }

        Duration remaining = remaining(deadlineNanos);
        Duration wait = min(settings.getRateLimitWait(), remaining);
        if (rateLimiter.tryAcquire(key, permits, wait)) {
            return permits;
        }
        if (wait.equals(remaining) || remaining(deadlineNanos).isZero()) {
            throw new DeadlineExceededException(key, FailureStage.RATE_LIMIT,
                    "Deadline exceeded waiting for rate limit tokens of provider " + key, null);
        }
        throw new RateLimitedException(key, "Rate limit exceeded for provider " + key);
    }

    private ChatCompletionResponse invoke(ProviderContext context, CompletionRequest request,
                                          int permits, CircuitBreaker.Permit permit, long deadlineNanos) {
        ProviderKey key = context.getKey();
        CircuitBreaker breaker = context.getBreaker();

        ConnectionLease lease;
        try {
            lease = acquireConnection(context, deadlineNanos);
        } catch (RuntimeException e) {
            breaker.releasePermission(permit);
            rateLimiter.refund(key, permits);
            throw e;
        }

        try (lease) {
            Duration remaining = remaining(deadlineNanos);
            Mono<ChatCompletionResponse> call;
            try {
                if (remaining.isZero()) {
                    throw new DeadlineExceededException(key, FailureStage.CONNECTION_POOL,
                            "Deadline exceeded before calling provider " + key, null);
                }
                call = providerService.getProvider(context.getSettings().getType())
                        .complete(lease.webClient(), request, context.getSettings());
            } catch (IllegalArgumentException e) {
                breaker.releasePermission(permit);
                rateLimiter.refund(key, permits);
                throw new ClientErrorException(key, FailureStage.UPSTREAM_CALL, null, e.getMessage(), e);
            } catch (RuntimeException e) {
                breaker.releasePermission(permit);
                rateLimiter.refund(key, permits);
                throw e;
            }

            try {
                ChatCompletionResponse response = call.timeout(remaining).block();
                if (response == null) {
                    throw new ProviderProtocolException("Provider " + key + " returned no response");
                }
                breaker.recordSuccess(permit);
                return response;
            } catch (RuntimeException e) {
                FailureClassifier.Classification failure = failureClassifier.classify(key, e);
                if (failure.isDiscardConnection()) {
                    lease.markUnusable();
                }
                if (failure.isBreakerFailure()) {
                    breaker.recordFailure(permit, failure.getException());
                } else {
                    breaker.releasePermission(permit);
                }
                log.warn("Call {} to provider {} failed: {}", request.getRequestId(), key, failure.getException().getMessage());
                throw failure.getException();
            }
        }
    }

    private ConnectionLease acquireConnection(ProviderContext context, long deadlineNanos) {
        ProviderKey key = context.getKey();
        Duration remaining = remaining(deadlineNanos);
        if (remaining.isZero()) {
            throw new DeadlineExceededException(key, FailureStage.CONNECTION_POOL,
                    "Deadline exceeded before acquiring a connection for provider " + key, null);
        }

        Duration wait = min(settings.getPoolAcquireTimeout(), remaining);
        try {
            return connectionPool.acquire(context.getSettings().getHostKey(), wait);
        } catch (PoolExhaustedException e) {
            if (wait.equals(remaining)) {
                throw new DeadlineExceededException(key, FailureStage.CONNECTION_POOL,
                        "Deadline exceeded waiting for a connection for provider " + key, e);
            }
            throw new PoolExhaustedException(key, e.getMessage(), e);
        } catch (IllegalStateException e) {
            log.warn("Connection pool refused a connection for provider {}: {}", key, e.getMessage());
            throw new PoolExhaustedException(key, "No connection for provider " + key + ": " + e.getMessage(), e);
        }
    }

    private void store(ProviderContext context, RequestFingerprint fingerprint, ChatCompletionResponse response, Duration ttl) {
        try {
            byte[] payload = objectMapper.writeValueAsBytes(response);
            context.getCache().put(fingerprint, payload, ttl);
        } catch (JsonProcessingException e) {
            log.warn("Response for {} on {} could not be serialized for caching", fingerprint.shortValue(), context.getKey(), e);
        }
    }

    private static Duration remaining(long deadlineNanos) {
        long nanos = deadlineNanos - System.nanoTime();
        return nanos > 0 ? Duration.ofNanos(nanos) : Duration.ZERO;
    }

    private static Duration min(Duration a, Duration b) {
        return a.compareTo(b) <= 0 ? a : b;
    }
}
