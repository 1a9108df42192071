package com.bulwark.controller;

import com.bulwark.model.CacheControlContext;
import com.bulwark.model.ChatCompletionRequest;
import com.bulwark.model.ChatCompletionResponse;
import com.bulwark.model.CompletionRequest;
import com.bulwark.model.CompletionResult;
import com.bulwark.model.ProviderKey;
import com.bulwark.service.ResilientClient;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * OpenAI-compatible chat completions routed through the resilient client to one provider key.
 */
@Slf4j
@RestController
@RequestMapping("/v1/providers")
public class CompletionController {

    private final ResilientClient resilientClient;
    private final CacheControlParser cacheControlParser;

    public CompletionController(ResilientClient resilientClient, CacheControlParser cacheControlParser) {
        this.resilientClient = resilientClient;
        this.cacheControlParser = cacheControlParser;
    }

    @PostMapping(value = "/{provider}/chat/completions", consumes = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<ChatCompletionResponse>> createChatCompletion(
            @PathVariable("provider") String provider,
            @RequestBody ChatCompletionRequest request,
            @RequestHeader HttpHeaders headers) {

        log.debug("Received chat completion request for provider: {}, model: {}", provider, request.getModel());

        if (request.getMessages() == null || request.getMessages().isEmpty()) {
            return Mono.error(new IllegalArgumentException("Messages cannot be empty"));
        }
        if (request.getModel() == null || request.getModel().isBlank()) {
            return Mono.error(new IllegalArgumentException("Model must be specified"));
        }

        CacheControlContext cacheContext = cacheControlParser.parse(headers);
        CompletionRequest completionRequest = CompletionRequest.builder()
                .providerKey(ProviderKey.of(provider))
                .model(request.getModel())
                .messages(request.getMessages())
                .sampling(request.toSamplingParameters())
                .stream(Boolean.TRUE.equals(request.getStream()))
                .timeout(parseTimeout(headers.getFirst(BulwarkHeaders.TIMEOUT_MS)))
                .cacheControl(cacheContext)
                .build();

        return resilientClient.completeAsync(completionRequest)
                .map(this::toResponseEntity);
    }

    private ResponseEntity<ChatCompletionResponse> toResponseEntity(CompletionResult result) {
        HttpHeaders headers = new HttpHeaders();
        headers.add(BulwarkHeaders.CACHE_HIT, String.valueOf(result.isCacheHit()));
        headers.add(BulwarkHeaders.PROVIDER, result.getProviderKey().getName());
        headers.add(BulwarkHeaders.ESTIMATED_TOKENS, String.valueOf(result.getTokenEstimate().getTokenCount()));
        headers.add(BulwarkHeaders.FINGERPRINT, result.getFingerprint().getValue());
        if (result.isCacheHit() && result.getCacheAge() != null) {
            headers.add(BulwarkHeaders.CACHE_AGE, String.valueOf(result.getCacheAge().toSeconds()));
        }

        return ResponseEntity.ok()
                .headers(headers)
                .body(result.getResponse());
    }

    private Duration parseTimeout(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        long millis;
        try {
            millis = Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid " + BulwarkHeaders.TIMEOUT_MS + " header: " + value, e);
        }
        if (millis <= 0) {
            throw new IllegalArgumentException(BulwarkHeaders.TIMEOUT_MS + " must be positive");
        }
        return Duration.ofMillis(millis);
    }
}
