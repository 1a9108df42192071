package com.bulwark.provider;

import com.bulwark.config.ProviderSettings;
import com.bulwark.model.ChatCompletionResponse;
import com.bulwark.model.CompletionRequest;
import com.bulwark.model.ProviderType;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

/**
 * Interface for chat completion providers.
 * Implementations handle provider-specific authentication and request/response mapping;
 * the connection they send on is supplied by the caller.
 */
public interface ChatProvider {

    /**
     * Wire protocol this adapter speaks.
     *
     * @return provider type
     */
    ProviderType getType();

    /**
     * Complete a chat request.
     *
     * @param client   client bound to a pooled connection to the provider's host
     * @param request  completion request
     * @param settings settings of the target provider key
     * @return provider response (normalized to OpenAI format)
     */
    Mono<ChatCompletionResponse> complete(WebClient client, CompletionRequest request, ProviderSettings settings);
}
