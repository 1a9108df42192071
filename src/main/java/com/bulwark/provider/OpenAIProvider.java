package com.bulwark.provider;

import com.bulwark.config.ProviderSettings;
import com.bulwark.model.ChatCompletionRequest;
import com.bulwark.model.ChatCompletionResponse;
import com.bulwark.model.CompletionRequest;
import com.bulwark.model.ProviderType;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

/**
 * OpenAI chat completions API and compatible servers (vLLM, LM Studio, llama.cpp server).
 * The configured base URL includes the API version segment, e.g. {@code https://api.openai.com/v1}.
 */
@Slf4j
@Component
public class OpenAIProvider extends AbstractChatProvider {

    public OpenAIProvider(ObjectMapper objectMapper) {
        super(objectMapper);
    }

    @Override
    public ProviderType getType() {
        return ProviderType.OPENAI;
    }

    @Override
    public Mono<ChatCompletionResponse> complete(WebClient client, CompletionRequest request, ProviderSettings settings) {
        validate(request);
        logForward(request, settings);

        WebClient.RequestBodySpec spec = client.post()
                .uri(settings.endpoint("/chat/completions"))
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE);
        if (settings.hasApiKey()) {
            spec = spec.header(HttpHeaders.AUTHORIZATION, "Bearer " + settings.getApiKey());
        }

        return spec.bodyValue(ChatCompletionRequest.from(request))
                .retrieve()
                .bodyToMono(ChatCompletionResponse.class)
                .map(response -> {
                    if (response.getChoices() == null || response.getChoices().isEmpty()) {
                        throw new ProviderProtocolException("OpenAI response has no choices");
                    }
                    return response;
                })
                .switchIfEmpty(Mono.error(() -> new ProviderProtocolException("OpenAI response body is empty")));
    }
}
