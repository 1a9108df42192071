package com.bulwark.provider;

import com.bulwark.config.JacksonConfiguration;
import com.bulwark.config.ProviderSettings;
import com.bulwark.model.CompletionRequest;
import com.bulwark.model.Message;
import com.bulwark.model.ProviderKey;
import com.bulwark.model.ProviderType;
import com.bulwark.support.StubExchange;
import com.bulwark.support.TestProviders;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.test.StepVerifier;

import static org.junit.jupiter.api.Assertions.*;

class OpenAIProviderTest {

    private static final String RESPONSE = """
            {"id":"chatcmpl-123","object":"chat.completion","created":1700000000,"model":"gpt-4o",
             "choices":[{"index":0,"message":{"role":"assistant","content":"4"},"finish_reason":"stop"}],
             "usage":{"prompt_tokens":12,"completion_tokens":1,"total_tokens":13}}
            """;

    private final OpenAIProvider provider = new OpenAIProvider(JacksonConfiguration.createObjectMapper());

    private final ProviderSettings settings = TestProviders
            .settings("openai", ProviderType.OPENAI, "https://api.openai.com/v1")
            .apiKey("sk-test")
            .build();

    private static CompletionRequest request() {
        return CompletionRequest.builder()
                .providerKey(ProviderKey.of("openai"))
                .model("gpt-4o")
                .message(Message.of("user", "What is 2+2?"))
                .build();
    }

    @Test
    void postsToChatCompletionsWithBearerToken() {
        StubExchange exchange = StubExchange.respondingWith(RESPONSE);

        StepVerifier.create(provider.complete(exchange.webClient(), request(), settings))
                .assertNext(response -> {
                    assertEquals("chatcmpl-123", response.getId());
                    assertEquals("4", response.getChoices().get(0).getMessage().getContent());
                    assertEquals(13, response.getUsage().getTotalTokens());
                })
                .verifyComplete();

        assertEquals(HttpMethod.POST, exchange.lastRequest().method());
        assertEquals("https://api.openai.com/v1/chat/completions", exchange.lastRequest().url().toString());
        assertEquals("Bearer sk-test", exchange.lastRequest().headers().getFirst(HttpHeaders.AUTHORIZATION));
    }

    @Test
    void omitsAuthorizationWithoutApiKey() {
        StubExchange exchange = StubExchange.respondingWith(RESPONSE);
        ProviderSettings local = TestProviders.settings("vllm", ProviderType.OPENAI, "http://localhost:8000/v1").build();

        StepVerifier.create(provider.complete(exchange.webClient(), request(), local))
                .expectNextCount(1)
                .verifyComplete();

        assertNull(exchange.lastRequest().headers().getFirst(HttpHeaders.AUTHORIZATION));
    }

    @Test
    void responseWithoutChoicesIsAProtocolError() {
        StubExchange exchange = StubExchange.respondingWith("{\"id\":\"x\",\"choices\":[]}");

        StepVerifier.create(provider.complete(exchange.webClient(), request(), settings))
                .expectError(ProviderProtocolException.class)
                .verify();
    }

    @Test
    void errorStatusSurfacesAsResponseException() {
        StubExchange exchange = new StubExchange();
        exchange.respond(HttpStatus.SERVICE_UNAVAILABLE, "{\"error\":\"overloaded\"}");

        StepVerifier.create(provider.complete(exchange.webClient(), request(), settings))
                .expectErrorSatisfies(error -> {
                    WebClientResponseException response = assertInstanceOf(WebClientResponseException.class, error);
                    assertEquals(503, response.getStatusCode().value());
                })
                .verify();
    }

    @Test
    void rejectsRequestsWithoutModel() {
        CompletionRequest noModel = request().toBuilder().model(null).build();
        StubExchange exchange = StubExchange.respondingWith(RESPONSE);

        assertThrows(IllegalArgumentException.class,
                () -> provider.complete(exchange.webClient(), noModel, settings));
        assertEquals(0, exchange.calls());
    }
}
