package com.bulwark.provider;

import com.bulwark.config.JacksonConfiguration;
import com.bulwark.model.ChatCompletionResponse;
import com.bulwark.model.CompletionRequest;
import com.bulwark.model.Message;
import com.bulwark.model.ProviderKey;
import com.bulwark.model.ProviderType;
import com.bulwark.model.SamplingParameters;
import com.bulwark.support.StubExchange;
import com.bulwark.support.TestProviders;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import static org.junit.jupiter.api.Assertions.*;

class OllamaProviderTest {

    private static final String RESPONSE = """
            {"model":"llama3","created_at":"2024-01-01T00:00:00Z",
             "message":{"role":"assistant","content":"Paris"},
             "done":true,"done_reason":"stop","prompt_eval_count":26,"eval_count":3}
            """;

    private final ObjectMapper objectMapper = JacksonConfiguration.createObjectMapper();
    private final OllamaProvider provider = new OllamaProvider(objectMapper);

    private static CompletionRequest request(SamplingParameters sampling) {
        return CompletionRequest.builder()
                .providerKey(ProviderKey.of("local-ollama"))
                .model("llama3")
                .message(Message.of("user", "Capital of France?"))
                .sampling(sampling)
                .build();
    }

    @Test
    void convertsSamplingToOptions() {
        JsonNode body = provider.convertToOllamaFormat(request(SamplingParameters.builder()
                .temperature(0.0)
                .maxTokens(64)
                .seed(42L)
                .build()));

        assertFalse(body.get("stream").asBoolean());
        assertEquals(0.0, body.get("options").get("temperature").asDouble(), 1e-9);
        assertEquals(64, body.get("options").get("num_predict").asInt());
        assertEquals(42, body.get("options").get("seed").asLong());
    }

    @Test
    void omitsEmptyOptions() {
        JsonNode body = provider.convertToOllamaFormat(request(SamplingParameters.defaults()));
        assertFalse(body.has("options"));
    }

    @Test
    void convertsResponse() throws Exception {
        ChatCompletionResponse response = provider.convertToOpenAIFormat(objectMapper.readTree(RESPONSE), "llama3");

        assertEquals("Paris", response.getChoices().get(0).getMessage().getContent());
        assertEquals("stop", response.getChoices().get(0).getFinishReason());
        assertEquals(26, response.getUsage().getPromptTokens());
        assertEquals(29, response.getUsage().getTotalTokens());
        assertTrue(response.getId().startsWith("chatcmpl-"));
    }

    @Test
    void postsToApiChat() {
        StubExchange exchange = StubExchange.respondingWith(RESPONSE);

        StepVerifier.create(provider.complete(exchange.webClient(), request(SamplingParameters.defaults()),
                        TestProviders.settings("local-ollama", ProviderType.OLLAMA, "http://localhost:11434").build()))
                .expectNextCount(1)
                .verifyComplete();

        assertEquals("http://localhost:11434/api/chat", exchange.lastRequest().url().toString());
    }
}
