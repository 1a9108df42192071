package com.bulwark.provider;

import com.bulwark.config.ProviderSettings;
import com.bulwark.model.ChatCompletionResponse;
import com.bulwark.model.Choice;
import com.bulwark.model.CompletionRequest;
import com.bulwark.model.Message;
import com.bulwark.model.ProviderType;
import com.bulwark.model.SamplingParameters;
import com.bulwark.model.Usage;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.List;

/**
 * Ollama native chat API ({@code POST /api/chat}), always non-streaming.
 */
@Slf4j
@Component
public class OllamaProvider extends AbstractChatProvider {

    public OllamaProvider(ObjectMapper objectMapper) {
        super(objectMapper);
    }

    @Override
    public ProviderType getType() {
        return ProviderType.OLLAMA;
    }

    @Override
    public Mono<ChatCompletionResponse> complete(WebClient client, CompletionRequest request, ProviderSettings settings) {
        validate(request);
        logForward(request, settings);

        return client.post()
                .uri(settings.endpoint("/api/chat"))
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .bodyValue(convertToOllamaFormat(request).toString())
                .retrieve()
                .bodyToMono(JsonNode.class)
                .map(response -> convertToOpenAIFormat(response, request.getModel()))
                .switchIfEmpty(Mono.error(() -> new ProviderProtocolException("Ollama response body is empty")));
    }

    JsonNode convertToOllamaFormat(CompletionRequest request) {
        ObjectNode ollamaRequest = objectMapper.createObjectNode();
        ollamaRequest.put("model", request.getModel());
        ollamaRequest.put("stream", false);

        ArrayNode messages = ollamaRequest.putArray("messages");
        for (Message msg : request.getMessages()) {
            ObjectNode node = messages.addObject();
            node.put("role", msg.getRole());
            node.put("content", msg.getContent());
        }

        SamplingParameters sampling = request.getSampling();
        ObjectNode options = objectMapper.createObjectNode();
        if (sampling.getTemperature() != null) {
            options.put("temperature", sampling.getTemperature());
        }
        if (sampling.getTopP() != null) {
            options.put("top_p", sampling.getTopP());
        }
        if (sampling.getMaxTokens() != null) {
            options.put("num_predict", sampling.getMaxTokens());
        }
        if (sampling.getSeed() != null) {
            options.put("seed", sampling.getSeed());
        }
        if (sampling.getPresencePenalty() != null) {
            options.put("presence_penalty", sampling.getPresencePenalty());
        }
        if (sampling.getFrequencyPenalty() != null) {
            options.put("frequency_penalty", sampling.getFrequencyPenalty());
        }
        if (sampling.getStop() != null && !sampling.getStop().isEmpty()) {
            ArrayNode stop = options.putArray("stop");
            sampling.getStop().forEach(stop::add);
        }
        if (!options.isEmpty()) {
            ollamaRequest.set("options", options);
        }
        return ollamaRequest;
    }

    ChatCompletionResponse convertToOpenAIFormat(JsonNode ollamaResponse, String model) {
        JsonNode message = required(ollamaResponse, "message");

        Message assistantMessage = Message.builder()
                .role(message.path("role").asText("assistant"))
                .content(message.path("content").asText(""))
                .build();

        String doneReason = ollamaResponse.path("done_reason").asText("stop");
        Choice choice = Choice.builder()
                .index(0)
                .message(assistantMessage)
                .finishReason("length".equals(doneReason) ? "length" : "stop")
                .build();

        Integer prompt = optionalInt(ollamaResponse, "prompt_eval_count");
        Integer completion = optionalInt(ollamaResponse, "eval_count");
        Usage usage = Usage.builder()
                .promptTokens(prompt)
                .completionTokens(completion)
                .totalTokens((prompt != null ? prompt : 0) + (completion != null ? completion : 0))
                .build();

        return ChatCompletionResponse.builder()
                .id(generatedId())
                .object(CHAT_COMPLETION_OBJECT)
                .created(Instant.now().getEpochSecond())
                .model(ollamaResponse.path("model").asText(model))
                .choices(List.of(choice))
                .usage(usage)
                .build();
    }
}
