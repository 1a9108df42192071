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
 * Anthropic (Claude) Messages API.
 */
@Slf4j
@Component
public class AnthropicProvider extends AbstractChatProvider {

    private static final String ANTHROPIC_VERSION = "2023-06-01";
    private static final int DEFAULT_MAX_TOKENS = 4096;

    public AnthropicProvider(ObjectMapper objectMapper) {
        super(objectMapper);
    }

    @Override
    public ProviderType getType() {
        return ProviderType.ANTHROPIC;
    }

    @Override
    public Mono<ChatCompletionResponse> complete(WebClient client, CompletionRequest request, ProviderSettings settings) {
        validate(request);
        logForward(request, settings);

        JsonNode anthropicRequest = convertToAnthropicFormat(request);

        WebClient.RequestBodySpec spec = client.post()
                .uri(settings.endpoint("/v1/messages"))
                .header("anthropic-version", ANTHROPIC_VERSION)
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE);
        if (settings.hasApiKey()) {
            spec = spec.header("x-api-key", settings.getApiKey());
        }

        return spec.bodyValue(anthropicRequest.toString())
                .retrieve()
                .bodyToMono(JsonNode.class)
                .map(response -> convertToOpenAIFormat(response, request.getModel()))
                .switchIfEmpty(Mono.error(() -> new ProviderProtocolException("Anthropic response body is empty")));
    }

    /**
     * Convert the request to Anthropic format. System messages move to the top-level
     * {@code system} field; the rest become text content blocks.
     */
    JsonNode convertToAnthropicFormat(CompletionRequest request) {
        ObjectNode anthropicRequest = objectMapper.createObjectNode();
        anthropicRequest.put("model", request.getModel());

        StringBuilder system = new StringBuilder();
        ArrayNode messagesArray = anthropicRequest.putArray("messages");

        for (Message msg : request.getMessages()) {
            if (msg.isSystem()) {
                if (system.length() > 0) {
                    system.append("\n\n");
                }
                system.append(msg.getContent());
                continue;
            }
            ObjectNode anthropicMsg = messagesArray.addObject();
            anthropicMsg.put("role", msg.getRole());

            ArrayNode contentArray = anthropicMsg.putArray("content");
            ObjectNode textContent = contentArray.addObject();
            textContent.put("type", "text");
            textContent.put("text", msg.getContent());
        }

        if (messagesArray.isEmpty()) {
            throw new IllegalArgumentException("Anthropic requests need at least one non-system message");
        }
        if (system.length() > 0) {
            anthropicRequest.put("system", system.toString());
        }

        SamplingParameters sampling = request.getSampling();
        anthropicRequest.put("max_tokens", sampling.getMaxTokens() != null ? sampling.getMaxTokens() : DEFAULT_MAX_TOKENS);
        if (sampling.getTemperature() != null) {
            anthropicRequest.put("temperature", sampling.getTemperature());
        }
        if (sampling.getTopP() != null) {
            anthropicRequest.put("top_p", sampling.getTopP());
        }
        if (sampling.getStop() != null && !sampling.getStop().isEmpty()) {
            ArrayNode stop = anthropicRequest.putArray("stop_sequences");
            sampling.getStop().forEach(stop::add);
        }

        return anthropicRequest;
    }

    /**
     * Convert Anthropic response to OpenAI format.
     */
    ChatCompletionResponse convertToOpenAIFormat(JsonNode anthropicResponse, String model) {
        JsonNode content = required(anthropicResponse, "content");
        if (!content.isArray()) {
            throw new ProviderProtocolException("Anthropic response 'content' is not an array");
        }

        StringBuilder contentBuilder = new StringBuilder();
        for (JsonNode item : content) {
            if ("text".equals(item.path("type").asText())) {
                contentBuilder.append(item.path("text").asText());
            }
        }

        Message assistantMessage = Message.builder()
                .role(anthropicResponse.path("role").asText("assistant"))
                .content(contentBuilder.toString())
                .build();

        Choice choice = Choice.builder()
                .index(0)
                .message(assistantMessage)
                .finishReason(mapStopReason(anthropicResponse.path("stop_reason").asText("end_turn")))
                .build();

        Usage usage = null;
        JsonNode usageNode = anthropicResponse.get("usage");
        if (usageNode != null) {
            Integer input = optionalInt(usageNode, "input_tokens");
            Integer output = optionalInt(usageNode, "output_tokens");
            usage = Usage.builder()
                    .promptTokens(input)
                    .completionTokens(output)
                    .totalTokens((input != null ? input : 0) + (output != null ? output : 0))
                    .build();
        }

        return ChatCompletionResponse.builder()
                .id(anthropicResponse.has("id") ? "chatcmpl-" + anthropicResponse.get("id").asText() : generatedId())
                .object(CHAT_COMPLETION_OBJECT)
                .created(Instant.now().getEpochSecond())
                .model(model)
                .choices(List.of(choice))
                .usage(usage)
                .build();
    }

    /**
     * Map Claude stop reasons to OpenAI finish reasons.
     */
    private String mapStopReason(String claudeStopReason) {
        return switch (claudeStopReason) {
            case "max_tokens" -> "length";
            case "tool_use" -> "tool_calls";
            default -> "stop";
        };
    }
}
