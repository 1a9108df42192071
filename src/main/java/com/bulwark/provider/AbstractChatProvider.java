package com.bulwark.provider;

import com.bulwark.config.ProviderSettings;
import com.bulwark.model.CompletionRequest;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.util.UUID;

/**
 * Abstract base class for chat providers with common functionality.
 */
@Slf4j
public abstract class AbstractChatProvider implements ChatProvider {

    protected static final String CHAT_COMPLETION_OBJECT = "chat.completion";

    protected final ObjectMapper objectMapper;

    protected AbstractChatProvider(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Reject requests the provider cannot accept before anything is sent.
     */
    protected void validate(CompletionRequest request) {
        if (request.getModel() == null || request.getModel().isBlank()) {
            throw new IllegalArgumentException("Model must be specified");
        }
        if (request.getMessages() == null || request.getMessages().isEmpty()) {
            throw new IllegalArgumentException("Messages cannot be empty");
        }
    }

    protected void logForward(CompletionRequest request, ProviderSettings settings) {
        log.debug("Forwarding request {} to {} ({}): model={}",
                request.getRequestId(), settings.getKey(), getType(), request.getModel());
    }

    /**
     * Required JSON field, failing with a protocol error when absent.
     */
    protected JsonNode required(JsonNode node, String field) {
        JsonNode value = node == null ? null : node.get(field);
        if (value == null || value.isNull()) {
            throw new ProviderProtocolException(getType() + " response is missing '" + field + "'");
        }
        return value;
    }

    protected Integer optionalInt(JsonNode node, String field) {
        JsonNode value = node == null ? null : node.get(field);
        return value != null && value.isNumber() ? value.asInt() : null;
    }

    protected String generatedId() {
        return "chatcmpl-" + UUID.randomUUID().toString().substring(0, 8);
    }
}
