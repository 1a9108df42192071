package com.bulwark.cache;

import com.bulwark.model.CompletionRequest;
import com.bulwark.model.Message;
import com.bulwark.model.SamplingParameters;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.codec.digest.DigestUtils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Canonicalizes completion requests into stable fingerprints.
 *
 * Steps:
 * 1. Keep only output-affecting fields (provider, model, messages, sampling parameters)
 * 2. Remove null values
 * 3. Sort JSON keys recursively
 * 4. Generate SHA-256 hash
 *
 * Message order, content and sampling values are kept exactly: two prompts differing only in
 * whitespace, or two temperatures differing in the third decimal, are different requests.
 */
@Slf4j
public class RequestFingerprinter {

    private final ObjectMapper objectMapper;

    public RequestFingerprinter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public RequestFingerprint fingerprint(CompletionRequest request) {
        String canonical = canonicalize(request);
        return RequestFingerprint.of(DigestUtils.sha256Hex(canonical));
    }

    /**
     * Canonical JSON string of the output-affecting part of the request.
     */
    public String canonicalize(CompletionRequest request) {
        ObjectNode root = objectMapper.createObjectNode();
        root.put("provider", request.getProviderKey().getName());
        root.put("model", request.getModel());

        ArrayNode messages = root.putArray("messages");
        for (Message message : request.getMessages()) {
            ObjectNode node = messages.addObject();
            node.put("role", message.getRole());
            node.put("content", message.getContent());
            node.put("name", message.getName());
        }

        SamplingParameters sampling = request.getSampling();
        ObjectNode params = root.putObject("sampling");
        params.put("temperature", sampling.getTemperature());
        params.put("top_p", sampling.getTopP());
        params.put("max_tokens", sampling.getMaxTokens());
        params.put("seed", sampling.getSeed());
        params.put("presence_penalty", sampling.getPresencePenalty());
        params.put("frequency_penalty", sampling.getFrequencyPenalty());
        if (sampling.getStop() != null) {
            ArrayNode stop = params.putArray("stop");
            sampling.getStop().forEach(stop::add);
        }

        StringBuilder sb = new StringBuilder();
        serializeNode(canonicalizeNode(root), sb);
        return sb.toString();
    }

    private JsonNode canonicalizeNode(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }

        if (node.isObject()) {
            ObjectNode canonical = objectMapper.createObjectNode();
            List<String> fieldNames = new ArrayList<>();
            node.fieldNames().forEachRemaining(fieldNames::add);
            Collections.sort(fieldNames);

            for (String fieldName : fieldNames) {
                JsonNode value = canonicalizeNode(node.get(fieldName));
                if (value != null) {
                    canonical.set(fieldName, value);
                }
            }
            return canonical;
        } else if (node.isArray()) {
            ArrayNode canonical = objectMapper.createArrayNode();
            for (JsonNode element : node) {
                JsonNode value = canonicalizeNode(element);
                canonical.add(value != null ? value : objectMapper.getNodeFactory().nullNode());
            }
            return canonical;
        }
        return node;
    }

    private void serializeNode(JsonNode node, StringBuilder sb) {
        if (node == null || node.isNull()) {
            sb.append("null");
        } else if (node.isObject()) {
            sb.append("{");
            List<String> fieldNames = new ArrayList<>();
            node.fieldNames().forEachRemaining(fieldNames::add);
            Collections.sort(fieldNames);

            boolean first = true;
            for (String fieldName : fieldNames) {
                if (!first) {
                    sb.append(",");
                }
                first = false;
                sb.append("\"").append(escapeJson(fieldName)).append("\":");
                serializeNode(node.get(fieldName), sb);
            }
            sb.append("}");
        } else if (node.isArray()) {
            sb.append("[");
            boolean first = true;
            for (JsonNode element : node) {
                if (!first) {
                    sb.append(",");
                }
                first = false;
                serializeNode(element, sb);
            }
            sb.append("]");
        } else if (node.isTextual()) {
            sb.append("\"").append(escapeJson(node.asText())).append("\"");
        } else {
            sb.append(node.asText());
        }
    }

    private String escapeJson(String text) {
        return text
                .replace("\\", "\\\\")
                .replace("\"", "\\\"")
                .replace("\n", "\\n")
                .replace("\r", "\\r")
                .replace("\t", "\\t");
    }
}
