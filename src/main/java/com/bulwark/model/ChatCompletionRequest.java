package com.bulwark.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * OpenAI-compatible chat completion request body.
 * Sent to OpenAI-type providers and accepted by the HTTP surface.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ChatCompletionRequest {

    @JsonProperty("model")
    private String model;

    @JsonProperty("messages")
    private List<Message> messages;

    @JsonProperty("temperature")
    private Double temperature;

    @JsonProperty("top_p")
    private Double topP;

    @JsonProperty("stream")
    private Boolean stream;

    @JsonProperty("stop")
    private List<String> stop;

    @JsonProperty("max_tokens")
    private Integer maxTokens;

    @JsonProperty("seed")
    private Long seed;

    @JsonProperty("presence_penalty")
    private Double presencePenalty;

    @JsonProperty("frequency_penalty")
    private Double frequencyPenalty;

    public SamplingParameters toSamplingParameters() {
        return SamplingParameters.builder()
                .temperature(temperature)
                .topP(topP)
                .maxTokens(maxTokens)
                .stop(stop)
                .seed(seed)
                .presencePenalty(presencePenalty)
                .frequencyPenalty(frequencyPenalty)
                .build();
    }

    public static ChatCompletionRequest from(CompletionRequest request) {
        SamplingParameters sampling = request.getSampling();
        return ChatCompletionRequest.builder()
                .model(request.getModel())
                .messages(request.getMessages())
                .temperature(sampling.getTemperature())
                .topP(sampling.getTopP())
                .maxTokens(sampling.getMaxTokens())
                .stop(sampling.getStop())
                .seed(sampling.getSeed())
                .presencePenalty(sampling.getPresencePenalty())
                .frequencyPenalty(sampling.getFrequencyPenalty())
                .stream(false)
                .build();
    }
}
