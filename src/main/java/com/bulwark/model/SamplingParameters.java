package com.bulwark.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Sampling parameters that affect the generated output.
 * All of them take part in the request fingerprint.
 */
@Value
@Builder(toBuilder = true)
public class SamplingParameters {

    Double temperature;
    Double topP;
    Integer maxTokens;
    List<String> stop;
    Long seed;
    Double presencePenalty;
    Double frequencyPenalty;

    public static SamplingParameters defaults() {
        return SamplingParameters.builder().build();
    }
}
