package com.bulwark.cache;

import com.bulwark.config.JacksonConfiguration;
import com.bulwark.model.CacheControlContext;
import com.bulwark.model.CompletionRequest;
import com.bulwark.model.Message;
import com.bulwark.model.ProviderKey;
import com.bulwark.model.SamplingParameters;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for RequestFingerprinter.
 */
class RequestFingerprinterTest {

    private RequestFingerprinter fingerprinter;

    @BeforeEach
    void setUp() {
        fingerprinter = new RequestFingerprinter(JacksonConfiguration.createObjectMapper());
    }

    private static CompletionRequest.CompletionRequestBuilder base() {
        return CompletionRequest.builder()
                .providerKey(ProviderKey.of("openai"))
                .model("gpt-4o")
                .message(Message.of("system", "You are terse."))
                .message(Message.of("user", "What is 2+2?"))
                .sampling(SamplingParameters.builder().temperature(0.0).maxTokens(50).build());
    }

    @Test
    void testFingerprintIsSha256Hex() {
        RequestFingerprint fingerprint = fingerprinter.fingerprint(base().build());
        assertNotNull(fingerprint);
        assertEquals(64, fingerprint.getValue().length());
        assertTrue(fingerprint.getValue().matches("[0-9a-f]{64}"));
    }

    @Test
    void testSameRequestSameFingerprint() {
        assertEquals(fingerprinter.fingerprint(base().build()), fingerprinter.fingerprint(base().build()));
    }

    @Test
    void testIgnoresFieldsThatDoNotAffectOutput() {
        CompletionRequest other = base()
                .requestId("another-id")
                .timeout(Duration.ofSeconds(3))
                .cacheControl(CacheControlContext.builder().store(false).build())
                .build();

        assertEquals(fingerprinter.fingerprint(base().build()), fingerprinter.fingerprint(other));
    }

    @Test
    void testCloseSamplingValuesKeepDistinctFingerprints() {
        CompletionRequest a = base()
                .sampling(SamplingParameters.builder().temperature(0.701).topP(0.951).build())
                .build();
        CompletionRequest b = base()
                .sampling(SamplingParameters.builder().temperature(0.704).topP(0.949).build())
                .build();

        assertNotEquals(fingerprinter.fingerprint(a), fingerprinter.fingerprint(b));
        assertTrue(fingerprinter.canonicalize(a).contains("\"temperature\":0.701"));
    }

    @Test
    void testSamplingParametersChangeFingerprint() {
        CompletionRequest seeded = base()
                .sampling(SamplingParameters.builder().temperature(0.0).maxTokens(50).seed(7L).build())
                .build();
        CompletionRequest stopped = base()
                .sampling(SamplingParameters.builder().temperature(0.0).maxTokens(50).stop(List.of("\n")).build())
                .build();

        RequestFingerprint original = fingerprinter.fingerprint(base().build());
        assertNotEquals(original, fingerprinter.fingerprint(seeded));
        assertNotEquals(original, fingerprinter.fingerprint(stopped));
    }

    @Test
    void testProviderAndModelChangeFingerprint() {
        RequestFingerprint original = fingerprinter.fingerprint(base().build());

        assertNotEquals(original, fingerprinter.fingerprint(base().providerKey(ProviderKey.of("azure")).build()));
        assertNotEquals(original, fingerprinter.fingerprint(base().model("gpt-4o-mini").build()));
    }

    @Test
    void testMessageOrderAndWhitespaceMatter() {
        CompletionRequest reordered = CompletionRequest.builder()
                .providerKey(ProviderKey.of("openai"))
                .model("gpt-4o")
                .message(Message.of("user", "What is 2+2?"))
                .message(Message.of("system", "You are terse."))
                .sampling(SamplingParameters.builder().temperature(0.0).maxTokens(50).build())
                .build();
        CompletionRequest spaced = CompletionRequest.builder()
                .providerKey(ProviderKey.of("openai"))
                .model("gpt-4o")
                .message(Message.of("system", "You are terse."))
                .message(Message.of("user", "What is  2+2?"))
                .sampling(SamplingParameters.builder().temperature(0.0).maxTokens(50).build())
                .build();

        RequestFingerprint original = fingerprinter.fingerprint(base().build());
        assertNotEquals(original, fingerprinter.fingerprint(reordered));
        assertNotEquals(original, fingerprinter.fingerprint(spaced));
    }

    @Test
    void testCanonicalFormSortsKeysAndDropsNulls() {
        CompletionRequest request = CompletionRequest.builder()
                .providerKey(ProviderKey.of("openai"))
                .model("gpt-4o")
                .message(Message.of("user", "hi"))
                .sampling(SamplingParameters.builder().temperature(0.5).build())
                .build();

        String canonical = fingerprinter.canonicalize(request);

        assertEquals("{\"messages\":[{\"content\":\"hi\",\"role\":\"user\"}],\"model\":\"gpt-4o\","
                + "\"provider\":\"openai\",\"sampling\":{\"temperature\":0.5}}", canonical);
    }
}
