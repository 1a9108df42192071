package com.bulwark.cache;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class PayloadCodecTest {

    private final PayloadCodec codec = new PayloadCodec(100);

    @Test
    void smallPayloadsAreStoredAsIs() {
        byte[] payload = "short".getBytes(StandardCharsets.UTF_8);
        PayloadCodec.Encoded encoded = codec.encode(payload);

        assertFalse(encoded.compressed());
        assertArrayEquals(payload, encoded.bytes());
    }

    @Test
    void repetitivePayloadsAreCompressed() {
        byte[] payload = "abc".repeat(1000).getBytes(StandardCharsets.UTF_8);
        PayloadCodec.Encoded encoded = codec.encode(payload);

        assertTrue(encoded.compressed());
        assertTrue(encoded.bytes().length < payload.length);
        assertArrayEquals(payload, codec.decode(encoded.bytes(), true));
    }

    @Test
    void incompressiblePayloadsStayUncompressed() {
        byte[] payload = new byte[200];
        new Random(42).nextBytes(payload);

        PayloadCodec.Encoded encoded = codec.encode(payload);

        assertFalse(encoded.compressed());
        assertArrayEquals(payload, codec.decode(encoded.bytes(), encoded.compressed()));
    }
}
