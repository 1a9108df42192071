package com.bulwark.cache;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

/**
 * GZIP compression of cached payloads above a size threshold.
 */
public class PayloadCodec {

    private final int compressionThresholdBytes;

    public PayloadCodec(int compressionThresholdBytes) {
        this.compressionThresholdBytes = compressionThresholdBytes;
    }

    /**
     * Compress the payload when it is large enough and compression actually shrinks it.
     */
    public Encoded encode(byte[] payload) {
        if (payload.length < compressionThresholdBytes) {
            return new Encoded(payload, false);
        }
        byte[] compressed = compress(payload);
        if (compressed.length >= payload.length) {
            return new Encoded(payload, false);
        }
        return new Encoded(compressed, true);
    }

    public byte[] decode(byte[] stored, boolean compressed) {
        return compressed ? decompress(stored) : stored;
    }

    private byte[] compress(byte[] payload) {
        try (ByteArrayOutputStream baos = new ByteArrayOutputStream()) {
            try (GZIPOutputStream gzipOut = new GZIPOutputStream(baos)) {
                gzipOut.write(payload);
            }
            return baos.toByteArray();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to compress cache payload", e);
        }
    }

    private byte[] decompress(byte[] compressed) {
        try (ByteArrayInputStream bais = new ByteArrayInputStream(compressed);
             GZIPInputStream gzipIn = new GZIPInputStream(bais);
             ByteArrayOutputStream baos = new ByteArrayOutputStream()) {

            byte[] buffer = new byte[1024];
            int len;
            while ((len = gzipIn.read(buffer)) > 0) {
                baos.write(buffer, 0, len);
            }
            return baos.toByteArray();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to decompress cache payload", e);
        }
    }

    /**
     * Stored form of a payload.
     */
    public record Encoded(byte[] bytes, boolean compressed) {
    }
}
