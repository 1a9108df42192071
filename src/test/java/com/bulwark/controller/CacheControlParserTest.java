package com.bulwark.controller;

import com.bulwark.model.CacheControlContext;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;

import static org.junit.jupiter.api.Assertions.*;

class CacheControlParserTest {

    private final CacheControlParser parser = new CacheControlParser();

    @Test
    void defaultsWithoutHeaders() {
        CacheControlContext context = parser.parse(new HttpHeaders());

        assertTrue(context.shouldLookup());
        assertTrue(context.shouldStore());
    }

    @Test
    void readsBypassAndStoreHeaders() {
        HttpHeaders headers = new HttpHeaders();
        headers.add(BulwarkHeaders.CACHE_BYPASS, "yes");
        headers.add(BulwarkHeaders.CACHE_STORE, "0");

        CacheControlContext context = parser.parse(headers);

        assertFalse(context.shouldLookup());
        assertFalse(context.shouldStore());
    }

    @Test
    void invalidValuesFallBackToDefaults() {
        assertTrue(parser.parseBoolean("maybe", true));
        assertFalse(parser.parseBoolean("", false));
        assertTrue(parser.parseBoolean(" ON ", false));
    }
}
