package com.bulwark.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.net.URI;
import java.util.Locale;

/**
 * Target host of pooled connections: scheme, host name and port.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class HostKey {

    String scheme;
    String host;
    int port;

    public static HostKey of(String scheme, String host, int port) {
        return new HostKey(scheme.toLowerCase(Locale.ROOT), host.toLowerCase(Locale.ROOT), port);
    }

    /**
     * Extract the host key from a provider base URL.
     *
     * @param baseUrl absolute http or https URL
     * @return host key with the default port filled in
     * @throws IllegalArgumentException if the URL is not an absolute http(s) URL
     */
    public static HostKey fromUrl(String baseUrl) {
        if (baseUrl == null || baseUrl.isBlank()) {
            throw new IllegalArgumentException("Base URL must not be blank");
        }

        URI uri;
        try {
            uri = URI.create(baseUrl.trim());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Malformed base URL: " + baseUrl, e);
        }

        String scheme = uri.getScheme();
        if (scheme == null || !(scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https"))) {
            throw new IllegalArgumentException("Base URL must use http or https: " + baseUrl);
        }
        if (uri.getHost() == null) {
            throw new IllegalArgumentException("Base URL has no host: " + baseUrl);
        }

        int port = uri.getPort();
        if (port == -1) {
            port = scheme.equalsIgnoreCase("https") ? 443 : 80;
        }
        return of(scheme, uri.getHost(), port);
    }

    public String toBaseUrl() {
        return scheme + "://" + host + ":" + port;
    }

    @Override
    public String toString() {
        return toBaseUrl();
    }
}
