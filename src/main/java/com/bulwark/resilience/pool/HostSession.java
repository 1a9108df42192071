package com.bulwark.resilience.pool;

import org.springframework.web.reactive.function.client.WebClient;

/**
 * One reusable network session to a host.
 */
public interface HostSession {

    /**
     * Client bound to this session's connection.
     */
    WebClient webClient();

    /**
     * Release the underlying connection. Safe to call more than once.
     */
    void close();
}
