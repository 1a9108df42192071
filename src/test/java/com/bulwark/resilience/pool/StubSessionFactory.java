package com.bulwark.resilience.pool;

import com.bulwark.model.HostKey;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Session factory that opens no sockets and counts what the pool does with its sessions.
 */
class StubSessionFactory implements SessionFactory {

    final AtomicInteger opened = new AtomicInteger();
    final AtomicInteger closed = new AtomicInteger();

    @Override
    public HostSession open(HostKey host) {
        opened.incrementAndGet();
        WebClient client = WebClient.builder().baseUrl(host.toBaseUrl()).build();
        return new HostSession() {
            private boolean open = true;

            @Override
            public WebClient webClient() {
                return client;
            }

            @Override
            public synchronized void close() {
                if (open) {
                    open = false;
                    closed.incrementAndGet();
                }
            }
        };
    }
}
