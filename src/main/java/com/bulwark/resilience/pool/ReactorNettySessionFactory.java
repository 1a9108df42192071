package com.bulwark.resilience.pool;

import com.bulwark.model.HostKey;
import io.netty.channel.ChannelOption;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;
import reactor.netty.resources.ConnectionProvider;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Builds each session on its own single-connection Reactor Netty provider,
 * so the pool alone decides how many connections exist and when they close.
 */
@Slf4j
public class ReactorNettySessionFactory implements SessionFactory {

    private final PoolSettings settings;
    private final WebClient.Builder webClientBuilder;
    private final AtomicLong sequence = new AtomicLong();

    public ReactorNettySessionFactory(PoolSettings settings, WebClient.Builder webClientBuilder) {
        this.settings = settings;
        this.webClientBuilder = webClientBuilder;
    }

    @Override
    public HostSession open(HostKey host) {
        String name = "bulwark-" + host.getHost() + "-" + host.getPort() + "-" + sequence.incrementAndGet();

        ConnectionProvider provider = ConnectionProvider.builder(name)
                .maxConnections(1)
                .maxIdleTime(settings.getIdleTimeout())
                .build();

        HttpClient httpClient = HttpClient.create(provider)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) settings.getConnectTimeout().toMillis())
                .keepAlive(true)
                .resolver(spec -> spec.cacheMaxTimeToLive(settings.getDnsCacheTtl()));

        WebClient webClient = webClientBuilder.clone()
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .build();

        log.debug("Opened session {} to {}", name, host);
        return new NettyHostSession(name, provider, webClient);
    }

    private static final class NettyHostSession implements HostSession {

        private final String name;
        private final ConnectionProvider provider;
        private final WebClient webClient;

        private NettyHostSession(String name, ConnectionProvider provider, WebClient webClient) {
            this.name = name;
            this.provider = provider;
            this.webClient = webClient;
        }

        @Override
        public WebClient webClient() {
            return webClient;
        }

        @Override
        public void close() {
            if (!provider.isDisposed()) {
                provider.dispose();
                log.debug("Closed session {}", name);
            }
        }
    }
}
