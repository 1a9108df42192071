package com.bulwark.resilience.pool;

import org.springframework.web.reactive.function.client.WebClient;

/**
 * Scoped checkout of a pooled connection. Closing the lease returns the connection,
 * or discards it if it was marked unusable.
 */
public class ConnectionLease implements AutoCloseable {

    private final ConnectionPool pool;
    private final PooledConnection connection;
    private boolean reusable = true;
    private boolean closed;

    ConnectionLease(ConnectionPool pool, PooledConnection connection) {
        this.pool = pool;
        this.connection = connection;
    }

    public PooledConnection connection() {
        return connection;
    }

    public WebClient webClient() {
        return connection.webClient();
    }

    /**
     * The connection saw a transport error or a timeout and must not be reused.
     */
    public void markUnusable() {
        reusable = false;
    }

    public boolean isReusable() {
        return reusable;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        pool.release(connection, reusable);
    }
}
