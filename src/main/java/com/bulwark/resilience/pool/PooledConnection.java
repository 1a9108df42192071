package com.bulwark.resilience.pool;

import com.bulwark.model.HostKey;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A session owned by the pool. At most one caller holds it at a time.
 */
@Slf4j
@Getter
public class PooledConnection {

    private final long id;
    private final HostKey host;
    private final Instant createdAt;
    private volatile Instant lastUsedAt;

    @Getter(AccessLevel.NONE)
    private final HostSession session;

    @Getter(AccessLevel.NONE)
    private final AtomicBoolean checkedOut = new AtomicBoolean();

    PooledConnection(long id, HostKey host, HostSession session, Instant createdAt) {
        this.id = id;
        this.host = host;
        this.session = session;
        this.createdAt = createdAt;
        this.lastUsedAt = createdAt;
    }

    public WebClient webClient() {
        return session.webClient();
    }

    public boolean isCheckedOut() {
        return checkedOut.get();
    }

    boolean checkOut(Instant now) {
        if (!checkedOut.compareAndSet(false, true)) {
            return false;
        }
        lastUsedAt = now;
        return true;
    }

    boolean checkIn(Instant now) {
        if (!checkedOut.compareAndSet(true, false)) {
            return false;
        }
        lastUsedAt = now;
        return true;
    }

    void close() {
        try {
            session.close();
        } catch (RuntimeException e) {
            log.warn("Failed to close connection {} to {}", id, host, e);
        }
    }

    @Override
    public String toString() {
        return "PooledConnection{id=" + id + ", host=" + host + "}";
    }
}
