package com.bulwark.resilience.pool;

import com.bulwark.model.HostKey;
import com.bulwark.model.dto.PoolStatistics;
import lombok.Getter;

import java.time.Duration;
import java.util.Deque;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.LongAdder;

/**
 * Connections to one host. Idle connections are kept most recently used first.
 */
@Getter
class HostPool {

    private final HostKey host;
    private final int maxConnections;
    private final Duration idleTimeout;
    private final Semaphore permits;
    private final Deque<PooledConnection> idle = new ConcurrentLinkedDeque<>();
    private final AtomicInteger inUse = new AtomicInteger();

    private final LongAdder created = new LongAdder();
    private final LongAdder discarded = new LongAdder();
    private final LongAdder reaped = new LongAdder();
    private final LongAdder exhausted = new LongAdder();

    HostPool(HostKey host, int maxConnections, Duration idleTimeout) {
        if (maxConnections <= 0) {
            throw new IllegalArgumentException("maxConnections for " + host + " must be positive, got " + maxConnections);
        }
        PoolSettings.requirePositive("idleTimeout for " + host, idleTimeout);
        this.host = host;
        this.maxConnections = maxConnections;
        this.idleTimeout = idleTimeout;
        this.permits = new Semaphore(maxConnections, true);
    }

    /**
     * A copy with the stricter of both limits. Only valid before any connection exists.
     */
    HostPool tightenedTo(int otherMaxConnections, Duration otherIdleTimeout) {
        int max = Math.min(maxConnections, otherMaxConnections);
        Duration timeout = otherIdleTimeout.compareTo(idleTimeout) < 0 ? otherIdleTimeout : idleTimeout;
        return new HostPool(host, max, timeout);
    }

    PoolStatistics statistics() {
        return PoolStatistics.builder()
                .host(host.toString())
                .maxConnections(maxConnections)
                .inUse(inUse.get())
                .idle(idle.size())
                .created(created.sum())
                .discarded(discarded.sum())
                .reaped(reaped.sum())
                .exhausted(exhausted.sum())
                .build();
    }
}
