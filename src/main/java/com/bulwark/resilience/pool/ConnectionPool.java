package com.bulwark.resilience.pool;

import com.bulwark.exception.PoolExhaustedException;
import com.bulwark.model.HostKey;
import com.bulwark.model.dto.PoolStatistics;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Reusable network sessions per target host.
 *
 * <p>Checked-out connections are bounded per host and pool-wide by fair semaphores; a caller
 * that cannot obtain both permits within its timeout gets a {@link PoolExhaustedException}.
 * Idle connections are reused most recently used first and closed by a background reaper once
 * they have been idle longer than the host's idle timeout. The reaper only ever sees
 * connections it has atomically removed from an idle deque, never a checked-out one.
 */
@Slf4j
public class ConnectionPool {

    private final PoolSettings settings;
    private final SessionFactory sessionFactory;
    private final Clock clock;

    private final Semaphore globalPermits;
    private final ConcurrentMap<HostKey, HostPool> hosts = new ConcurrentHashMap<>();
    private final AtomicInteger liveConnections = new AtomicInteger();
    private final AtomicLong connectionIds = new AtomicLong();

    private volatile boolean running;
    private ScheduledExecutorService reaper;

    public ConnectionPool(PoolSettings settings, SessionFactory sessionFactory, Clock clock) {
        settings.validate();
        this.settings = settings;
        this.sessionFactory = sessionFactory;
        this.clock = clock;
        this.globalPermits = new Semaphore(settings.getMaxTotalConnections(), true);
    }

    /**
     * Declare per-host limits. When several providers share a host the stricter limits win.
     *
     * @throws IllegalStateException if the pool is already running
     */
    public synchronized void registerHost(HostKey host, int maxConnections, Duration idleTimeout) {
        if (running) {
            throw new IllegalStateException("Hosts must be registered before the pool starts");
        }
        hosts.compute(host, (key, existing) -> existing == null
                ? new HostPool(key, maxConnections, idleTimeout)
                : existing.tightenedTo(maxConnections, idleTimeout));
    }

    public synchronized void start() {
        if (running) {
            return;
        }
        reaper = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "bulwark-pool-reaper");
            thread.setDaemon(true);
            return thread;
        });
        long interval = settings.getReaperInterval().toMillis();
        reaper.scheduleWithFixedDelay(this::runReaper, interval, interval, TimeUnit.MILLISECONDS);
        running = true;
        log.info("Connection pool started: maxTotal={}, hosts={}, idleTimeout={}, reaperInterval={}",
                settings.getMaxTotalConnections(), hosts.size(), settings.getIdleTimeout(), settings.getReaperInterval());
    }

    /**
     * Stop the reaper and close idle connections. Connections still checked out are closed when released.
     */
    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        reaper.shutdownNow();
        reaper = null;

        int closed = 0;
        for (HostPool hostPool : hosts.values()) {
            PooledConnection connection;
            while ((connection = hostPool.getIdle().pollFirst()) != null) {
                discard(hostPool, connection);
                closed++;
            }
        }
        log.info("Connection pool stopped, closed {} idle connections", closed);
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * Check out a connection to {@code host}, waiting up to {@code timeout} for a free slot.
     *
     * @return lease that returns the connection when closed
     * @throws PoolExhaustedException if no connection became available in time
     * @throws IllegalStateException  if the pool is not running
     */
    public ConnectionLease acquire(HostKey host, Duration timeout) {
        if (!running) {
            throw new IllegalStateException("Connection pool is not running");
        }
        HostPool hostPool = hostPool(host);
        long budget = timeout == null || timeout.isNegative() ? 0 : timeout.toNanos();
        long deadline = System.nanoTime() + budget;

        acquirePermits(hostPool, budget, deadline);

        try {
            PooledConnection connection = takeIdle(hostPool);
            if (connection == null) {
                connection = create(hostPool);
            }
            if (!connection.checkOut(clock.instant())) {
                throw new IllegalStateException("Connection " + connection.getId() + " is already checked out");
            }
            hostPool.getInUse().incrementAndGet();
            log.debug("Checked out connection {} to {}", connection.getId(), host);
            return new ConnectionLease(this, connection);
        } catch (RuntimeException e) {
            globalPermits.release();
            hostPool.getPermits().release();
            throw e;
        }
    }

    /**
     * Return a checked-out connection. Unusable connections are closed instead of pooled.
     *
     * @throws IllegalStateException if the connection is not checked out
     */
    public void release(PooledConnection connection, boolean reusable) {
        if (!connection.checkIn(clock.instant())) {
            throw new IllegalStateException("Connection " + connection.getId() + " released twice");
        }
        HostPool hostPool = hostPool(connection.getHost());
        hostPool.getInUse().decrementAndGet();
        try {
            if (reusable && running) {
                hostPool.getIdle().offerFirst(connection);
                log.debug("Returned connection {} to {}", connection.getId(), connection.getHost());
            } else {
                if (!reusable) {
                    log.warn("Discarding unusable connection {} to {}", connection.getId(), connection.getHost());
                }
                discard(hostPool, connection);
            }
        } finally {
            globalPermits.release();
            hostPool.getPermits().release();
        }
    }

    /**
     * Close every idle connection past its host's idle timeout.
     *
     * @return number of connections closed
     */
    public int reapIdleConnections() {
        Instant now = clock.instant();
        int reaped = 0;
        for (HostPool hostPool : hosts.values()) {
            for (PooledConnection connection : new ArrayList<>(hostPool.getIdle())) {
                if (!isIdleTooLong(hostPool, connection, now)) {
                    continue;
                }
                if (hostPool.getIdle().remove(connection)) {
                    hostPool.getReaped().increment();
                    discard(hostPool, connection);
                    reaped++;
                }
            }
        }
        if (reaped > 0) {
            log.debug("Reaped {} idle connections", reaped);
        }
        return reaped;
    }

    public List<PoolStatistics> statistics() {
        List<PoolStatistics> result = new ArrayList<>();
        hosts.values().stream()
                .sorted(Comparator.comparing(pool -> pool.getHost().toString()))
                .forEach(pool -> result.add(pool.statistics()));
        return result;
    }

    public PoolStatistics statistics(HostKey host) {
        return hostPool(host).statistics();
    }

    /**
     * Connections currently open, idle or checked out.
     */
    public int liveConnections() {
        return liveConnections.get();
    }

    private void acquirePermits(HostPool hostPool, long budget, long deadline) {
        HostKey host = hostPool.getHost();
        try {
            if (!hostPool.getPermits().tryAcquire(budget, TimeUnit.NANOSECONDS)) {
                throw exhausted(hostPool, "No connection to " + host + " available within " + Duration.ofNanos(budget)
                        + " (" + hostPool.getMaxConnections() + " per host in use)");
            }
            long remaining = Math.max(0, deadline - System.nanoTime());
            if (!globalPermits.tryAcquire(remaining, TimeUnit.NANOSECONDS)) {
                hostPool.getPermits().release();
                throw exhausted(hostPool, "No connection to " + host + " available within " + Duration.ofNanos(budget)
                        + " (" + settings.getMaxTotalConnections() + " pool-wide in use)");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PoolExhaustedException(null, "Interrupted while waiting for a connection to " + host, e);
        }
    }

    private PoolExhaustedException exhausted(HostPool hostPool, String message) {
        hostPool.getExhausted().increment();
        log.warn(message);
        return new PoolExhaustedException(null, message);
    }

    private PooledConnection takeIdle(HostPool hostPool) {
        Instant now = clock.instant();
        PooledConnection connection;
        while ((connection = hostPool.getIdle().pollFirst()) != null) {
            if (!isIdleTooLong(hostPool, connection, now)) {
                return connection;
            }
            hostPool.getReaped().increment();
            discard(hostPool, connection);
        }
        return null;
    }

    private PooledConnection create(HostPool hostPool) {
        while (liveConnections.get() >= settings.getMaxTotalConnections()) {
            if (!evictOldestIdle()) {
                break;
            }
        }
        PooledConnection connection = new PooledConnection(
                connectionIds.incrementAndGet(),
                hostPool.getHost(),
                sessionFactory.open(hostPool.getHost()),
                clock.instant());
        liveConnections.incrementAndGet();
        hostPool.getCreated().increment();
        log.debug("Created connection {} to {}", connection.getId(), hostPool.getHost());
        return connection;
    }

    /**
     * Close the least recently used idle connection across all hosts.
     *
     * @return false if there was no idle connection to close
     */
    private boolean evictOldestIdle() {
        while (true) {
            HostPool owner = null;
            PooledConnection oldest = null;
            for (HostPool hostPool : hosts.values()) {
                PooledConnection candidate = hostPool.getIdle().peekLast();
                if (candidate != null && (oldest == null || candidate.getLastUsedAt().isBefore(oldest.getLastUsedAt()))) {
                    oldest = candidate;
                    owner = hostPool;
                }
            }
            if (oldest == null) {
                return false;
            }
            if (owner.getIdle().remove(oldest)) {
                log.debug("Evicting idle connection {} to {} to stay within the pool-wide limit",
                        oldest.getId(), owner.getHost());
                discard(owner, oldest);
                return true;
            }
        }
    }

    private boolean isIdleTooLong(HostPool hostPool, PooledConnection connection, Instant now) {
        return Duration.between(connection.getLastUsedAt(), now).compareTo(hostPool.getIdleTimeout()) >= 0;
    }

    private void discard(HostPool hostPool, PooledConnection connection) {
        liveConnections.decrementAndGet();
        hostPool.getDiscarded().increment();
        connection.close();
    }

    private HostPool hostPool(HostKey host) {
        return hosts.computeIfAbsent(host,
                key -> new HostPool(key, settings.getMaxConnectionsPerHost(), settings.getIdleTimeout()));
    }

    private void runReaper() {
        try {
            reapIdleConnections();
        } catch (RuntimeException e) {
            log.error("Idle connection reaper failed", e);
        }
    }
}
