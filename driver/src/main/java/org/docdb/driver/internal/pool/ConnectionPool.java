/*
 * Copyright (c) "Neo4j"
 * Neo4j Sweden AB [https://neo4j.com]
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.docdb.driver.internal.pool;

import static java.lang.String.format;
import static java.util.concurrent.TimeUnit.MILLISECONDS;
import static org.docdb.driver.internal.util.LockUtil.executeWithLock;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import org.docdb.driver.Logger;
import org.docdb.driver.Logging;
import org.docdb.driver.ServerAddress;
import org.docdb.driver.cluster.ServerDescription;
import org.docdb.driver.exceptions.ConnectionAcquisitionTimeoutException;
import org.docdb.driver.exceptions.DriverException;
import org.docdb.driver.internal.logging.PrefixedLogger;
import org.docdb.driver.internal.metrics.MetricsListener;
import org.docdb.driver.internal.spi.Authenticator;
import org.docdb.driver.internal.spi.Connection;
import org.docdb.driver.internal.spi.ConnectionFactory;

/**
 * Connections to a single server.
 * <p>
 * Idle connections are handed out most recently used first. Every connection is stamped with the pool generation in
 * effect when it was opened, {@link #clear(ClearCause)} bumps the generation so that all older connections are
 * destroyed instead of reused. Connections are opened and closed outside the pool lock.
 */
public class ConnectionPool {
    private final ServerAddress address;
    private final String id;
    private final ConnectionFactory connectionFactory;
    private final Authenticator authenticator;
    private final Supplier<ServerDescription> serverDescription;
    private final PoolSettings settings;
    private final MetricsListener metricsListener;
    private final Clock clock;
    private final Logger log;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition available = lock.newCondition();
    private final Deque<PooledConnection> idle = new ArrayDeque<>();
    private int total;
    private int inUse;
    private boolean closed;
    private volatile int generation;

    public ConnectionPool(
            ServerAddress address,
            ConnectionFactory connectionFactory,
            Authenticator authenticator,
            Supplier<ServerDescription> serverDescription,
            PoolSettings settings,
            MetricsListener metricsListener,
            Clock clock,
            Logging logging) {
        this.address = address;
        this.id = format("%s:%d-%d", address.host(), address.port(), hashCode());
        this.connectionFactory = connectionFactory;
        this.authenticator = authenticator;
        this.serverDescription = serverDescription;
        this.settings = settings;
        this.metricsListener = metricsListener;
        this.clock = clock;
        this.log = new PrefixedLogger(logging.getLog(getClass()), address.toString());
        metricsListener.registerPoolMetrics(id, address, this::inUse, this::idle);
    }

    public ServerAddress address() {
        return address;
    }

    public String id() {
        return id;
    }

    public int generation() {
        return generation;
    }

    public int inUse() {
        return executeWithLock(lock, () -> inUse);
    }

    public int idle() {
        return executeWithLock(lock, idle::size);
    }

    /**
     * @return open connections, idle or in use, plus those currently being opened
     */
    public int size() {
        return executeWithLock(lock, () -> total);
    }

    public boolean isClosed() {
        return executeWithLock(lock, () -> closed);
    }

    /**
     * Take a connection out of the pool, opening a new one if none is idle and the pool is not full.
     *
     * @param deadlineMillis clock time after which waiting for a connection is abandoned
     * @return a connection of the current generation
     * @throws ConnectionAcquisitionTimeoutException when the pool stays full until the deadline
     * @throws IllegalStateException when the pool is closed
     */
    public PooledConnection checkout(long deadlineMillis) {
        var startMillis = clock.millis();
        var checkoutEvent = metricsListener.createListenerEvent();
        metricsListener.beforeCheckout(id, checkoutEvent);
        try {
            while (true) {
                PooledConnection pooled = null;
                PooledConnection perished = null;
                var reservedGeneration = -1;

                lock.lock();
                try {
                    checkNotClosed();
                    var candidate = idle.pollFirst();
                    if (candidate != null) {
                        if (isPerished(candidate, clock.millis())) {
                            total--;
                            perished = candidate;
                        } else {
                            inUse++;
                            pooled = candidate;
                        }
                    } else if (total < settings.maxSize()) {
                        total++;
                        reservedGeneration = generation;
                    } else {
                        var remaining = deadlineMillis - clock.millis();
                        if (remaining <= 0) {
                            metricsListener.afterCheckoutTimedOut(id);
                            throw new ConnectionAcquisitionTimeoutException(
                                    address, Math.max(0, deadlineMillis - startMillis));
                        }
                        available.await(remaining, MILLISECONDS);
                        continue;
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new DriverException("Interrupted while waiting for a connection to " + address, e);
                } finally {
                    lock.unlock();
                }

                if (perished != null) {
                    destroy(perished, "perished while idle");
                    continue;
                }
                if (pooled == null) {
                    pooled = openReserved(reservedGeneration);
                    if (pooled == null) {
                        continue;
                    }
                }
                pooled.markCheckedOut();
                metricsListener.afterCheckedOut(id, checkoutEvent);
                metricsListener.connectionCheckedOut(id, pooled.inUseEvent());
                return pooled;
            }
        } finally {
            metricsListener.afterCheckout(id);
        }
    }

    /**
     * Return a connection. Healthy connections of the current generation become the most recently used idle
     * connection, all others are destroyed.
     *
     * @param connection the connection
     */
    void checkin(PooledConnection connection) {
        boolean reusable;
        lock.lock();
        try {
            inUse--;
            reusable = !closed && connection.isOpen() && connection.generation() == generation;
            if (reusable) {
                connection.touch(clock.millis());
                idle.addFirst(connection);
            } else {
                total--;
            }
            available.signalAll();
        } finally {
            lock.unlock();
        }
        metricsListener.connectionCheckedIn(id, connection.inUseEvent());
        if (!reusable) {
            destroy(connection, "returned to the pool unusable");
        }
    }

    /**
     * Invalidate all current connections by bumping the generation.
     *
     * @param cause why the pool is cleared, decides whether idle connections are closed now or on next use
     */
    public void clear(ClearCause cause) {
        List<PooledConnection> toClose = List.of();
        lock.lock();
        try {
            if (closed) {
                return;
            }
            generation++;
            if (cause.closesIdleConnections()) {
                toClose = new ArrayList<>(idle);
                total -= idle.size();
                idle.clear();
            }
            available.signalAll();
        } finally {
            lock.unlock();
        }
        log.debug("Pool cleared, cause %s, generation is now %d", cause, generation);
        for (var connection : toClose) {
            destroy(connection, "pool cleared");
        }
    }

    /**
     * Close idle connections that are past the maximum idle time, least recently used first, then open connections
     * until the pool holds its minimum size. The pool is only filled while the server is known to bear data.
     */
    public void maintain() {
        var expired = new ArrayList<PooledConnection>();
        lock.lock();
        try {
            if (closed) {
                return;
            }
            var now = clock.millis();
            var iterator = idle.descendingIterator();
            while (iterator.hasNext()) {
                var connection = iterator.next();
                if (isPerished(connection, now)) {
                    iterator.remove();
                    total--;
                    expired.add(connection);
                }
            }
        } finally {
            lock.unlock();
        }
        for (var connection : expired) {
            destroy(connection, "expired while idle");
        }
        var serverType = serverDescription.get().type();
        if (!serverType.isDataBearing()) {
            log.trace("Not filling pool, server is %s", serverType);
            return;
        }
        ensureMinSize();
    }

    /**
     * Close idle connections and reject further checkouts. Connections in use are destroyed when returned.
     */
    public void close() {
        List<PooledConnection> toClose;
        lock.lock();
        try {
            if (closed) {
                return;
            }
            closed = true;
            toClose = new ArrayList<>(idle);
            total -= idle.size();
            idle.clear();
            available.signalAll();
        } finally {
            lock.unlock();
        }
        for (var connection : toClose) {
            destroy(connection, "pool closed");
        }
        metricsListener.removePoolMetrics(id);
        log.debug("Pool closed");
    }

    private void ensureMinSize() {
        while (true) {
            int reservedGeneration;
            lock.lock();
            try {
                if (closed || total >= settings.minSize()) {
                    return;
                }
                total++;
                reservedGeneration = generation;
            } finally {
                lock.unlock();
            }

            PooledConnection connection;
            try {
                connection = openReservedForIdle(reservedGeneration);
            } catch (RuntimeException e) {
                log.debug("Failed to open a connection to keep the minimum pool size: %s", e);
                return;
            }
            if (connection == null) {
                return;
            }
        }
    }

    private PooledConnection openReservedForIdle(int reservedGeneration) {
        var connection = open(reservedGeneration);
        boolean added;
        lock.lock();
        try {
            added = !closed && reservedGeneration == generation;
            if (added) {
                idle.addFirst(connection);
                available.signalAll();
            } else {
                total--;
            }
        } finally {
            lock.unlock();
        }
        if (!added) {
            destroy(connection, "pool cleared while the connection was opened");
            return null;
        }
        return connection;
    }

    /**
     * @return the new connection, {@code null} when the pool was cleared or closed while it was opened
     */
    private PooledConnection openReserved(int reservedGeneration) {
        var connection = open(reservedGeneration);
        boolean stale;
        lock.lock();
        try {
            stale = closed || reservedGeneration != generation;
            if (stale) {
                total--;
                available.signalAll();
            } else {
                inUse++;
            }
        } finally {
            lock.unlock();
        }
        if (stale) {
            destroy(connection, "pool cleared while the connection was opened");
            return null;
        }
        return connection;
    }

    private PooledConnection open(int reservedGeneration) {
        var openEvent = metricsListener.createListenerEvent();
        metricsListener.beforeOpening(id, openEvent);
        Connection connection = null;
        try {
            connection = connectionFactory.connect(
                    address, settings.connectTimeoutMillis(), settings.socketTimeoutMillis());
            authenticator.authenticate(connection, serverDescription.get());
            metricsListener.afterOpened(id, openEvent);
            log.trace("Opened connection of generation %d", reservedGeneration);
            return new PooledConnection(
                    this, connection, reservedGeneration, clock.millis(), metricsListener.createListenerEvent());
        } catch (RuntimeException e) {
            metricsListener.afterFailedToOpen(id);
            if (connection != null) {
                closeQuietly(connection);
            }
            executeWithLock(lock, () -> {
                total--;
                available.signalAll();
            });
            throw e;
        }
    }

    private boolean isPerished(PooledConnection connection, long nowMillis) {
        if (connection.generation() != generation || !connection.isOpen()) {
            return true;
        }
        return settings.idleTimeoutEnabled() && nowMillis - connection.lastUsedMillis() > settings.maxIdleTimeMillis();
    }

    private void destroy(PooledConnection connection, String reason) {
        if (log.isTraceEnabled()) {
            log.trace("Closing %s, %s", connection, reason);
        }
        try {
            connection.closeDelegate();
        } catch (RuntimeException e) {
            log.warn("Failed to close " + connection, e);
        }
        metricsListener.afterDestroyed(id);
    }

    private void closeQuietly(Connection connection) {
        try {
            connection.close();
        } catch (RuntimeException e) {
            log.warn("Failed to close connection after a failed handshake", e);
        }
    }

    private void checkNotClosed() {
        if (closed) {
            throw new IllegalStateException(format("Connection pool for %s is closed", address));
        }
    }
}
