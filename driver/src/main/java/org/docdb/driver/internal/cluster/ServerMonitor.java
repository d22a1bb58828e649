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
package org.docdb.driver.internal.cluster;

import static java.util.concurrent.TimeUnit.MILLISECONDS;
import static org.docdb.driver.internal.util.DaemonThreadFactory.newDaemonThread;
import static org.docdb.driver.internal.util.LockUtil.executeWithLock;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import org.docdb.driver.Logger;
import org.docdb.driver.Logging;
import org.docdb.driver.ServerAddress;
import org.docdb.driver.cluster.ServerDescription;
import org.docdb.driver.cluster.ServerHeartbeatFailedEvent;
import org.docdb.driver.cluster.ServerHeartbeatStartedEvent;
import org.docdb.driver.cluster.ServerHeartbeatSucceededEvent;
import org.docdb.driver.cluster.ServerType;
import org.docdb.driver.internal.logging.PrefixedLogger;
import org.docdb.driver.internal.spi.Connection;
import org.docdb.driver.internal.spi.ConnectionFactory;

/**
 * Periodically checks one server on a dedicated daemon thread and reports what it learned.
 * <p>
 * The monitor owns its heartbeat connection, which is never pooled. The periodic timer and requests for an immediate
 * check share one condition, so a request made while a check is running is honoured right after it, no earlier than
 * the minimum heartbeat interval after the start of the previous check.
 */
public class ServerMonitor {
    static final Map<String, Object> HELLO_COMMAND = Map.of("hello", 1);

    private final ServerAddress address;
    private final ConnectionFactory connectionFactory;
    private final Consumer<ServerDescription> descriptionHandler;
    private final Consumer<Throwable> failureHandler;
    private final ClusterEventPublisher eventPublisher;
    private final Clock clock;
    private final long heartbeatIntervalMillis;
    private final long minHeartbeatIntervalMillis;
    private final int connectTimeoutMillis;
    private final Logger log;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition checkCondition = lock.newCondition();
    private boolean checkRequested;

    private final AtomicBoolean started = new AtomicBoolean();
    private final AtomicBoolean stopped = new AtomicBoolean();
    private final RoundTripTimeAverage roundTripTime = new RoundTripTimeAverage();
    private volatile Connection connection;
    private volatile Thread thread;

    /**
     * @param descriptionHandler receives the description built from every check
     * @param failureHandler invoked on a failed check, before the resulting description is handed over
     */
    public ServerMonitor(
            ServerAddress address,
            ConnectionFactory connectionFactory,
            Consumer<ServerDescription> descriptionHandler,
            Consumer<Throwable> failureHandler,
            ClusterEventPublisher eventPublisher,
            Clock clock,
            long heartbeatIntervalMillis,
            long minHeartbeatIntervalMillis,
            int connectTimeoutMillis,
            Logging logging) {
        this.address = address;
        this.connectionFactory = connectionFactory;
        this.descriptionHandler = descriptionHandler;
        this.failureHandler = failureHandler;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
        this.heartbeatIntervalMillis = heartbeatIntervalMillis;
        this.minHeartbeatIntervalMillis = Math.min(minHeartbeatIntervalMillis, heartbeatIntervalMillis);
        this.connectTimeoutMillis = connectTimeoutMillis;
        this.log = new PrefixedLogger(logging.getLog(getClass()), address.toString());
    }

    public ServerAddress address() {
        return address;
    }

    public void start() {
        if (stopped.get() || !started.compareAndSet(false, true)) {
            return;
        }
        var monitorThread = newDaemonThread("docdb-monitor-" + address, this::run);
        thread = monitorThread;
        monitorThread.start();
        log.debug("Monitor started");
    }

    /**
     * Stop monitoring. An in-flight check is abandoned by closing the heartbeat connection.
     */
    public void stop() {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        executeWithLock(lock, checkCondition::signalAll);
        closeConnection();
        log.debug("Monitor stopped");
    }

    public boolean isStopped() {
        return stopped.get();
    }

    /**
     * Wake the monitor up for a check as soon as the minimum heartbeat interval allows.
     */
    public void requestImmediateCheck() {
        executeWithLock(lock, () -> {
            checkRequested = true;
            checkCondition.signalAll();
        });
    }

    Thread thread() {
        return thread;
    }

    private void run() {
        try {
            while (!stopped.get() && !Thread.currentThread().isInterrupted()) {
                var checkStart = clock.millis();
                var description = check();
                if (stopped.get()) {
                    break;
                }
                try {
                    descriptionHandler.accept(description);
                } catch (RuntimeException e) {
                    log.warn("Failed to apply server description " + description, e);
                }
                waitForNextCheck(checkStart);
            }
        } finally {
            closeConnection();
        }
    }

    ServerDescription check() {
        eventPublisher.publish(listener -> listener.serverHeartbeatStarted(new ServerHeartbeatStartedEvent(address)));
        var start = System.nanoTime();
        try {
            var reply = heartbeatConnection().sendCommand(HELLO_COMMAND);
            var elapsed = Duration.ofNanos(System.nanoTime() - start);
            var hello = HelloResult.parse(reply);
            var average = roundTripTime.add(elapsed);
            eventPublisher.publish(listener ->
                    listener.serverHeartbeatSucceeded(new ServerHeartbeatSucceededEvent(address, elapsed)));
            var description = hello.toServerDescription(address, average, clock.millis());
            if (log.isTraceEnabled()) {
                log.trace("Heartbeat succeeded in %d ms: %s", elapsed.toMillis(), description);
            }
            if (description.type() == ServerType.UNKNOWN) {
                log.debug("Server answered the heartbeat with an error: %s", reply);
            }
            return description;
        } catch (RuntimeException e) {
            var elapsed = Duration.ofNanos(System.nanoTime() - start);
            closeConnection();
            roundTripTime.reset();
            if (stopped.get()) {
                return ServerDescription.unknown(address, e);
            }
            log.debug("Heartbeat failed after %d ms: %s", elapsed.toMillis(), e);
            eventPublisher.publish(listener ->
                    listener.serverHeartbeatFailed(new ServerHeartbeatFailedEvent(address, elapsed, e)));
            try {
                failureHandler.accept(e);
            } catch (RuntimeException handlerError) {
                log.warn("Failed to handle heartbeat failure", handlerError);
            }
            return ServerDescription.builder(address)
                    .type(ServerType.UNKNOWN)
                    .error(e)
                    .lastUpdateTime(clock.millis())
                    .build();
        }
    }

    private Connection heartbeatConnection() {
        var current = connection;
        if (current != null && current.isOpen()) {
            return current;
        }
        var opened = connectionFactory.connect(address, connectTimeoutMillis);
        connection = opened;
        if (stopped.get()) {
            // stop() may have run between connect and assignment
            closeConnection();
        }
        return opened;
    }

    private void waitForNextCheck(long checkStart) {
        lock.lock();
        try {
            while (!stopped.get()) {
                var due = checkRequested
                        ? checkStart + minHeartbeatIntervalMillis
                        : checkStart + heartbeatIntervalMillis;
                var remaining = due - clock.millis();
                if (remaining <= 0) {
                    break;
                }
                checkCondition.await(remaining, MILLISECONDS);
            }
            checkRequested = false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.debug("Monitor thread interrupted, stopping");
        } finally {
            lock.unlock();
        }
    }

    private void closeConnection() {
        var current = connection;
        connection = null;
        if (current != null) {
            try {
                current.close();
            } catch (RuntimeException e) {
                log.warn("Failed to close heartbeat connection", e);
            }
        }
    }
}
