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

import static java.lang.String.format;
import static java.util.concurrent.TimeUnit.MILLISECONDS;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import org.docdb.driver.Config;
import org.docdb.driver.Logger;
import org.docdb.driver.Logging;
import org.docdb.driver.Metrics;
import org.docdb.driver.ReadPreference;
import org.docdb.driver.ServerAddress;
import org.docdb.driver.cluster.ServerDescription;
import org.docdb.driver.cluster.ServerDescriptionChangedEvent;
import org.docdb.driver.cluster.ServerType;
import org.docdb.driver.cluster.TopologyDescription;
import org.docdb.driver.cluster.TopologyDescriptionChangedEvent;
import org.docdb.driver.cluster.TopologyType;
import org.docdb.driver.exceptions.DriverException;
import org.docdb.driver.exceptions.IncompatibleClusterException;
import org.docdb.driver.exceptions.ServerSelectionTimeoutException;
import org.docdb.driver.exceptions.ServiceUnavailableException;
import org.docdb.driver.internal.cluster.loadbalancing.LeastConnectedLoadBalancingStrategy;
import org.docdb.driver.internal.cluster.loadbalancing.LoadBalancingStrategy;
import org.docdb.driver.internal.cluster.selection.CompositeServerSelector;
import org.docdb.driver.internal.cluster.selection.LatencyMinimizingServerSelector;
import org.docdb.driver.internal.cluster.selection.ReadPreferenceServerSelector;
import org.docdb.driver.internal.cluster.selection.ServerSelector;
import org.docdb.driver.internal.cluster.selection.WritableServerSelector;
import org.docdb.driver.internal.metrics.MetricsProvider;
import org.docdb.driver.internal.pool.ClearCause;
import org.docdb.driver.internal.pool.ConnectionPool;
import org.docdb.driver.internal.pool.PoolSettings;
import org.docdb.driver.internal.spi.Authenticator;
import org.docdb.driver.internal.spi.ConnectionFactory;
import org.docdb.driver.internal.util.Preconditions;

/**
 * Owns the topology, one monitor and one pool per tracked server, and a scheduler for pool maintenance.
 * <p>
 * Monitors report to {@link #onServerDescription(ServerDescription)}. Every report is applied and the resulting
 * membership change is reconciled under one lock: monitors and pools are started for new members and stopped for
 * removed ones, listeners are notified, and threads waiting in server selection are woken up. Stopping monitors and
 * closing pools happens after the lock is released.
 */
public class ClusterImpl implements Cluster {
    private final Config config;
    private final Topology topology;
    private final ConnectionFactory connectionFactory;
    private final Authenticator authenticator;
    private final MetricsProvider metricsProvider;
    private final ClusterEventPublisher eventPublisher;
    private final ScheduledExecutorService maintenanceExecutor;
    private final LoadBalancingStrategy loadBalancingStrategy;
    private final PoolSettings poolSettings;
    private final Clock clock;
    private final Logging logging;
    private final Logger log;

    private final ReentrantLock stateLock = new ReentrantLock();
    private final Condition topologyChanged = stateLock.newCondition();
    private final Map<ServerAddress, ServerMonitor> monitors = new HashMap<>();
    private final Map<ServerAddress, ConnectionPool> pools = new ConcurrentHashMap<>();
    private final AtomicBoolean closed = new AtomicBoolean();

    private final ServerSelector writableSelector;

    public ClusterImpl(
            Topology topology,
            Config config,
            ConnectionFactory connectionFactory,
            Authenticator authenticator,
            MetricsProvider metricsProvider,
            ScheduledExecutorService maintenanceExecutor,
            Clock clock) {
        this.config = config;
        this.topology = topology;
        this.connectionFactory = connectionFactory;
        this.authenticator = authenticator;
        this.metricsProvider = metricsProvider;
        this.maintenanceExecutor = maintenanceExecutor;
        this.clock = clock;
        this.logging = config.logging();
        this.log = logging.getLog(getClass());
        this.eventPublisher = new ClusterEventPublisher(config.clusterListener(), logging);
        this.poolSettings = PoolSettings.from(config);
        this.loadBalancingStrategy = new LeastConnectedLoadBalancingStrategy(this::inUseConnections, logging);
        this.writableSelector = new CompositeServerSelector(List.of(
                WritableServerSelector.INSTANCE,
                new LatencyMinimizingServerSelector(config.localThresholdMillis())));
    }

    /**
     * Create pools and start monitors for the initial members and schedule pool maintenance.
     */
    public void start() {
        var initial = topology.description();
        stateLock.lock();
        try {
            for (var server : initial.servers()) {
                addServer(server.address(), initial.type());
            }
        } finally {
            stateLock.unlock();
        }
        var interval = config.maintenanceIntervalMillis();
        maintenanceExecutor.scheduleWithFixedDelay(this::maintainPools, interval, interval, MILLISECONDS);
        log.info("Cluster created with topology %s", initial.shortDescription());
    }

    @Override
    public ServerConnection selectServer(ReadPreference readPreference) {
        var selector = new CompositeServerSelector(List.of(
                new ReadPreferenceServerSelector(
                        readPreference, config.heartbeatIntervalMillis(), config.stalenessCorrectionMillis()),
                new LatencyMinimizingServerSelector(config.localThresholdMillis())));
        return selectServer(selector, config.serverSelectionTimeoutMillis(), false);
    }

    @Override
    public ServerConnection selectWritableServer() {
        return selectServer(writableSelector, config.serverSelectionTimeoutMillis(), true);
    }

    @Override
    public ServerConnection selectServer(ServerSelector selector, long timeoutMillis) {
        return selectServer(selector, timeoutMillis, selector == WritableServerSelector.INSTANCE);
    }

    private ServerConnection selectServer(ServerSelector selector, long timeoutMillis, boolean write) {
        Preconditions.checkArgument(timeoutMillis >= 0, "Server selection timeout must not be negative");
        var deadline = clock.millis() + timeoutMillis;
        while (true) {
            checkNotClosed();
            var snapshot = topology.description();
            if (snapshot.compatibilityError() != null) {
                throw new IncompatibleClusterException(snapshot.compatibilityError());
            }

            var candidates = new ArrayList<>(selector.select(snapshot));
            if (!candidates.isEmpty()) {
                Collections.shuffle(candidates);
                var connection = connect(candidates, snapshot, deadline, write);
                if (connection != null) {
                    return connection;
                }
                continue;
            }

            stateLock.lock();
            try {
                if (topology.description() != snapshot || closed.get()) {
                    continue;
                }
                var remaining = deadline - clock.millis();
                if (remaining <= 0) {
                    throw new ServerSelectionTimeoutException(
                            format(
                                    "Timed out after %d ms while waiting for a server that matches %s. "
                                            + "Client view of cluster state is %s",
                                    timeoutMillis, selector, snapshot.shortDescription()),
                            snapshot);
                }
                requestImmediateCheck();
                topologyChanged.await(remaining, MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new DriverException("Interrupted while waiting for a server that matches " + selector, e);
            } finally {
                stateLock.unlock();
            }
        }
    }

    private ServerConnection connect(
            List<ServerDescription> candidates, TopologyDescription snapshot, long deadline, boolean write) {
        var address = loadBalancingStrategy.pick(candidates, write).address();
        var pool = pools.get(address);
        if (pool == null) {
            // removed since the snapshot was taken
            return null;
        }
        try {
            var pooled = pool.checkout(deadline);
            return new ServerConnection(pooled, snapshot.server(address), this::handleCommandError);
        } catch (IllegalStateException e) {
            log.debug("Pool of %s was closed during server selection", address);
            return null;
        } catch (ServiceUnavailableException e) {
            markServerUnknown(address, e);
            throw e;
        }
    }

    @Override
    public void markServerUnknown(ServerAddress address, Throwable error) {
        if (closed.get()) {
            return;
        }
        log.debug("Marking server %s unknown: %s", address, error);
        onServerDescription(ServerDescription.builder(address)
                .type(ServerType.UNKNOWN)
                .error(error)
                .lastUpdateTime(clock.millis())
                .build());
        var cause = ServerErrors.clearCause(error);
        clearPool(address, cause != null ? cause : ClearCause.NETWORK_ERROR);
        ServerMonitor monitor;
        stateLock.lock();
        try {
            monitor = monitors.get(address);
        } finally {
            stateLock.unlock();
        }
        if (monitor != null) {
            monitor.requestImmediateCheck();
        }
    }

    @Override
    public void handleCommandError(ServerAddress address, int generation, Throwable error) {
        if (ServerErrors.clearCause(error) == null) {
            return;
        }
        var pool = pools.get(address);
        if (pool == null) {
            return;
        }
        if (generation < pool.generation()) {
            log.debug(
                    "Ignoring error from %s on a connection of generation %d, the pool is at generation %d: %s",
                    address, generation, pool.generation(), error);
            return;
        }
        markServerUnknown(address, error);
    }

    @Override
    public TopologyDescription currentTopology() {
        return topology.description();
    }

    @Override
    public Metrics metrics() {
        return metricsProvider.metrics();
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        List<ServerMonitor> monitorsToStop;
        List<ConnectionPool> poolsToClose;
        stateLock.lock();
        try {
            monitorsToStop = new ArrayList<>(monitors.values());
            poolsToClose = new ArrayList<>(pools.values());
            monitors.clear();
            pools.clear();
            topologyChanged.signalAll();
        } finally {
            stateLock.unlock();
        }
        monitorsToStop.forEach(ServerMonitor::stop);
        poolsToClose.forEach(ConnectionPool::close);
        maintenanceExecutor.shutdownNow();
        log.info("Cluster closed");
    }

    /**
     * Apply a server report and reconcile monitors, pools and waiters with the result.
     *
     * @param description the report
     */
    void onServerDescription(ServerDescription description) {
        var cleanup = new ArrayList<Runnable>();
        stateLock.lock();
        try {
            if (closed.get()) {
                return;
            }
            var previous = topology.description();
            var current = topology.apply(description);
            if (current == previous) {
                return;
            }
            reconcile(previous, current, cleanup);
            publishEvents(previous, current);
            topologyChanged.signalAll();
        } finally {
            stateLock.unlock();
        }
        cleanup.forEach(Runnable::run);
    }

    private void reconcile(TopologyDescription previous, TopologyDescription current, List<Runnable> cleanup) {
        for (var address : current.addresses()) {
            if (!pools.containsKey(address)) {
                addServer(address, current.type());
            }
        }
        for (var address : new ArrayList<>(pools.keySet())) {
            if (!current.contains(address)) {
                var pool = pools.remove(address);
                var monitor = monitors.remove(address);
                log.debug("Server %s left the topology", address);
                if (monitor != null) {
                    cleanup.add(monitor::stop);
                }
                cleanup.add(pool::close);
            }
        }
        for (var server : current.servers()) {
            var before = previous.server(server.address());
            if (before == null) {
                continue;
            }
            var pool = pools.get(server.address());
            if (before.type().isDataBearing() && server.type() == ServerType.UNKNOWN) {
                cleanup.add(() -> pool.clear(ClearCause.STATE_CHANGE));
            } else if (!before.type().isDataBearing() && server.type().isDataBearing() && poolSettings.minSize() > 0) {
                cleanup.add(() -> maintenanceExecutor.execute(() -> maintain(pool)));
            }
        }
    }

    private void addServer(ServerAddress address, TopologyType topologyType) {
        var pool = new ConnectionPool(
                address,
                connectionFactory,
                authenticator,
                () -> serverDescription(address),
                poolSettings,
                metricsProvider.metricsListener(),
                clock,
                logging);
        pools.put(address, pool);
        if (topologyType == TopologyType.LOAD_BALANCED) {
            return;
        }
        var monitor = new ServerMonitor(
                address,
                connectionFactory,
                this::onServerDescription,
                error -> clearPool(address, ClearCause.HEARTBEAT_FAILURE),
                eventPublisher,
                clock,
                config.heartbeatIntervalMillis(),
                config.minHeartbeatIntervalMillis(),
                config.connectTimeoutMillis(),
                logging);
        monitors.put(address, monitor);
        monitor.start();
        log.debug("Server %s joined the topology", address);
    }

    private void publishEvents(TopologyDescription previous, TopologyDescription current) {
        var changed = previous.type() != current.type() || !previous.addresses().equals(current.addresses());
        for (var server : current.servers()) {
            var before = previous.server(server.address());
            if (before != null && !before.equals(server)) {
                changed = true;
                eventPublisher.publish(listener -> listener.serverDescriptionChanged(
                        new ServerDescriptionChangedEvent(server.address(), before, server)));
            }
        }
        if (changed) {
            if (log.isDebugEnabled()) {
                log.debug("Topology changed to %s", current.shortDescription());
            }
            eventPublisher.publish(listener ->
                    listener.topologyDescriptionChanged(new TopologyDescriptionChangedEvent(previous, current)));
        }
    }

    private ServerDescription serverDescription(ServerAddress address) {
        var description = topology.description().server(address);
        return description != null ? description : ServerDescription.unknown(address, null);
    }

    private void clearPool(ServerAddress address, ClearCause cause) {
        var pool = pools.get(address);
        if (pool != null) {
            pool.clear(cause);
        }
    }

    private void requestImmediateCheck() {
        for (var monitor : monitors.values()) {
            monitor.requestImmediateCheck();
        }
    }

    private int inUseConnections(ServerAddress address) {
        var pool = pools.get(address);
        return pool == null ? 0 : pool.inUse();
    }

    private void maintainPools() {
        for (var pool : pools.values()) {
            maintain(pool);
        }
    }

    private void maintain(ConnectionPool pool) {
        try {
            pool.maintain();
        } catch (RuntimeException e) {
            log.warn("Maintenance of connection pool " + pool.id() + " failed", e);
        }
    }

    private void checkNotClosed() {
        if (closed.get()) {
            throw new IllegalStateException("Cluster is closed");
        }
    }
}
