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
package org.docdb.driver.internal.metrics;

import io.micrometer.core.instrument.MeterRegistry;
import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;
import java.util.function.IntSupplier;
import org.docdb.driver.ConnectionPoolMetrics;
import org.docdb.driver.Metrics;
import org.docdb.driver.ServerAddress;

/**
 * Routes the events of every pool of a cluster to the meters of that pool. Events of pools that were never
 * registered, or already removed, are dropped.
 */
final class MicrometerMetrics implements Metrics, MetricsListener {
    private final MeterRegistry registry;
    private final Map<String, MicrometerConnectionPoolMetrics> pools = new ConcurrentHashMap<>();

    MicrometerMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    @Override
    public Collection<ConnectionPoolMetrics> connectionPoolMetrics() {
        return Collections.unmodifiableCollection(pools.values());
    }

    @Override
    public void registerPoolMetrics(
            String poolId, ServerAddress address, IntSupplier inUseSupplier, IntSupplier idleSupplier) {
        pools.put(poolId, new MicrometerConnectionPoolMetrics(poolId, address, inUseSupplier, idleSupplier, registry));
    }

    @Override
    public void removePoolMetrics(String poolId) {
        var removed = pools.remove(poolId);
        if (removed != null) {
            removed.unregister();
        }
    }

    @Override
    public ListenerEvent<?> createListenerEvent() {
        return new MicrometerTimerListenerEvent(registry);
    }

    @Override
    public void beforeOpening(String poolId, ListenerEvent<?> openEvent) {
        forPool(poolId, pool -> pool.beforeOpening(openEvent));
    }

    @Override
    public void afterOpened(String poolId, ListenerEvent<?> openEvent) {
        forPool(poolId, pool -> pool.afterOpened(openEvent));
    }

    @Override
    public void afterFailedToOpen(String poolId) {
        forPool(poolId, ConnectionPoolMetricsListener::afterFailedToOpen);
    }

    @Override
    public void afterDestroyed(String poolId) {
        forPool(poolId, ConnectionPoolMetricsListener::afterDestroyed);
    }

    @Override
    public void beforeCheckout(String poolId, ListenerEvent<?> checkoutEvent) {
        forPool(poolId, pool -> pool.beforeCheckout(checkoutEvent));
    }

    @Override
    public void afterCheckout(String poolId) {
        forPool(poolId, ConnectionPoolMetricsListener::afterCheckout);
    }

    @Override
    public void afterCheckedOut(String poolId, ListenerEvent<?> checkoutEvent) {
        forPool(poolId, pool -> pool.afterCheckedOut(checkoutEvent));
    }

    @Override
    public void afterCheckoutTimedOut(String poolId) {
        forPool(poolId, ConnectionPoolMetricsListener::afterCheckoutTimedOut);
    }

    @Override
    public void connectionCheckedOut(String poolId, ListenerEvent<?> inUseEvent) {
        forPool(poolId, pool -> pool.connectionCheckedOut(inUseEvent));
    }

    @Override
    public void connectionCheckedIn(String poolId, ListenerEvent<?> inUseEvent) {
        forPool(poolId, pool -> pool.connectionCheckedIn(inUseEvent));
    }

    private void forPool(String poolId, Consumer<ConnectionPoolMetricsListener> event) {
        var pool = pools.get(poolId);
        if (pool != null) {
            event.accept(pool);
        }
    }
}
