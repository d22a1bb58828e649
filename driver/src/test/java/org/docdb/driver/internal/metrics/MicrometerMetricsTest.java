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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.docdb.driver.ConnectionPoolMetrics;
import org.docdb.driver.ServerAddress;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class MicrometerMetricsTest {
    private static final String POOL_ID = "db1:27017-1";

    private MeterRegistry registry;
    private MicrometerMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new MicrometerMetrics(registry);
    }

    @Test
    void shouldExposeRegisteredPools() {
        metrics.registerPoolMetrics(POOL_ID, new ServerAddress("db1", 27017), () -> 2, () -> 5);

        var pools = metrics.connectionPoolMetrics();

        assertEquals(1, pools.size());
        ConnectionPoolMetrics pool = pools.iterator().next();
        assertEquals(POOL_ID, pool.id());
        assertEquals(2, pool.inUse());
        assertEquals(5, pool.idle());
    }

    @Test
    void shouldDelegateEventsToPoolMetrics() {
        // GIVEN
        metrics.registerPoolMetrics(POOL_ID, new ServerAddress("db1", 27017), () -> 0, () -> 0);
        var checkoutEvent = metrics.createListenerEvent();
        var openEvent = metrics.createListenerEvent();

        // WHEN
        metrics.beforeCheckout(POOL_ID, checkoutEvent);
        metrics.beforeOpening(POOL_ID, openEvent);
        metrics.afterOpened(POOL_ID, openEvent);
        metrics.afterCheckedOut(POOL_ID, checkoutEvent);
        metrics.afterCheckout(POOL_ID);

        // THEN
        var pool = metrics.connectionPoolMetrics().iterator().next();
        assertEquals(1, pool.created());
        assertEquals(1, pool.acquired());
        assertEquals(0, pool.acquiring());
    }

    @Test
    void shouldIgnoreEventsOfUnknownPools() {
        metrics.afterDestroyed("unknown");
        metrics.afterFailedToOpen("unknown");

        assertTrue(metrics.connectionPoolMetrics().isEmpty());
    }

    @Test
    void shouldRemovePoolAndItsMeters() {
        metrics.registerPoolMetrics(POOL_ID, new ServerAddress("db1", 27017), () -> 0, () -> 0);

        metrics.removePoolMetrics(POOL_ID);
        metrics.removePoolMetrics(POOL_ID);

        assertTrue(metrics.connectionPoolMetrics().isEmpty());
        assertTrue(registry.find(MicrometerConnectionPoolMetrics.IN_USE).meters().isEmpty());
    }

    @Test
    void shouldCreateTimerEvents() {
        assertInstanceOf(MicrometerTimerListenerEvent.class, metrics.createListenerEvent());
    }
}
