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

import static org.docdb.driver.internal.logging.DevNullLogging.DEV_NULL_LOGGING;
import static org.docdb.driver.internal.util.ServerDescriptionUtil.A;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.then;
import static org.mockito.Mockito.mock;

import java.time.Clock;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import org.docdb.driver.cluster.ServerDescription;
import org.docdb.driver.cluster.ServerType;
import org.docdb.driver.exceptions.ClientException;
import org.docdb.driver.exceptions.ConnectionAcquisitionTimeoutException;
import org.docdb.driver.exceptions.ServiceUnavailableException;
import org.docdb.driver.internal.metrics.DevNullMetricsListener;
import org.docdb.driver.internal.metrics.MetricsListener;
import org.docdb.driver.internal.spi.Authenticator;
import org.docdb.driver.internal.util.FakeClock;
import org.docdb.driver.internal.util.FakeConnectionFactory;
import org.docdb.driver.internal.util.ServerDescriptionUtil;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

class ConnectionPoolTest {
    private static final long MAX_IDLE_MILLIS = 1_000;

    private final FakeConnectionFactory connectionFactory = new FakeConnectionFactory();
    private final FakeClock clock = new FakeClock();
    private final AtomicReference<ServerDescription> server =
            new AtomicReference<>(ServerDescriptionUtil.server(A, ServerType.STANDALONE).build());

    @Test
    void shouldOpenConnectionWhenNoneIsIdle() {
        var pool = newPool(2, 0);

        var connection = pool.checkout(clock.millis());

        assertEquals(1, pool.size());
        assertEquals(1, pool.inUse());
        assertEquals(0, pool.idle());
        assertEquals(0, connection.generation());
        assertEquals(A, connection.address());
    }

    @Test
    void shouldReuseMostRecentlyUsedConnectionFirst() {
        // GIVEN
        var pool = newPool(3, 0);
        var first = pool.checkout(clock.millis());
        var second = pool.checkout(clock.millis());
        first.close();
        clock.progress(10);
        second.close();

        // WHEN
        var reused = pool.checkout(clock.millis());

        // THEN
        assertSame(second, reused);
        assertEquals(2, pool.size());
        assertEquals(1, pool.idle());
        assertEquals(1, pool.inUse());
    }

    @Test
    void shouldIgnoreRepeatedClose() {
        var pool = newPool(1, 0);
        var connection = pool.checkout(clock.millis());

        connection.close();
        connection.close();

        assertEquals(0, pool.inUse());
        assertEquals(1, pool.idle());
    }

    @Test
    void shouldRejectCommandsOnReturnedConnection() {
        var pool = newPool(1, 0);
        var connection = pool.checkout(clock.millis());
        connection.close();

        assertThrows(IllegalStateException.class, () -> connection.sendCommand(Map.of("ping", 1)));
    }

    @Test
    void shouldTimeOutWhenPoolStaysFull() {
        // GIVEN
        var metricsListener = mock(MetricsListener.class);
        var pool = newPool(1, 0, metricsListener);
        pool.checkout(clock.millis());

        // WHEN
        var error = assertThrows(ConnectionAcquisitionTimeoutException.class, () -> pool.checkout(clock.millis()));

        // THEN
        assertEquals(A, error.address());
        then(metricsListener).should().afterCheckoutTimedOut(pool.id());
        assertEquals(1, pool.size());
    }

    @Test
    void shouldHandOverReturnedConnectionToWaitingCheckout() throws Exception {
        // GIVEN
        var pool = new ConnectionPool(
                A,
                connectionFactory,
                Authenticator.NONE,
                () -> ServerDescription.unknown(A, null),
                new PoolSettings(1, 0, 0, 1_000, 0),
                DevNullMetricsListener.INSTANCE,
                Clock.systemUTC(),
                DEV_NULL_LOGGING);
        var held = pool.checkout(System.currentTimeMillis());

        // WHEN
        var waiting = CompletableFuture.supplyAsync(() -> pool.checkout(System.currentTimeMillis() + 10_000));
        Thread.sleep(50);
        held.close();

        // THEN
        assertSame(held, waiting.get(10, TimeUnit.SECONDS));
        assertEquals(1, pool.size());
    }

    @Test
    void clearShouldBumpGenerationAndDestroyReturnedConnectionsOfOlderGeneration() {
        // GIVEN
        var pool = newPool(2, 0);
        var connection = pool.checkout(clock.millis());

        // WHEN
        pool.clear(ClearCause.NETWORK_ERROR);
        connection.close();

        // THEN
        assertEquals(1, pool.generation());
        assertFalse(connection.isOpen());
        assertEquals(0, pool.size());
        assertEquals(0, pool.idle());
    }

    @Test
    void clearOnNetworkErrorShouldCloseIdleConnectionsImmediately() {
        var pool = newPool(2, 0);
        var connection = pool.checkout(clock.millis());
        connection.close();

        pool.clear(ClearCause.NETWORK_ERROR);

        assertFalse(connection.isOpen());
        assertEquals(0, pool.idle());
        assertEquals(0, pool.size());
    }

    @Test
    void clearOnStateChangeShouldCloseIdleConnectionsLazily() {
        // GIVEN
        var pool = newPool(2, 0);
        var old = pool.checkout(clock.millis());
        old.close();

        // WHEN
        pool.clear(ClearCause.STATE_CHANGE);

        // THEN
        assertTrue(old.isOpen());
        assertEquals(1, pool.idle());

        var fresh = pool.checkout(clock.millis());
        assertNotSame(old, fresh);
        assertFalse(old.isOpen());
        assertEquals(1, fresh.generation());
        assertEquals(1, pool.size());
    }

    @Test
    void shouldNotReuseConnectionClosedByServer() {
        var pool = newPool(2, 0);
        var connection = pool.checkout(clock.millis());
        connection.close();
        connectionFactory.connections().get(0).close();

        var next = pool.checkout(clock.millis());

        assertNotSame(connection, next);
        assertEquals(1, pool.size());
    }

    @Test
    void maintainShouldCloseConnectionsIdleForTooLong() {
        // GIVEN
        var pool = newPool(3, 0);
        var stale = pool.checkout(clock.millis());
        var recent = pool.checkout(clock.millis());
        stale.close();
        clock.progress(MAX_IDLE_MILLIS / 2);
        recent.close();

        // WHEN
        clock.progress(MAX_IDLE_MILLIS / 2 + 1);
        pool.maintain();

        // THEN
        assertFalse(stale.isOpen());
        assertTrue(recent.isOpen());
        assertEquals(1, pool.idle());
        assertEquals(1, pool.size());
    }

    @Test
    void maintainShouldFillPoolToMinimumSize() {
        var pool = newPool(5, 2);

        pool.maintain();

        assertEquals(2, pool.size());
        assertEquals(2, pool.idle());
        assertEquals(2, connectionFactory.openConnections(A));
    }

    @ParameterizedTest
    @EnumSource(
            value = ServerType.class,
            names = {"UNKNOWN", "RS_ARBITER", "RS_GHOST", "RS_OTHER"})
    void maintainShouldNotFillPoolOfServerThatBearsNoData(ServerType type) {
        // GIVEN
        server.set(ServerDescriptionUtil.server(A, type).build());
        var pool = newPool(5, 2);

        // WHEN
        pool.maintain();

        // THEN
        assertEquals(0, pool.size());
        assertEquals(0, connectionFactory.openConnections(A));
    }

    @Test
    void maintainShouldStillCloseIdleConnectionsOfServerThatBearsNoData() {
        // GIVEN
        var pool = newPool(2, 1);
        var connection = pool.checkout(clock.millis());
        connection.close();
        server.set(ServerDescriptionUtil.server(A, ServerType.RS_ARBITER).build());

        // WHEN
        clock.progress(MAX_IDLE_MILLIS + 1);
        pool.maintain();

        // THEN
        assertFalse(connection.isOpen());
        assertEquals(0, pool.size());
    }

    @Test
    void maintainShouldStopFillingWhenServerIsUnreachable() {
        connectionFactory.fail(A);
        var pool = newPool(5, 2);

        pool.maintain();

        assertEquals(0, pool.size());
    }

    @Test
    void shouldReleaseReservationWhenConnectFails() {
        connectionFactory.fail(A);
        var pool = newPool(1, 0);

        assertThrows(ServiceUnavailableException.class, () -> pool.checkout(clock.millis()));

        assertEquals(0, pool.size());
        assertEquals(0, pool.inUse());
    }

    @Test
    void shouldCloseConnectionWhenAuthenticationFails() {
        // GIVEN
        Authenticator authenticator = (connection, server) -> {
            throw new ClientException("Authentication failed");
        };
        var pool = new ConnectionPool(
                A,
                connectionFactory,
                authenticator,
                () -> ServerDescription.unknown(A, null),
                new PoolSettings(1, 0, MAX_IDLE_MILLIS, 1_000, 0),
                DevNullMetricsListener.INSTANCE,
                clock,
                DEV_NULL_LOGGING);

        // WHEN
        assertThrows(ClientException.class, () -> pool.checkout(clock.millis()));

        // THEN
        assertEquals(0, connectionFactory.openConnections(A));
        assertEquals(0, pool.size());
    }

    @Test
    void closeShouldCloseIdleConnectionsAndRejectCheckouts() {
        // GIVEN
        var metricsListener = mock(MetricsListener.class);
        var pool = newPool(2, 0, metricsListener);
        var idle = pool.checkout(clock.millis());
        var inUse = pool.checkout(clock.millis());
        idle.close();

        // WHEN
        pool.close();
        pool.close();

        // THEN
        assertTrue(pool.isClosed());
        assertFalse(idle.isOpen());
        assertTrue(inUse.isOpen());
        assertThrows(IllegalStateException.class, () -> pool.checkout(clock.millis()));
        then(metricsListener).should().removePoolMetrics(pool.id());

        inUse.close();
        assertFalse(inUse.isOpen());
        assertEquals(0, pool.size());
    }

    @Test
    void shouldRegisterPoolMetrics() {
        var metricsListener = mock(MetricsListener.class);

        var pool = newPool(1, 0, metricsListener);

        then(metricsListener).should().registerPoolMetrics(eq(pool.id()), eq(A), any(), any());
    }

    @Test
    void shouldReportConnectionLifecycleToMetrics() {
        // GIVEN
        var metricsListener = mock(MetricsListener.class);
        var pool = newPool(1, 0, metricsListener);

        // WHEN
        pool.checkout(clock.millis()).close();

        // THEN
        then(metricsListener).should().beforeOpening(eq(pool.id()), any());
        then(metricsListener).should().afterOpened(eq(pool.id()), any());
        then(metricsListener).should().afterCheckedOut(eq(pool.id()), any());
        then(metricsListener).should().afterCheckout(anyString());
        then(metricsListener).should().connectionCheckedIn(eq(pool.id()), any());
    }

    private ConnectionPool newPool(int maxSize, int minSize) {
        return newPool(maxSize, minSize, DevNullMetricsListener.INSTANCE);
    }

    private ConnectionPool newPool(int maxSize, int minSize, MetricsListener metricsListener) {
        return new ConnectionPool(
                A,
                connectionFactory,
                Authenticator.NONE,
                server::get,
                new PoolSettings(maxSize, minSize, MAX_IDLE_MILLIS, 1_000, 0),
                metricsListener,
                clock,
                DEV_NULL_LOGGING);
    }
}
