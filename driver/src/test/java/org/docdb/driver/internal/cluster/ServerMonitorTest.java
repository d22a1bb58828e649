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

import static org.docdb.driver.internal.logging.DevNullLogging.DEV_NULL_LOGGING;
import static org.docdb.driver.internal.util.ServerDescriptionUtil.A;
import static org.docdb.driver.internal.util.ServerDescriptionUtil.B;
import static org.docdb.driver.internal.util.ServerDescriptionUtil.SET_NAME;
import static org.docdb.driver.internal.util.TestUtil.awaitCondition;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.then;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import org.docdb.driver.cluster.ClusterListener;
import org.docdb.driver.cluster.ServerDescription;
import org.docdb.driver.cluster.ServerHeartbeatFailedEvent;
import org.docdb.driver.cluster.ServerHeartbeatStartedEvent;
import org.docdb.driver.cluster.ServerHeartbeatSucceededEvent;
import org.docdb.driver.cluster.ServerType;
import org.docdb.driver.exceptions.ServiceUnavailableException;
import org.docdb.driver.internal.util.FakeConnectionFactory;
import org.docdb.driver.internal.util.HelloReplies;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class ServerMonitorTest {
    private final FakeConnectionFactory connectionFactory = new FakeConnectionFactory();
    private final ClusterListener listener = mock(ClusterListener.class);
    private final List<ServerDescription> descriptions = new CopyOnWriteArrayList<>();
    private final List<Throwable> failures = new CopyOnWriteArrayList<>();
    private ServerMonitor monitor;

    @AfterEach
    void tearDown() {
        if (monitor != null) {
            monitor.stop();
        }
    }

    @Test
    void shouldDescribeServerFromHelloReply() {
        // GIVEN
        connectionFactory.reply(A, HelloReplies.secondary(SET_NAME, B, A, B));
        monitor = newMonitor(10_000, 500);

        // WHEN
        var description = monitor.check();

        // THEN
        assertEquals(ServerType.RS_SECONDARY, description.type());
        assertEquals(SET_NAME, description.setName());
        assertEquals(B, description.primary());
        assertNotNull(description.roundTripTime());
        assertNull(description.error());
        then(listener).should().serverHeartbeatStarted(new ServerHeartbeatStartedEvent(A));
        then(listener).should().serverHeartbeatSucceeded(any(ServerHeartbeatSucceededEvent.class));
        assertTrue(failures.isEmpty());
    }

    @Test
    void shouldReuseHeartbeatConnection() {
        connectionFactory.reply(A, HelloReplies.standalone());
        monitor = newMonitor(10_000, 500);

        monitor.check();
        monitor.check();

        assertEquals(1, connectionFactory.connections().size());
        assertEquals(2, connectionFactory.helloCount(A));
    }

    @Test
    void shouldReportUnknownServerAndNotifyFailureHandlerWhenCheckFails() {
        // GIVEN
        var error = new ServiceUnavailableException("Connection refused");
        connectionFactory.fail(A, error);
        monitor = newMonitor(10_000, 500);

        // WHEN
        var description = monitor.check();

        // THEN
        assertEquals(ServerType.UNKNOWN, description.type());
        assertSame(error, description.error());
        assertEquals(List.of(error), failures);
        then(listener).should().serverHeartbeatFailed(any(ServerHeartbeatFailedEvent.class));
        then(listener).should(never()).serverHeartbeatSucceeded(any());
    }

    @Test
    void shouldReconnectAfterFailedCheck() {
        // GIVEN
        connectionFactory.reply(A, HelloReplies.standalone());
        monitor = newMonitor(10_000, 500);
        monitor.check();
        connectionFactory.fail(A);
        monitor.check();

        // WHEN
        connectionFactory.reply(A, HelloReplies.standalone());
        var description = monitor.check();

        // THEN
        assertEquals(ServerType.STANDALONE, description.type());
        assertEquals(2, connectionFactory.connections().size());
        assertFalse(connectionFactory.connections().get(0).isOpen());
    }

    @Test
    void shouldReportUnknownServerWhenHelloReturnsError() {
        var reply = HelloReplies.standalone();
        reply.put("ok", 0.0);
        reply.put("errmsg", "command failed");
        connectionFactory.reply(A, reply);
        monitor = newMonitor(10_000, 500);

        var description = monitor.check();

        assertEquals(ServerType.UNKNOWN, description.type());
        assertTrue(failures.isEmpty());
    }

    @Test
    void shouldCheckPeriodicallyOnceStarted() {
        connectionFactory.reply(A, HelloReplies.standalone());
        monitor = newMonitor(20, 10);

        monitor.start();

        awaitCondition(() -> descriptions.size() >= 3);
        assertEquals(ServerType.STANDALONE, descriptions.get(0).type());
    }

    @Test
    void immediateCheckShouldWakeUpMonitor() {
        // GIVEN
        connectionFactory.reply(A, HelloReplies.standalone());
        monitor = newMonitor(60_000, 10);
        monitor.start();
        awaitCondition(() -> descriptions.size() == 1);

        // WHEN
        monitor.requestImmediateCheck();

        // THEN
        awaitCondition(() -> descriptions.size() == 2);
    }

    @Test
    void immediateCheckShouldNotRunBeforeMinimumHeartbeatInterval() {
        // GIVEN
        var minHeartbeatMillis = 300L;
        var checkStarts = new CopyOnWriteArrayList<Long>();
        var timingListener = new ClusterListener() {
            @Override
            public void serverHeartbeatStarted(ServerHeartbeatStartedEvent event) {
                checkStarts.add(System.currentTimeMillis());
            }
        };
        connectionFactory.reply(A, HelloReplies.standalone());
        monitor = new ServerMonitor(
                A,
                connectionFactory,
                descriptions::add,
                failures::add,
                new ClusterEventPublisher(timingListener, DEV_NULL_LOGGING),
                Clock.systemUTC(),
                60_000,
                minHeartbeatMillis,
                1_000,
                DEV_NULL_LOGGING);
        monitor.start();
        awaitCondition(() -> descriptions.size() == 1);

        // WHEN
        monitor.requestImmediateCheck();
        monitor.requestImmediateCheck();
        monitor.requestImmediateCheck();

        // THEN
        awaitCondition(() -> descriptions.size() == 2);
        var gap = checkStarts.get(1) - checkStarts.get(0);
        assertTrue(gap >= minHeartbeatMillis - 20, "checks were only " + gap + " ms apart");
        assertEquals(2, checkStarts.size());
    }

    @Test
    void stopShouldTerminateMonitorThreadAndCloseConnection() throws InterruptedException {
        // GIVEN
        connectionFactory.reply(A, HelloReplies.standalone());
        monitor = newMonitor(60_000, 10);
        monitor.start();
        awaitCondition(() -> descriptions.size() == 1);

        // WHEN
        monitor.stop();
        monitor.stop();

        // THEN
        monitor.thread().join(10_000);
        assertFalse(monitor.thread().isAlive());
        assertTrue(monitor.isStopped());
        assertEquals(0, connectionFactory.openConnections(A));
    }

    @Test
    void shouldNotStartAfterStop() {
        monitor = newMonitor(10_000, 500);

        monitor.stop();
        monitor.start();

        assertNull(monitor.thread());
    }

    @Test
    void shouldKeepMonitoringWhenDescriptionHandlerFails() {
        // GIVEN
        connectionFactory.reply(A, HelloReplies.standalone());
        var calls = new CopyOnWriteArrayList<ServerDescription>();
        monitor = new ServerMonitor(
                A,
                connectionFactory,
                description -> {
                    calls.add(description);
                    throw new IllegalStateException("boom");
                },
                failures::add,
                new ClusterEventPublisher(listener, DEV_NULL_LOGGING),
                Clock.systemUTC(),
                20,
                10,
                1_000,
                DEV_NULL_LOGGING);

        // WHEN
        monitor.start();

        // THEN
        awaitCondition(() -> calls.size() >= 2);
    }

    @Test
    void failingListenerShouldNotBreakCheck() {
        connectionFactory.reply(A, HelloReplies.standalone());
        var failingListener = new ClusterListener() {
            @Override
            public void serverHeartbeatStarted(ServerHeartbeatStartedEvent event) {
                throw new IllegalStateException("listener failure");
            }
        };
        monitor = new ServerMonitor(
                A,
                connectionFactory,
                descriptions::add,
                failures::add,
                new ClusterEventPublisher(failingListener, DEV_NULL_LOGGING),
                Clock.systemUTC(),
                10_000,
                500,
                1_000,
                DEV_NULL_LOGGING);

        var description = monitor.check();

        assertInstanceOf(ServerDescription.class, description);
        assertEquals(ServerType.STANDALONE, description.type());
    }

    private ServerMonitor newMonitor(long heartbeatMillis, long minHeartbeatMillis) {
        return new ServerMonitor(
                A,
                connectionFactory,
                descriptions::add,
                failures::add,
                new ClusterEventPublisher(listener, DEV_NULL_LOGGING),
                Clock.systemUTC(),
                heartbeatMillis,
                minHeartbeatMillis,
                1_000,
                DEV_NULL_LOGGING);
    }
}
