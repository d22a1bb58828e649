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
package org.docdb.driver.internal.cluster.loadbalancing;

import static org.docdb.driver.internal.logging.DevNullLogging.DEV_NULL_LOGGING;
import static org.docdb.driver.internal.util.ServerDescriptionUtil.A;
import static org.docdb.driver.internal.util.ServerDescriptionUtil.B;
import static org.docdb.driver.internal.util.ServerDescriptionUtil.C;
import static org.docdb.driver.internal.util.ServerDescriptionUtil.secondary;
import static org.docdb.driver.internal.util.ServerDescriptionUtil.server;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.startsWith;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.then;
import static org.mockito.Mockito.mock;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import org.docdb.driver.Logger;
import org.docdb.driver.Logging;
import org.docdb.driver.ServerAddress;
import org.docdb.driver.cluster.ServerDescription;
import org.docdb.driver.cluster.ServerType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class LeastConnectedLoadBalancingStrategyTest {
    private final Map<ServerAddress, Integer> checkedOut = new HashMap<>();
    private final ServerDescription a = secondary(A, A, B, C);
    private final ServerDescription b = secondary(B, A, B, C);
    private final ServerDescription c = secondary(C, A, B, C);
    private LeastConnectedLoadBalancingStrategy strategy;

    @BeforeEach
    void setUp() {
        strategy = new LeastConnectedLoadBalancingStrategy(this::checkedOutCount, DEV_NULL_LOGGING);
    }

    @Test
    void shouldPickNothingWithoutCandidates() {
        assertNull(strategy.pick(List.of(), false));
        assertNull(strategy.pick(List.of(), true));
    }

    @Test
    void shouldPickOnlyCandidateHoweverBusy() {
        checkedOut.put(A, 42);

        assertSame(a, strategy.pick(List.of(a), false));
        assertSame(a, strategy.pick(List.of(a), true));
    }

    @Test
    void shouldPickLeastBusyServer() {
        checkedOut.put(A, 3);
        checkedOut.put(B, 4);
        checkedOut.put(C, 1);

        assertSame(c, strategy.pick(List.of(a, b, c), false));
        assertSame(c, strategy.pick(List.of(a, b, c), true));
    }

    @Test
    void shouldTakeTurnsBetweenEquallyBusyServers() {
        var candidates = List.of(a, b, c);

        assertSame(a, strategy.pick(candidates, false));
        assertSame(b, strategy.pick(candidates, false));
        assertSame(c, strategy.pick(candidates, false));
        assertSame(a, strategy.pick(candidates, false));
    }

    @Test
    void shouldRotateReadsAndWritesIndependently() {
        var router1 = server(A, ServerType.MONGOS).build();
        var router2 = server(B, ServerType.MONGOS).build();
        var candidates = List.of(router1, router2);

        assertSame(router1, strategy.pick(candidates, false));
        assertSame(router1, strategy.pick(candidates, true));
        assertSame(router2, strategy.pick(candidates, false));
        assertSame(router2, strategy.pick(candidates, true));
    }

    @Test
    void shouldStopScanningAtIdleServer() {
        // GIVEN
        var lookups = new AtomicInteger();
        var counting = new LeastConnectedLoadBalancingStrategy(
                address -> {
                    lookups.incrementAndGet();
                    return address.equals(A) ? 0 : 5;
                },
                DEV_NULL_LOGGING);

        // WHEN
        var picked = counting.pick(List.of(a, b, c), false);

        // THEN
        assertSame(a, picked);
        assertEquals(1, lookups.get());
    }

    @Test
    void shouldTracePick() {
        // GIVEN
        var logging = mock(Logging.class);
        var logger = mock(Logger.class);
        given(logging.getLog(any(Class.class))).willReturn(logger);
        checkedOut.put(A, 42);
        LoadBalancingStrategy tracing = new LeastConnectedLoadBalancingStrategy(this::checkedOutCount, logging);

        // WHEN
        tracing.pick(List.of(a), false);
        tracing.pick(List.of(), true);

        // THEN
        then(logger).should().trace(startsWith("Picked"), eq(A), eq("read"), eq(42));
        then(logger).should().trace(startsWith("No candidate"), eq("write"));
    }

    private int checkedOutCount(ServerAddress address) {
        return checkedOut.getOrDefault(address, 0);
    }
}
