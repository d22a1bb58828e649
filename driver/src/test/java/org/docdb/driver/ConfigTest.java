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
package org.docdb.driver;

import static java.util.concurrent.TimeUnit.MILLISECONDS;
import static java.util.concurrent.TimeUnit.SECONDS;
import static org.docdb.driver.internal.logging.DevNullLogging.DEV_NULL_LOGGING;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.mock;

import org.docdb.driver.cluster.ClusterListener;
import org.junit.jupiter.api.Test;

class ConfigTest {
    @Test
    void shouldDefaultToDocumentedValues() {
        var config = Config.defaultConfig();

        assertSame(DEV_NULL_LOGGING, config.logging());
        assertSame(MetricsAdapter.DEV_NULL, config.metricsAdapter());
        assertSame(ClusterListener.NO_OP, config.clusterListener());
        assertNull(config.replicaSetName());
        assertFalse(config.directConnection());
        assertFalse(config.loadBalanced());
        assertEquals(10_000, config.heartbeatIntervalMillis());
        assertEquals(500, config.minHeartbeatIntervalMillis());
        assertEquals(10_000, config.connectTimeoutMillis());
        assertEquals(0, config.socketTimeoutMillis());
        assertEquals(30_000, config.serverSelectionTimeoutMillis());
        assertEquals(15, config.localThresholdMillis());
        assertEquals(100, config.maxConnectionPoolSize());
        assertEquals(0, config.minConnectionPoolSize());
        assertEquals(0, config.maxConnectionIdleTimeMillis());
        assertEquals(60_000, config.maintenanceIntervalMillis());
    }

    @Test
    void shouldDefaultStalenessCorrectionToHeartbeatInterval() {
        var config = Config.builder().withHeartbeatInterval(3, SECONDS).build();

        assertEquals(3_000, config.stalenessCorrectionMillis());
    }

    @Test
    void shouldUseConfiguredStalenessCorrection() {
        var config = Config.builder()
                .withHeartbeatInterval(3, SECONDS)
                .withStalenessCorrection(0, MILLISECONDS)
                .build();

        assertEquals(0, config.stalenessCorrectionMillis());
    }

    @Test
    void shouldKeepClusterListener() {
        var listener = mock(ClusterListener.class);

        var config = Config.builder().withClusterListener(listener).build();

        assertSame(listener, config.clusterListener());
    }

    @Test
    void shouldTurnNegativeMaxPoolSizeIntoUnlimited() {
        var config = Config.builder().withMaxConnectionPoolSize(-1).build();

        assertEquals(Integer.MAX_VALUE, config.maxConnectionPoolSize());
    }

    @Test
    void shouldRejectZeroMaxPoolSize() {
        assertThrows(IllegalArgumentException.class, () -> Config.builder().withMaxConnectionPoolSize(0));
    }

    @Test
    void shouldRejectInvalidDurations() {
        var builder = Config.builder();

        assertThrows(IllegalArgumentException.class, () -> builder.withHeartbeatInterval(0, SECONDS));
        assertThrows(IllegalArgumentException.class, () -> builder.withConnectionTimeout(-1, SECONDS));
        assertThrows(IllegalArgumentException.class, () -> builder.withLocalThreshold(-1, MILLISECONDS));
        assertThrows(IllegalArgumentException.class, () -> builder.withMaxConnectionIdleTime(-1, SECONDS));
        assertThrows(IllegalArgumentException.class, () -> builder.withMaintenanceInterval(0, SECONDS));
        assertThrows(IllegalArgumentException.class, () -> builder.withMinConnectionPoolSize(-1));
    }

    @Test
    void shouldRejectMinPoolSizeAboveMax() {
        var builder = Config.builder().withMaxConnectionPoolSize(5).withMinConnectionPoolSize(6);

        assertThrows(IllegalArgumentException.class, builder::build);
    }

    @Test
    void shouldRejectConflictingTopologyOptions() {
        assertThrows(
                IllegalArgumentException.class,
                () -> Config.builder().withDirectConnection(true).withLoadBalanced(true).build());
        assertThrows(
                IllegalArgumentException.class,
                () -> Config.builder().withLoadBalanced(true).withReplicaSetName("rs0").build());
    }
}
