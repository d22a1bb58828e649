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
package org.docdb.driver.internal.cluster.selection;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.docdb.driver.cluster.ServerDescription;
import org.docdb.driver.cluster.TopologyDescription;

/**
 * Keeps the servers whose round-trip time is within the local threshold of the fastest one.
 */
public class LatencyMinimizingServerSelector implements ServerSelector {
    private final long localThresholdMillis;

    public LatencyMinimizingServerSelector(long localThresholdMillis) {
        if (localThresholdMillis < 0) {
            throw new IllegalArgumentException("Local threshold must not be negative, was " + localThresholdMillis);
        }
        this.localThresholdMillis = localThresholdMillis;
    }

    @Override
    public List<ServerDescription> select(TopologyDescription topology) {
        Duration fastest = null;
        for (var server : topology.servers()) {
            var roundTripTime = server.roundTripTime();
            if (roundTripTime != null && (fastest == null || roundTripTime.compareTo(fastest) < 0)) {
                fastest = roundTripTime;
            }
        }
        if (fastest == null) {
            // no measurements, e.g. a load balancer
            return List.copyOf(topology.servers());
        }
        var threshold = fastest.plusMillis(localThresholdMillis);
        var result = new ArrayList<ServerDescription>();
        for (var server : topology.servers()) {
            var roundTripTime = server.roundTripTime();
            if (roundTripTime == null || roundTripTime.compareTo(threshold) <= 0) {
                result.add(server);
            }
        }
        return result;
    }

    @Override
    public String toString() {
        return "LatencyMinimizingServerSelector{localThresholdMillis=" + localThresholdMillis + "}";
    }
}
