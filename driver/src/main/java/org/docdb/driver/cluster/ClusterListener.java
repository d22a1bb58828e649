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
package org.docdb.driver.cluster;

/**
 * Receives server discovery and monitoring events.
 * <p>
 * Methods are invoked on monitor threads and, for topology events, while the topology update is being published.
 * Implementations must be thread-safe and return quickly; exceptions thrown by a listener are logged and otherwise
 * ignored.
 */
public interface ClusterListener {
    ClusterListener NO_OP = new ClusterListener() {};

    default void serverDescriptionChanged(ServerDescriptionChangedEvent event) {}

    default void topologyDescriptionChanged(TopologyDescriptionChangedEvent event) {}

    default void serverHeartbeatStarted(ServerHeartbeatStartedEvent event) {}

    default void serverHeartbeatSucceeded(ServerHeartbeatSucceededEvent event) {}

    default void serverHeartbeatFailed(ServerHeartbeatFailedEvent event) {}
}
