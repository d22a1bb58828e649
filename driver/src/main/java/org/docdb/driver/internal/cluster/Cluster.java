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

import org.docdb.driver.Metrics;
import org.docdb.driver.ReadPreference;
import org.docdb.driver.ServerAddress;
import org.docdb.driver.cluster.TopologyDescription;
import org.docdb.driver.exceptions.ConnectionAcquisitionTimeoutException;
import org.docdb.driver.exceptions.IncompatibleClusterException;
import org.docdb.driver.exceptions.ServerSelectionTimeoutException;
import org.docdb.driver.internal.cluster.selection.ServerSelector;

/**
 * A monitored cluster of servers, the entry point for routing operations.
 */
public interface Cluster extends AutoCloseable {
    /**
     * Block until the selector matches a server, then check a connection to it out of its pool.
     *
     * @param selector decides which servers are eligible
     * @param timeoutMillis how long to wait for an eligible server and a connection to it
     * @return a connection to the selected server, close it to return it to the pool
     * @throws ServerSelectionTimeoutException when no server matched in time
     * @throws ConnectionAcquisitionTimeoutException when the pool of the selected server stayed exhausted
     * @throws IncompatibleClusterException when a member speaks an unsupported wire protocol version
     * @throws IllegalStateException when the cluster is closed
     */
    ServerConnection selectServer(ServerSelector selector, long timeoutMillis);

    /**
     * Select a server for a read with the configured selection timeout and latency window.
     *
     * @param readPreference the read preference
     * @return a connection to the selected server
     */
    ServerConnection selectServer(ReadPreference readPreference);

    /**
     * Select a server accepting writes with the configured selection timeout and latency window.
     *
     * @return a connection to the selected server
     */
    ServerConnection selectWritableServer();

    /**
     * Forget what is known about a server, for example after a network error on one of its connections. Its pool
     * is cleared and it is checked again as soon as possible.
     *
     * @param address the server
     * @param error what happened
     */
    void markServerUnknown(ServerAddress address, Throwable error);

    /**
     * Inspect a failure of a command sent to a server and mark the server unknown when the error shows its state
     * changed. Errors from connections opened before the pool of the server was last cleared are ignored.
     *
     * @param address the server
     * @param generation pool generation of the connection the command was sent on
     * @param error the failure
     */
    void handleCommandError(ServerAddress address, int generation, Throwable error);

    /**
     * @return the latest topology snapshot
     */
    TopologyDescription currentTopology();

    /**
     * @return connection pool metrics
     * @throws org.docdb.driver.exceptions.ClientException when metrics are not enabled
     */
    Metrics metrics();

    /**
     * Stop all monitors and close all pools.
     */
    @Override
    void close();
}
