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

import java.util.Map;
import org.docdb.driver.ServerAddress;
import org.docdb.driver.cluster.ServerDescription;
import org.docdb.driver.exceptions.DriverException;
import org.docdb.driver.internal.pool.PooledConnection;
import org.docdb.driver.internal.spi.Connection;

/**
 * A pooled connection to a selected server, together with the description the selection was based on.
 * <p>
 * Command failures are reported to the cluster before they are rethrown, so that errors such as "not primary"
 * invalidate the server right away. Closing returns the connection to its pool.
 */
public class ServerConnection implements Connection {
    private final PooledConnection connection;
    private final ServerDescription server;
    private final CommandErrorHandler errorHandler;

    @FunctionalInterface
    interface CommandErrorHandler {
        void handleCommandError(ServerAddress address, int generation, Throwable error);
    }

    ServerConnection(PooledConnection connection, ServerDescription server, CommandErrorHandler errorHandler) {
        this.connection = connection;
        this.server = server;
        this.errorHandler = errorHandler;
    }

    public ServerAddress address() {
        return server.address();
    }

    /**
     * @return the description of the server at the time it was selected
     */
    public ServerDescription server() {
        return server;
    }

    public int generation() {
        return connection.generation();
    }

    @Override
    public Map<String, Object> sendCommand(Map<String, Object> command) {
        try {
            return connection.sendCommand(command);
        } catch (DriverException e) {
            errorHandler.handleCommandError(server.address(), connection.generation(), e);
            throw e;
        }
    }

    @Override
    public boolean isOpen() {
        return connection.isOpen();
    }

    @Override
    public void close() {
        connection.close();
    }

    @Override
    public String toString() {
        return "ServerConnection{address=" + server.address() + ", type=" + server.type() + ", generation="
                + connection.generation() + "}";
    }
}
