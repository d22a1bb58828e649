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
package org.docdb.driver.internal.spi;

import org.docdb.driver.ServerAddress;

/**
 * Opens connections to servers. Used both by monitors, for their dedicated heartbeat connection, and by pools.
 */
public interface ConnectionFactory {
    /**
     * Open a connection to the given address.
     *
     * @param address the server
     * @param connectTimeoutMillis socket connect timeout
     * @param readTimeoutMillis socket read timeout, {@code 0} for none
     * @return an open connection
     * @throws org.docdb.driver.exceptions.ServiceUnavailableException when the server can't be reached
     */
    Connection connect(ServerAddress address, int connectTimeoutMillis, int readTimeoutMillis);

    default Connection connect(ServerAddress address, int connectTimeoutMillis) {
        return connect(address, connectTimeoutMillis, connectTimeoutMillis);
    }
}
