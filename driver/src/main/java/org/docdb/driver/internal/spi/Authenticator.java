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

import org.docdb.driver.cluster.ServerDescription;

/**
 * Runs the authentication handshake on every new pooled connection before it is handed out.
 */
@FunctionalInterface
public interface Authenticator {
    Authenticator NONE = (connection, server) -> {};

    /**
     * @param connection the freshly opened connection
     * @param server the last known description of the server the connection points to
     */
    void authenticate(Connection connection, ServerDescription server);
}
