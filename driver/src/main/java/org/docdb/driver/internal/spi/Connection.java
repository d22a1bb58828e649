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

import java.util.Map;

/**
 * A network connection to a single server, provided by the transport layer.
 * <p>
 * Implementations are not required to be thread-safe, a connection is used by one thread at a time. The exception is
 * {@link #close()}, which may be called from another thread to abandon a blocked {@link #sendCommand(Map)}.
 */
public interface Connection extends AutoCloseable {
    /**
     * Send a command document and wait for the reply.
     *
     * @param command the command, with the command name as first key
     * @return the reply document
     * @throws org.docdb.driver.exceptions.ServiceUnavailableException on network failures
     * @throws org.docdb.driver.exceptions.CommandException when the server answered with an error
     */
    Map<String, Object> sendCommand(Map<String, Object> command);

    boolean isOpen();

    @Override
    void close();
}
