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
package org.docdb.driver.exceptions;

import java.io.Serial;
import org.docdb.driver.ServerAddress;

/**
 * Raised when a server was selected but its connection pool could not hand out a connection before the deadline
 * because the pool was at its maximum size.
 *
 * @since 1.0
 */
public class ConnectionAcquisitionTimeoutException extends DriverException {
    @Serial
    private static final long serialVersionUID = 4611960419213372853L;

    private final ServerAddress address;

    public ConnectionAcquisitionTimeoutException(ServerAddress address, long timeoutMillis) {
        super(String.format(
                "Unable to acquire connection to %s from the pool within %d ms, the pool is exhausted",
                address, timeoutMillis));
        this.address = address;
    }

    public ServerAddress address() {
        return address;
    }
}
