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
import org.docdb.driver.cluster.TopologyDescription;

/**
 * Raised when no server matching the requested selector became available before the server selection deadline.
 * <p>
 * The last observed {@link TopologyDescription} is attached, and summarised in the message, so that callers can tell
 * apart "no primary available", "no member matched the tag sets" and "all members unreachable".
 *
 * @since 1.0
 */
public class ServerSelectionTimeoutException extends DriverException {
    @Serial
    private static final long serialVersionUID = -2938478437810282214L;

    private final transient TopologyDescription topologyDescription;

    public ServerSelectionTimeoutException(String message, TopologyDescription topologyDescription) {
        super(message);
        this.topologyDescription = topologyDescription;
    }

    /**
     * The topology as it was when the selection gave up.
     *
     * @return the last topology description
     */
    public TopologyDescription topologyDescription() {
        return topologyDescription;
    }
}
