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
package org.docdb.driver.internal.pool;

/**
 * Why a pool is cleared. Decides whether idle connections are closed right away or only when next touched.
 */
public enum ClearCause {
    NETWORK_ERROR(true),
    SHUTDOWN(true),
    HEARTBEAT_FAILURE(true),
    STATE_CHANGE(false);

    private final boolean closesIdleConnections;

    ClearCause(boolean closesIdleConnections) {
        this.closesIdleConnections = closesIdleConnections;
    }

    public boolean closesIdleConnections() {
        return closesIdleConnections;
    }
}
