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
 * Role of a single server as learned from its last heartbeat.
 */
public enum ServerType {
    UNKNOWN,
    STANDALONE,
    MONGOS,
    POSSIBLE_PRIMARY,
    RS_PRIMARY,
    RS_SECONDARY,
    RS_ARBITER,
    RS_GHOST,
    RS_OTHER,
    LOAD_BALANCER;

    /**
     * @return {@code true} when the last heartbeat actually told something about the server
     */
    public boolean isKnown() {
        return this != UNKNOWN && this != POSSIBLE_PRIMARY;
    }

    /**
     * @return {@code true} for servers that hold data and can serve operations
     */
    public boolean isDataBearing() {
        return this == STANDALONE || this == MONGOS || this == RS_PRIMARY || this == RS_SECONDARY
                || this == LOAD_BALANCER;
    }

    public boolean isWritable() {
        return this == STANDALONE || this == MONGOS || this == RS_PRIMARY || this == LOAD_BALANCER;
    }
}
