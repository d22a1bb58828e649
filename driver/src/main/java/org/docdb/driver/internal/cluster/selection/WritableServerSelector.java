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
package org.docdb.driver.internal.cluster.selection;

import java.util.List;
import org.docdb.driver.cluster.ServerDescription;
import org.docdb.driver.cluster.ServerType;
import org.docdb.driver.cluster.TopologyDescription;

/**
 * Selects servers that accept writes: the primary of a replica set, routers, a standalone or a load balancer.
 */
public enum WritableServerSelector implements ServerSelector {
    INSTANCE;

    @Override
    public List<ServerDescription> select(TopologyDescription topology) {
        if (topology.type().isReplicaSet()) {
            return topology.serversOfType(ServerType.RS_PRIMARY);
        }
        return Selectors.nonReplicaSetCandidates(topology).stream()
                .filter(server -> server.type().isWritable())
                .toList();
    }

    @Override
    public String toString() {
        return "WritableServerSelector";
    }
}
