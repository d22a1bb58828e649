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

import java.util.ArrayList;
import java.util.List;
import org.docdb.driver.cluster.ServerDescription;
import org.docdb.driver.cluster.ServerType;
import org.docdb.driver.cluster.TopologyDescription;

/**
 * Role filtering shared by read and write selection for the topology types where preferences do not apply.
 */
final class Selectors {
    private Selectors() {}

    /**
     * @return candidates for {@code SINGLE}, {@code SHARDED} and {@code LOAD_BALANCED} topologies, empty for
     *         {@code UNKNOWN}
     * @throws IllegalArgumentException for replica set topologies
     */
    static List<ServerDescription> nonReplicaSetCandidates(TopologyDescription topology) {
        return switch (topology.type()) {
            case UNKNOWN -> List.of();
            case SINGLE -> knownServers(topology);
            case SHARDED -> topology.serversOfType(ServerType.MONGOS);
            case LOAD_BALANCED -> topology.serversOfType(ServerType.LOAD_BALANCER);
            default -> throw new IllegalArgumentException("Not applicable to topology type " + topology.type());
        };
    }

    private static List<ServerDescription> knownServers(TopologyDescription topology) {
        var result = new ArrayList<ServerDescription>();
        for (var server : topology.servers()) {
            if (server.isKnown()) {
                result.add(server);
            }
        }
        return result;
    }
}
