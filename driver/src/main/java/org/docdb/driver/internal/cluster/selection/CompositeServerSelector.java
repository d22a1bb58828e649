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

import java.util.LinkedHashMap;
import java.util.List;
import org.docdb.driver.ServerAddress;
import org.docdb.driver.cluster.ServerDescription;
import org.docdb.driver.cluster.TopologyDescription;

/**
 * Applies selectors in order, each one sees only the servers the previous one selected.
 */
public class CompositeServerSelector implements ServerSelector {
    private final List<ServerSelector> selectors;

    public CompositeServerSelector(List<ServerSelector> selectors) {
        if (selectors.isEmpty()) {
            throw new IllegalArgumentException("At least one selector is required");
        }
        this.selectors = List.copyOf(selectors);
    }

    @Override
    public List<ServerDescription> select(TopologyDescription topology) {
        var current = topology;
        List<ServerDescription> selected = List.of();
        for (var selector : selectors) {
            selected = selector.select(current);
            if (selected.isEmpty()) {
                return selected;
            }
            current = restrict(topology, selected);
        }
        return selected;
    }

    private static TopologyDescription restrict(TopologyDescription topology, List<ServerDescription> servers) {
        var map = new LinkedHashMap<ServerAddress, ServerDescription>();
        for (var server : servers) {
            map.put(server.address(), server);
        }
        return new TopologyDescription(
                topology.type(),
                topology.setName(),
                map,
                topology.maxSetVersion(),
                topology.maxElectionId(),
                topology.compatibilityError());
    }

    @Override
    public String toString() {
        return "CompositeServerSelector" + selectors;
    }
}
