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
import org.docdb.driver.cluster.TopologyDescription;

/**
 * Picks the servers eligible for an operation from a topology snapshot. Implementations are pure functions of the
 * snapshot.
 */
@FunctionalInterface
public interface ServerSelector {
    /**
     * @param topology the snapshot
     * @return eligible servers, empty when none, never {@code null}
     */
    List<ServerDescription> select(TopologyDescription topology);
}
