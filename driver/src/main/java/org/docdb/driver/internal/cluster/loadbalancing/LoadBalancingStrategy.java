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
package org.docdb.driver.internal.cluster.loadbalancing;

import java.util.List;
import org.docdb.driver.cluster.ServerDescription;

/**
 * Chooses the server an operation runs on once server selection has narrowed the candidates down.
 */
public interface LoadBalancingStrategy {
    /**
     * @param candidates servers that passed server selection, in no particular order
     * @param write whether the connection is wanted for a write
     * @return the chosen server, {@code null} when there are no candidates
     */
    ServerDescription pick(List<ServerDescription> candidates, boolean write);
}
