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
import java.util.function.ToIntFunction;
import org.docdb.driver.Logger;
import org.docdb.driver.Logging;
import org.docdb.driver.ServerAddress;
import org.docdb.driver.cluster.ServerDescription;

/**
 * Picks the candidate whose pool has the fewest connections checked out. The scan starts at a rotating offset, kept
 * separately for reads and writes, so candidates that are equally busy take turns.
 */
public class LeastConnectedLoadBalancingStrategy implements LoadBalancingStrategy {
    private final RoundRobinArrayIndex readOffset = new RoundRobinArrayIndex();
    private final RoundRobinArrayIndex writeOffset = new RoundRobinArrayIndex();
    private final ToIntFunction<ServerAddress> checkedOut;
    private final Logger log;

    public LeastConnectedLoadBalancingStrategy(ToIntFunction<ServerAddress> checkedOut, Logging logging) {
        this.checkedOut = checkedOut;
        this.log = logging.getLog(getClass());
    }

    @Override
    public ServerDescription pick(List<ServerDescription> candidates, boolean write) {
        var operation = write ? "write" : "read";
        if (candidates.isEmpty()) {
            log.trace("No candidate to pick for a %s", operation);
            return null;
        }
        var count = candidates.size();
        var offset = (write ? writeOffset : readOffset).next(count);

        ServerDescription best = null;
        var bestLoad = Integer.MAX_VALUE;
        for (var i = 0; i < count && bestLoad > 0; i++) {
            var candidate = candidates.get((offset + i) % count);
            var load = checkedOut.applyAsInt(candidate.address());
            if (load < bestLoad) {
                best = candidate;
                bestLoad = load;
            }
        }

        log.trace("Picked %s for a %s, %d connections checked out", best.address(), operation, bestLoad);
        return best;
    }
}
