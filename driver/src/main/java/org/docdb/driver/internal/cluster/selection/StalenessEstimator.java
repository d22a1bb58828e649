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

import java.util.Optional;
import org.docdb.driver.cluster.ServerDescription;
import org.docdb.driver.cluster.ServerType;
import org.docdb.driver.cluster.TopologyDescription;

/**
 * Estimates how far a secondary lags behind, in milliseconds.
 * <p>
 * With a known primary {@code P} the estimate for secondary {@code S} is
 * {@code (S.lastUpdate - S.lastWrite) - (P.lastUpdate - P.lastWrite) + correction}. Without one it is measured
 * against the secondary with the most recent write: {@code SMax.lastWrite - S.lastWrite + correction}.
 */
class StalenessEstimator {
    private final long correctionMillis;

    StalenessEstimator(long correctionMillis) {
        this.correctionMillis = correctionMillis;
    }

    /**
     * @return the estimate, empty when the servers did not report their last write
     */
    Optional<Long> estimate(ServerDescription secondary, TopologyDescription topology) {
        if (secondary.lastWriteDate() == null) {
            return Optional.empty();
        }
        var primary = topology.primary();
        if (primary.isPresent()) {
            var p = primary.get();
            if (p.lastWriteDate() == null) {
                return Optional.empty();
            }
            var secondaryLag = secondary.lastUpdateTime() - secondary.lastWriteDate();
            var primaryLag = p.lastUpdateTime() - p.lastWriteDate();
            return Optional.of(secondaryLag - primaryLag + correctionMillis);
        }
        Long maxLastWrite = null;
        for (var server : topology.serversOfType(ServerType.RS_SECONDARY)) {
            var lastWrite = server.lastWriteDate();
            if (lastWrite != null && (maxLastWrite == null || lastWrite > maxLastWrite)) {
                maxLastWrite = lastWrite;
            }
        }
        return Optional.of(maxLastWrite - secondary.lastWriteDate() + correctionMillis);
    }
}
