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

import static java.lang.String.format;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.docdb.driver.ReadPreference;
import org.docdb.driver.TagSet;
import org.docdb.driver.cluster.ServerDescription;
import org.docdb.driver.cluster.ServerType;
import org.docdb.driver.cluster.TopologyDescription;
import org.docdb.driver.exceptions.ClientException;

/**
 * Selects the servers a read with the given {@link ReadPreference} may be sent to.
 * <p>
 * In replica sets secondaries are first filtered by maximum staleness and then by tag sets, the first tag set matched
 * by at least one server wins. Other topology types ignore the preference.
 */
public class ReadPreferenceServerSelector implements ServerSelector {
    static final Duration SMALLEST_MAX_STALENESS = Duration.ofSeconds(90);
    static final Duration IDLE_WRITE_PERIOD = Duration.ofSeconds(10);

    private final ReadPreference readPreference;
    private final StalenessEstimator stalenessEstimator;

    /**
     * @param readPreference the preference
     * @param heartbeatIntervalMillis heartbeat interval, bounds the smallest allowed staleness
     * @param stalenessCorrectionMillis added to every staleness estimate
     * @throws ClientException when the maximum staleness is below the smallest allowed value
     */
    public ReadPreferenceServerSelector(
            ReadPreference readPreference, long heartbeatIntervalMillis, long stalenessCorrectionMillis) {
        this.readPreference = readPreference;
        this.stalenessEstimator = new StalenessEstimator(stalenessCorrectionMillis);
        var maxStaleness = readPreference.maxStaleness();
        if (maxStaleness != null) {
            var smallest = Duration.ofMillis(heartbeatIntervalMillis).plus(IDLE_WRITE_PERIOD);
            if (smallest.compareTo(SMALLEST_MAX_STALENESS) < 0) {
                smallest = SMALLEST_MAX_STALENESS;
            }
            if (maxStaleness.compareTo(smallest) < 0) {
                throw new ClientException(format(
                        "Maximum staleness of %d seconds is below the smallest allowed value of %d seconds",
                        maxStaleness.toSeconds(), smallest.toSeconds()));
            }
        }
    }

    public ReadPreference readPreference() {
        return readPreference;
    }

    @Override
    public List<ServerDescription> select(TopologyDescription topology) {
        if (!topology.type().isReplicaSet()) {
            return Selectors.nonReplicaSetCandidates(topology);
        }
        var primaries = topology.serversOfType(ServerType.RS_PRIMARY);
        return switch (readPreference.mode()) {
            case PRIMARY -> primaries;
            case PRIMARY_PREFERRED -> primaries.isEmpty() ? secondaries(topology) : primaries;
            case SECONDARY -> secondaries(topology);
            case SECONDARY_PREFERRED -> {
                var secondaries = secondaries(topology);
                yield secondaries.isEmpty() ? primaries : secondaries;
            }
            case NEAREST -> {
                var candidates = new ArrayList<>(primaries);
                candidates.addAll(fresh(topology.serversOfType(ServerType.RS_SECONDARY), topology));
                yield matchTagSets(candidates);
            }
        };
    }

    private List<ServerDescription> secondaries(TopologyDescription topology) {
        return matchTagSets(fresh(topology.serversOfType(ServerType.RS_SECONDARY), topology));
    }

    private List<ServerDescription> fresh(List<ServerDescription> secondaries, TopologyDescription topology) {
        var maxStaleness = readPreference.maxStaleness();
        if (maxStaleness == null) {
            return secondaries;
        }
        var maxStalenessMillis = maxStaleness.toMillis();
        var result = new ArrayList<ServerDescription>();
        for (var secondary : secondaries) {
            var staleness = stalenessEstimator.estimate(secondary, topology);
            if (staleness.isEmpty() || staleness.get() <= maxStalenessMillis) {
                result.add(secondary);
            }
        }
        return result;
    }

    private List<ServerDescription> matchTagSets(List<ServerDescription> candidates) {
        var tagSets = readPreference.tagSets();
        if (tagSets.isEmpty()) {
            return candidates;
        }
        for (TagSet tagSet : tagSets) {
            var matches = new ArrayList<ServerDescription>();
            for (var candidate : candidates) {
                if (candidate.hasTags(tagSet)) {
                    matches.add(candidate);
                }
            }
            if (!matches.isEmpty()) {
                return matches;
            }
        }
        return List.of();
    }

    @Override
    public String toString() {
        return "ReadPreferenceServerSelector{readPreference=" + readPreference + "}";
    }
}
