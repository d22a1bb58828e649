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

import static java.util.Collections.unmodifiableMap;
import static java.util.Objects.requireNonNull;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.docdb.driver.ServerAddress;

/**
 * Immutable, cluster-wide view assembled from the descriptions of all tracked servers.
 * <p>
 * Instances are never modified. The topology state machine publishes a new instance for every heartbeat that changes
 * something, so readers can hold on to a snapshot without any locking.
 */
public final class TopologyDescription {
    private final TopologyType type;
    private final String setName;
    private final Map<ServerAddress, ServerDescription> servers;
    private final Integer maxSetVersion;
    private final ElectionId maxElectionId;
    private final String compatibilityError;

    public TopologyDescription(
            TopologyType type,
            String setName,
            Map<ServerAddress, ServerDescription> servers,
            Integer maxSetVersion,
            ElectionId maxElectionId,
            String compatibilityError) {
        this.type = requireNonNull(type);
        this.setName = setName;
        this.servers = unmodifiableMap(new LinkedHashMap<>(servers));
        this.maxSetVersion = maxSetVersion;
        this.maxElectionId = maxElectionId;
        this.compatibilityError = compatibilityError;
    }

    public TopologyType type() {
        return type;
    }

    /**
     * @return the replica set name, once observed or configured it never changes
     */
    public String setName() {
        return setName;
    }

    public Collection<ServerDescription> servers() {
        return servers.values();
    }

    public Set<ServerAddress> addresses() {
        return servers.keySet();
    }

    public ServerDescription server(ServerAddress address) {
        return servers.get(address);
    }

    public boolean contains(ServerAddress address) {
        return servers.containsKey(address);
    }

    public Optional<ServerDescription> primary() {
        return servers.values().stream().filter(ServerDescription::isPrimary).findFirst();
    }

    public List<ServerDescription> serversOfType(ServerType serverType) {
        var result = new ArrayList<ServerDescription>();
        for (var server : servers.values()) {
            if (server.type() == serverType) {
                result.add(server);
            }
        }
        return result;
    }

    public Integer maxSetVersion() {
        return maxSetVersion;
    }

    public ElectionId maxElectionId() {
        return maxElectionId;
    }

    /**
     * @return description of the wire version mismatch, {@code null} when all members are compatible
     */
    public String compatibilityError() {
        return compatibilityError;
    }

    /**
     * Summary meant for error messages: type, set name and, for every member, address, type and last error.
     *
     * @return short human readable description
     */
    public String shortDescription() {
        var builder = new StringBuilder("{type=").append(type);
        if (setName != null) {
            builder.append(", setName=").append(setName);
        }
        builder.append(", servers=[");
        var first = true;
        for (var server : servers.values()) {
            if (!first) {
                builder.append(", ");
            }
            first = false;
            builder.append("{address=").append(server.address()).append(", type=").append(server.type());
            if (server.roundTripTime() != null) {
                builder.append(", roundTripTime=").append(server.roundTripTime().toMillis()).append(" ms");
            }
            if (!server.tags().isEmpty()) {
                builder.append(", tags=").append(server.tags());
            }
            if (server.error() != null) {
                builder.append(", error=").append(server.error());
            }
            builder.append('}');
        }
        builder.append(']');
        if (compatibilityError != null) {
            builder.append(", compatibilityError=").append(compatibilityError);
        }
        return builder.append('}').toString();
    }

    @Override
    public String toString() {
        return shortDescription();
    }
}
