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
package org.docdb.driver.internal.cluster;

import static java.lang.String.format;
import static org.docdb.driver.internal.util.LockUtil.executeWithLock;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;
import org.docdb.driver.Logger;
import org.docdb.driver.Logging;
import org.docdb.driver.ServerAddress;
import org.docdb.driver.cluster.ElectionId;
import org.docdb.driver.cluster.ServerDescription;
import org.docdb.driver.cluster.ServerType;
import org.docdb.driver.cluster.TopologyDescription;
import org.docdb.driver.cluster.TopologyType;

/**
 * Folds server descriptions reported by monitors into a consistent {@link TopologyDescription}.
 * <p>
 * Updates are serialized by a single lock, every update publishes a new immutable description. Reads never lock.
 * Anomalies in reports, such as a member of another replica set, never fail an update: the offending server is
 * removed or its report is discarded, and a warning is logged.
 */
public class Topology {
    public static final int MIN_SUPPORTED_WIRE_VERSION = 6;
    public static final int MAX_SUPPORTED_WIRE_VERSION = 25;

    private final int seedCount;
    private final ReentrantLock lock = new ReentrantLock();
    private final Logger log;
    private volatile TopologyDescription description;

    public Topology(
            List<ServerAddress> seeds,
            String replicaSetName,
            boolean directConnection,
            boolean loadBalanced,
            Logging logging) {
        if (seeds.isEmpty()) {
            throw new IllegalArgumentException("At least one seed address is required");
        }
        if ((directConnection || loadBalanced) && seeds.size() > 1) {
            throw new IllegalArgumentException(format(
                    "%s requires exactly one seed, got %s",
                    directConnection ? "A direct connection" : "A load balanced topology", seeds));
        }
        this.seedCount = seeds.size();
        this.log = logging.getLog(getClass());
        this.description = initialDescription(seeds, replicaSetName, directConnection, loadBalanced);
    }

    public TopologyDescription description() {
        return description;
    }

    /**
     * Fold a server report into the topology.
     *
     * @param update the latest description of one server
     * @return the description in effect after the update, the same instance when the report was ignored
     */
    public TopologyDescription apply(ServerDescription update) {
        return executeWithLock(lock, () -> {
            var updated = doApply(description, update);
            description = updated;
            return updated;
        });
    }

    private TopologyDescription doApply(TopologyDescription current, ServerDescription update) {
        var address = update.address();
        if (!current.contains(address)) {
            log.debug("Ignoring description of %s, the server is no longer part of the topology", address);
            return current;
        }
        if (current.type() == TopologyType.LOAD_BALANCED) {
            return current;
        }

        var state = new MutableTopology(current);
        state.servers.put(address, update);

        switch (current.type()) {
            case SINGLE -> {}
            case UNKNOWN -> updateUnknown(state, update);
            case SHARDED -> {
                if (update.type() != ServerType.UNKNOWN && update.type() != ServerType.MONGOS) {
                    removeWithWarning(
                            state,
                            address,
                            format("%s is a %s in a sharded cluster", address, update.type()));
                }
            }
            case REPLICA_SET_WITH_PRIMARY -> updateReplicaSetWithPrimary(state, update);
            case REPLICA_SET_NO_PRIMARY -> updateReplicaSetNoPrimary(state, update);
            default -> throw new IllegalStateException("Unexpected topology type " + current.type());
        }

        var updated = state.toDescription();
        if (log.isDebugEnabled() && updated.type() != current.type()) {
            log.debug("Topology type changed from %s to %s", current.type(), updated.type());
        }
        return updated;
    }

    private void updateUnknown(MutableTopology state, ServerDescription update) {
        switch (update.type()) {
            case STANDALONE -> {
                if (seedCount == 1) {
                    state.type = TopologyType.SINGLE;
                } else {
                    removeWithWarning(
                            state,
                            update.address(),
                            format("%s is a standalone and %d seeds were given", update.address(), seedCount));
                }
            }
            case MONGOS -> state.type = TopologyType.SHARDED;
            case RS_PRIMARY -> {
                state.type = TopologyType.REPLICA_SET_WITH_PRIMARY;
                updateFromPrimary(state, update);
            }
            case RS_SECONDARY, RS_ARBITER, RS_OTHER -> {
                state.type = TopologyType.REPLICA_SET_NO_PRIMARY;
                updateWithoutPrimary(state, update);
            }
            default -> {}
        }
    }

    private void updateReplicaSetWithPrimary(MutableTopology state, ServerDescription update) {
        switch (update.type()) {
            case STANDALONE, MONGOS -> {
                removeWithWarning(
                        state,
                        update.address(),
                        format("%s is a %s in a replica set", update.address(), update.type()));
                checkIfHasPrimary(state);
            }
            case RS_PRIMARY -> updateFromPrimary(state, update);
            case RS_SECONDARY, RS_ARBITER, RS_OTHER -> updateWithPrimaryFromMember(state, update);
            default -> checkIfHasPrimary(state);
        }
    }

    private void updateReplicaSetNoPrimary(MutableTopology state, ServerDescription update) {
        switch (update.type()) {
            case STANDALONE, MONGOS -> removeWithWarning(
                    state, update.address(), format("%s is a %s in a replica set", update.address(), update.type()));
            case RS_PRIMARY -> updateFromPrimary(state, update);
            case RS_SECONDARY, RS_ARBITER, RS_OTHER -> updateWithoutPrimary(state, update);
            default -> {}
        }
    }

    private void updateFromPrimary(MutableTopology state, ServerDescription update) {
        var address = update.address();
        if (state.setName == null) {
            state.setName = update.setName();
        }
        if (!state.setName.equals(update.setName())) {
            removeWithWarning(state, address, setNameMismatch(update, state.setName));
            checkIfHasPrimary(state);
            return;
        }

        if (isStalePrimary(state, update)) {
            log.info(
                    "Ignoring primary report of %s with setVersion %s and electionId %s, "
                            + "a primary with setVersion %s and electionId %s was seen before",
                    address,
                    update.setVersion(),
                    update.electionId(),
                    state.maxSetVersion,
                    state.maxElectionId);
            state.servers.put(address, ServerDescription.unknown(address, null));
            checkIfHasPrimary(state);
            return;
        }

        if (update.electionId() != null
                && (state.maxElectionId == null || update.electionId().compareTo(state.maxElectionId) > 0)) {
            state.maxElectionId = update.electionId();
        }
        if (update.setVersion() != null
                && (state.maxSetVersion == null || update.setVersion() > state.maxSetVersion)) {
            state.maxSetVersion = update.setVersion();
        }

        for (var server : List.copyOf(state.servers.values())) {
            if (server.isPrimary() && !server.address().equals(address)) {
                log.info(
                        "Demoting former primary %s, %s reported itself as the new primary",
                        server.address(), address);
                state.servers.put(server.address(), ServerDescription.unknown(server.address(), null));
            }
        }

        var members = update.allMembers();
        for (var member : members) {
            state.servers.putIfAbsent(member, ServerDescription.unknown(member, null));
        }
        for (var tracked : List.copyOf(state.servers.keySet())) {
            if (!members.contains(tracked)) {
                removeWithWarning(
                        state, tracked, format("%s is not in the hosts reported by primary %s", tracked, address));
            }
        }
        checkIfHasPrimary(state);
    }

    private void updateWithPrimaryFromMember(MutableTopology state, ServerDescription update) {
        var address = update.address();
        if (!Objects.equals(state.setName, update.setName())) {
            removeWithWarning(state, address, setNameMismatch(update, state.setName));
        } else if (isMeMismatch(update)) {
            removeWithWarning(state, address, format("%s reported itself as %s", address, update.me()));
        }
        checkIfHasPrimary(state);
    }

    private void updateWithoutPrimary(MutableTopology state, ServerDescription update) {
        var address = update.address();
        if (state.setName == null) {
            state.setName = update.setName();
        }
        if (!state.setName.equals(update.setName())) {
            removeWithWarning(state, address, setNameMismatch(update, state.setName));
            return;
        }

        for (var member : update.allMembers()) {
            state.servers.putIfAbsent(member, ServerDescription.unknown(member, null));
        }

        var primaryHint = update.primary();
        if (primaryHint != null) {
            var hinted = state.servers.get(primaryHint);
            if (hinted == null || hinted.type() == ServerType.UNKNOWN) {
                state.servers.put(
                        primaryHint,
                        ServerDescription.builder(primaryHint)
                                .type(ServerType.POSSIBLE_PRIMARY)
                                .build());
            }
        }

        if (isMeMismatch(update)) {
            removeWithWarning(state, address, format("%s reported itself as %s", address, update.me()));
        }
    }

    private static boolean isStalePrimary(MutableTopology state, ServerDescription update) {
        if (update.electionId() == null || update.setVersion() == null) {
            return false;
        }
        if (state.maxSetVersion == null || state.maxElectionId == null) {
            return false;
        }
        return update.setVersion() < state.maxSetVersion
                || (update.setVersion().equals(state.maxSetVersion)
                        && update.electionId().compareTo(state.maxElectionId) < 0);
    }

    private static boolean isMeMismatch(ServerDescription update) {
        return update.me() != null && !update.me().equals(update.address());
    }

    private static void checkIfHasPrimary(MutableTopology state) {
        var hasPrimary = state.servers.values().stream()
                .anyMatch(server -> server.isPrimary() && Objects.equals(server.setName(), state.setName));
        state.type = hasPrimary ? TopologyType.REPLICA_SET_WITH_PRIMARY : TopologyType.REPLICA_SET_NO_PRIMARY;
    }

    private void removeWithWarning(MutableTopology state, ServerAddress address, String reason) {
        log.warn("Removing server %s from the topology, %s", address, reason);
        state.servers.remove(address);
        if (state.servers.isEmpty()) {
            log.warn("Topology now has no servers, the seeds or the replica set name are likely misconfigured");
        }
    }

    private static String setNameMismatch(ServerDescription update, String setName) {
        return format(
                "it reported replica set name `%s` but the replica set name is `%s`",
                update.setName(), setName);
    }

    static String compatibilityError(Map<ServerAddress, ServerDescription> servers) {
        for (var server : servers.values()) {
            if (!server.isCompatibleWith(MIN_SUPPORTED_WIRE_VERSION, MAX_SUPPORTED_WIRE_VERSION)) {
                return format(
                        "Server at %s reports wire version range [%d, %d], "
                                + "but this version of the driver only supports [%d, %d]",
                        server.address(),
                        server.minWireVersion(),
                        server.maxWireVersion(),
                        MIN_SUPPORTED_WIRE_VERSION,
                        MAX_SUPPORTED_WIRE_VERSION);
            }
        }
        return null;
    }

    private static TopologyDescription initialDescription(
            List<ServerAddress> seeds, String replicaSetName, boolean directConnection, boolean loadBalanced) {
        var servers = new LinkedHashMap<ServerAddress, ServerDescription>();
        if (loadBalanced) {
            var address = seeds.get(0);
            servers.put(
                    address,
                    ServerDescription.builder(address).type(ServerType.LOAD_BALANCER).build());
            return new TopologyDescription(TopologyType.LOAD_BALANCED, null, servers, null, null, null);
        }
        for (var seed : seeds) {
            servers.put(seed, ServerDescription.unknown(seed, null));
        }
        TopologyType type;
        if (directConnection) {
            type = TopologyType.SINGLE;
        } else if (replicaSetName != null) {
            type = TopologyType.REPLICA_SET_NO_PRIMARY;
        } else {
            type = TopologyType.UNKNOWN;
        }
        return new TopologyDescription(type, replicaSetName, servers, null, null, null);
    }

    private static class MutableTopology {
        private TopologyType type;
        private String setName;
        private final Map<ServerAddress, ServerDescription> servers;
        private Integer maxSetVersion;
        private ElectionId maxElectionId;

        private MutableTopology(TopologyDescription description) {
            this.type = description.type();
            this.setName = description.setName();
            this.servers = new LinkedHashMap<>();
            description.servers().forEach(server -> servers.put(server.address(), server));
            this.maxSetVersion = description.maxSetVersion();
            this.maxElectionId = description.maxElectionId();
        }

        private TopologyDescription toDescription() {
            return new TopologyDescription(
                    type, setName, servers, maxSetVersion, maxElectionId, compatibilityError(servers));
        }
    }
}
