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

import static java.util.Collections.emptyMap;
import static java.util.Collections.emptySet;
import static java.util.Collections.unmodifiableMap;
import static java.util.Collections.unmodifiableSet;
import static java.util.Objects.requireNonNull;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.docdb.driver.ServerAddress;
import org.docdb.driver.TagSet;

/**
 * Immutable snapshot of what is known about one server after its last heartbeat.
 * <p>
 * A new description is produced by the server monitor on every heartbeat, successful or not, and replaces the
 * previous one for the same address. Descriptions of servers whose type is not {@link ServerType#isKnown() known}
 * never carry replica set, election or tag data, the builder drops such data for them.
 */
public final class ServerDescription {
    private final ServerAddress address;
    private final ServerType type;
    private final Duration roundTripTime;
    private final int minWireVersion;
    private final int maxWireVersion;
    private final String setName;
    private final Set<ServerAddress> hosts;
    private final Set<ServerAddress> passives;
    private final Set<ServerAddress> arbiters;
    private final ServerAddress primary;
    private final ServerAddress me;
    private final Map<String, String> tags;
    private final ElectionId electionId;
    private final Integer setVersion;
    private final Long lastWriteDate;
    private final Integer logicalSessionTimeoutMinutes;
    private final long lastUpdateTime;
    private final Throwable error;

    private ServerDescription(Builder builder) {
        this.address = requireNonNull(builder.address, "address");
        this.type = requireNonNull(builder.type, "type");
        this.lastUpdateTime = builder.lastUpdateTime;
        this.error = builder.error;
        var known = type.isKnown();
        this.roundTripTime = known ? builder.roundTripTime : null;
        this.minWireVersion = known ? builder.minWireVersion : 0;
        this.maxWireVersion = known ? builder.maxWireVersion : 0;
        this.setName = known ? builder.setName : null;
        this.hosts = known ? unmodifiableSet(new LinkedHashSet<>(builder.hosts)) : emptySet();
        this.passives = known ? unmodifiableSet(new LinkedHashSet<>(builder.passives)) : emptySet();
        this.arbiters = known ? unmodifiableSet(new LinkedHashSet<>(builder.arbiters)) : emptySet();
        this.primary = known ? builder.primary : null;
        this.me = known ? builder.me : null;
        this.tags = known ? unmodifiableMap(new LinkedHashMap<>(builder.tags)) : emptyMap();
        this.electionId = known ? builder.electionId : null;
        this.setVersion = known ? builder.setVersion : null;
        this.lastWriteDate = known ? builder.lastWriteDate : null;
        this.logicalSessionTimeoutMinutes = known ? builder.logicalSessionTimeoutMinutes : null;
    }

    public static Builder builder(ServerAddress address) {
        return new Builder(address);
    }

    /**
     * Description of a server nothing is known about, either because it was never checked or because its last
     * heartbeat failed.
     *
     * @param address the server address
     * @param error the heartbeat failure, may be {@code null}
     * @return unknown description
     */
    public static ServerDescription unknown(ServerAddress address, Throwable error) {
        return builder(address).type(ServerType.UNKNOWN).error(error).build();
    }

    public ServerAddress address() {
        return address;
    }

    public ServerType type() {
        return type;
    }

    public boolean isKnown() {
        return type.isKnown();
    }

    public boolean isPrimary() {
        return type == ServerType.RS_PRIMARY;
    }

    public boolean isSecondary() {
        return type == ServerType.RS_SECONDARY;
    }

    /**
     * @return smoothed round-trip time of heartbeats, {@code null} when the server is not known
     */
    public Duration roundTripTime() {
        return roundTripTime;
    }

    public int minWireVersion() {
        return minWireVersion;
    }

    public int maxWireVersion() {
        return maxWireVersion;
    }

    public String setName() {
        return setName;
    }

    public Set<ServerAddress> hosts() {
        return hosts;
    }

    public Set<ServerAddress> passives() {
        return passives;
    }

    public Set<ServerAddress> arbiters() {
        return arbiters;
    }

    /**
     * @return hosts, passives and arbiters reported by this member, in that order
     */
    public Set<ServerAddress> allMembers() {
        var all = new LinkedHashSet<ServerAddress>(hosts);
        all.addAll(passives);
        all.addAll(arbiters);
        return all;
    }

    /**
     * @return the primary this member believes in, may be {@code null}
     */
    public ServerAddress primary() {
        return primary;
    }

    /**
     * @return the address the member reported for itself, may be {@code null}
     */
    public ServerAddress me() {
        return me;
    }

    public Map<String, String> tags() {
        return tags;
    }

    public boolean hasTags(TagSet tagSet) {
        return tagSet.isSubsetOf(tags);
    }

    public ElectionId electionId() {
        return electionId;
    }

    public Integer setVersion() {
        return setVersion;
    }

    /**
     * @return epoch millis of the last write applied by this member, may be {@code null}
     */
    public Long lastWriteDate() {
        return lastWriteDate;
    }

    public Integer logicalSessionTimeoutMinutes() {
        return logicalSessionTimeoutMinutes;
    }

    /**
     * @return epoch millis of the heartbeat this description was created from
     */
    public long lastUpdateTime() {
        return lastUpdateTime;
    }

    public Throwable error() {
        return error;
    }

    /**
     * Checks if the server wire protocol range intersects the given range.
     *
     * @param driverMinWireVersion lowest supported version
     * @param driverMaxWireVersion highest supported version
     * @return {@code true} if compatible, unknown servers are always compatible
     */
    public boolean isCompatibleWith(int driverMinWireVersion, int driverMaxWireVersion) {
        return !isKnown() || type == ServerType.LOAD_BALANCER
                || (minWireVersion <= driverMaxWireVersion && maxWireVersion >= driverMinWireVersion);
    }

    /**
     * Compares everything except the heartbeat timestamp and round-trip time, which change on every heartbeat.
     */
    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        var that = (ServerDescription) o;
        return minWireVersion == that.minWireVersion
                && maxWireVersion == that.maxWireVersion
                && address.equals(that.address)
                && type == that.type
                && Objects.equals(setName, that.setName)
                && hosts.equals(that.hosts)
                && passives.equals(that.passives)
                && arbiters.equals(that.arbiters)
                && Objects.equals(primary, that.primary)
                && Objects.equals(me, that.me)
                && tags.equals(that.tags)
                && Objects.equals(electionId, that.electionId)
                && Objects.equals(setVersion, that.setVersion)
                && Objects.equals(logicalSessionTimeoutMinutes, that.logicalSessionTimeoutMinutes)
                && Objects.equals(errorSignature(error), errorSignature(that.error));
    }

    @Override
    public int hashCode() {
        return Objects.hash(address, type, setName, hosts, primary, electionId, setVersion);
    }

    @Override
    public String toString() {
        var builder = new StringBuilder("{address=")
                .append(address)
                .append(", type=")
                .append(type);
        if (roundTripTime != null) {
            builder.append(", roundTripTime=")
                    .append(roundTripTime.toNanos() / 1_000_000.0)
                    .append(" ms");
        }
        if (setName != null) {
            builder.append(", setName=").append(setName);
        }
        if (setVersion != null || electionId != null) {
            builder.append(", setVersion=").append(setVersion).append(", electionId=").append(electionId);
        }
        if (!tags.isEmpty()) {
            builder.append(", tags=").append(tags);
        }
        if (error != null) {
            builder.append(", error=").append(error);
        }
        return builder.append('}').toString();
    }

    private static String errorSignature(Throwable error) {
        return error == null ? null : error.getClass().getName() + ": " + error.getMessage();
    }

    public static final class Builder {
        private final ServerAddress address;
        private ServerType type = ServerType.UNKNOWN;
        private Duration roundTripTime;
        private int minWireVersion;
        private int maxWireVersion;
        private String setName;
        private Set<ServerAddress> hosts = emptySet();
        private Set<ServerAddress> passives = emptySet();
        private Set<ServerAddress> arbiters = emptySet();
        private ServerAddress primary;
        private ServerAddress me;
        private Map<String, String> tags = emptyMap();
        private ElectionId electionId;
        private Integer setVersion;
        private Long lastWriteDate;
        private Integer logicalSessionTimeoutMinutes;
        private long lastUpdateTime;
        private Throwable error;

        private Builder(ServerAddress address) {
            this.address = requireNonNull(address);
        }

        public Builder type(ServerType type) {
            this.type = type;
            return this;
        }

        public Builder roundTripTime(Duration roundTripTime) {
            this.roundTripTime = roundTripTime;
            return this;
        }

        public Builder wireVersions(int minWireVersion, int maxWireVersion) {
            this.minWireVersion = minWireVersion;
            this.maxWireVersion = maxWireVersion;
            return this;
        }

        public Builder setName(String setName) {
            this.setName = setName;
            return this;
        }

        public Builder hosts(Set<ServerAddress> hosts) {
            this.hosts = requireNonNull(hosts);
            return this;
        }

        public Builder passives(Set<ServerAddress> passives) {
            this.passives = requireNonNull(passives);
            return this;
        }

        public Builder arbiters(Set<ServerAddress> arbiters) {
            this.arbiters = requireNonNull(arbiters);
            return this;
        }

        public Builder primary(ServerAddress primary) {
            this.primary = primary;
            return this;
        }

        public Builder me(ServerAddress me) {
            this.me = me;
            return this;
        }

        public Builder tags(Map<String, String> tags) {
            this.tags = requireNonNull(tags);
            return this;
        }

        public Builder electionId(ElectionId electionId) {
            this.electionId = electionId;
            return this;
        }

        public Builder setVersion(Integer setVersion) {
            this.setVersion = setVersion;
            return this;
        }

        public Builder lastWriteDate(Long lastWriteDate) {
            this.lastWriteDate = lastWriteDate;
            return this;
        }

        public Builder logicalSessionTimeoutMinutes(Integer logicalSessionTimeoutMinutes) {
            this.logicalSessionTimeoutMinutes = logicalSessionTimeoutMinutes;
            return this;
        }

        public Builder lastUpdateTime(long lastUpdateTime) {
            this.lastUpdateTime = lastUpdateTime;
            return this;
        }

        public Builder error(Throwable error) {
            this.error = error;
            return this;
        }

        public ServerDescription build() {
            return new ServerDescription(this);
        }
    }
}
