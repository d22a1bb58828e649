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
package org.docdb.driver;

import static java.util.Collections.emptyList;
import static java.util.Collections.unmodifiableList;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.docdb.driver.exceptions.ClientException;

/**
 * Caller supplied policy constraining which replica set members may serve a read.
 * <p>
 * Tag sets are tried in order; the first one matched by at least one eligible member wins. Maximum staleness
 * excludes secondaries estimated to lag behind the primary, or the freshest secondary, by more than the bound.
 * Neither applies to the {@link Mode#PRIMARY primary} mode. In sharded topologies the role is ignored and all routers
 * are eligible.
 */
public final class ReadPreference {
    public enum Mode {
        PRIMARY("primary"),
        PRIMARY_PREFERRED("primaryPreferred"),
        SECONDARY("secondary"),
        SECONDARY_PREFERRED("secondaryPreferred"),
        NEAREST("nearest");

        private final String modeName;

        Mode(String modeName) {
            this.modeName = modeName;
        }

        public String modeName() {
            return modeName;
        }

        public static Mode fromName(String name) {
            for (var mode : values()) {
                if (mode.modeName.equalsIgnoreCase(name)) {
                    return mode;
                }
            }
            throw new ClientException("Unknown read preference mode `" + name + "`");
        }
    }

    private static final ReadPreference PRIMARY = new ReadPreference(Mode.PRIMARY, emptyList(), null);

    private final Mode mode;
    private final List<TagSet> tagSets;
    private final Duration maxStaleness;

    private ReadPreference(Mode mode, List<TagSet> tagSets, Duration maxStaleness) {
        this.mode = mode;
        this.tagSets = unmodifiableList(new ArrayList<>(tagSets));
        this.maxStaleness = maxStaleness;
    }

    public static ReadPreference primary() {
        return PRIMARY;
    }

    public static ReadPreference primaryPreferred() {
        return of(Mode.PRIMARY_PREFERRED, emptyList(), null);
    }

    public static ReadPreference secondary() {
        return of(Mode.SECONDARY, emptyList(), null);
    }

    public static ReadPreference secondaryPreferred() {
        return of(Mode.SECONDARY_PREFERRED, emptyList(), null);
    }

    public static ReadPreference nearest() {
        return of(Mode.NEAREST, emptyList(), null);
    }

    /**
     * Creates a read preference.
     *
     * @param mode the mode
     * @param tagSets tag sets in the order they should be tried, may be empty
     * @param maxStaleness the staleness bound, {@code null} for none
     * @return the read preference
     * @throws ClientException if tag sets or staleness are combined with the primary mode, or staleness is not
     * positive
     */
    public static ReadPreference of(Mode mode, List<TagSet> tagSets, Duration maxStaleness) {
        Objects.requireNonNull(mode, "mode");
        Objects.requireNonNull(tagSets, "tagSets");
        if (mode == Mode.PRIMARY) {
            if (tagSets.stream().anyMatch(tagSet -> !tagSet.isEmpty())) {
                throw new ClientException("Tag sets can not be used with the primary read preference");
            }
            if (maxStaleness != null) {
                throw new ClientException("Maximum staleness can not be used with the primary read preference");
            }
            return PRIMARY;
        }
        if (maxStaleness != null && (maxStaleness.isNegative() || maxStaleness.isZero())) {
            throw new ClientException("Maximum staleness must be positive, was " + maxStaleness);
        }
        return new ReadPreference(mode, tagSets, maxStaleness);
    }

    public ReadPreference withTagSets(List<TagSet> tagSets) {
        return of(mode, tagSets, maxStaleness);
    }

    public ReadPreference withMaxStaleness(Duration maxStaleness) {
        return of(mode, tagSets, maxStaleness);
    }

    public Mode mode() {
        return mode;
    }

    public List<TagSet> tagSets() {
        return tagSets;
    }

    /**
     * @return the staleness bound, {@code null} when not set
     */
    public Duration maxStaleness() {
        return maxStaleness;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        var that = (ReadPreference) o;
        return mode == that.mode && tagSets.equals(that.tagSets) && Objects.equals(maxStaleness, that.maxStaleness);
    }

    @Override
    public int hashCode() {
        return Objects.hash(mode, tagSets, maxStaleness);
    }

    @Override
    public String toString() {
        var builder = new StringBuilder("ReadPreference{mode=").append(mode.modeName());
        if (!tagSets.isEmpty()) {
            builder.append(", tagSets=").append(tagSets);
        }
        if (maxStaleness != null) {
            builder.append(", maxStaleness=").append(maxStaleness.toSeconds()).append("s");
        }
        return builder.append('}').toString();
    }
}
