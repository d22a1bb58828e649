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

import static java.util.Collections.unmodifiableMap;

import java.io.Serial;
import java.io.Serializable;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * An ordered set of key/value labels used to restrict which replica set members a read may go to.
 * A member matches when its own tags contain every entry of the tag set; the empty tag set matches every member.
 */
public final class TagSet implements Serializable {
    @Serial
    private static final long serialVersionUID = -5431928306713524542L;

    private static final TagSet EMPTY = new TagSet(Map.of());

    private final Map<String, String> tags;

    private TagSet(Map<String, String> tags) {
        this.tags = unmodifiableMap(new LinkedHashMap<>(tags));
    }

    public static TagSet empty() {
        return EMPTY;
    }

    public static TagSet of(String name, String value) {
        return of(Map.of(name, value));
    }

    public static TagSet of(Map<String, String> tags) {
        Objects.requireNonNull(tags);
        tags.forEach((name, value) -> {
            Objects.requireNonNull(name, "tag name");
            Objects.requireNonNull(value, "tag value");
        });
        return tags.isEmpty() ? EMPTY : new TagSet(tags);
    }

    public boolean isEmpty() {
        return tags.isEmpty();
    }

    public Map<String, String> asMap() {
        return tags;
    }

    /**
     * @param serverTags the tags advertised by a server
     * @return {@code true} when every tag of this set is present with the same value in the server tags
     */
    public boolean isSubsetOf(Map<String, String> serverTags) {
        for (var entry : tags.entrySet()) {
            if (!entry.getValue().equals(serverTags.get(entry.getKey()))) {
                return false;
            }
        }
        return true;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return tags.equals(((TagSet) o).tags);
    }

    @Override
    public int hashCode() {
        return tags.hashCode();
    }

    @Override
    public String toString() {
        return tags.toString();
    }
}
