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

import java.io.Serial;
import java.io.Serializable;
import java.util.Arrays;
import java.util.HexFormat;
import java.util.Objects;

/**
 * Identifier of a primary election. Ordered by unsigned byte-wise comparison, later elections compare greater.
 */
public final class ElectionId implements Comparable<ElectionId>, Serializable {
    @Serial
    private static final long serialVersionUID = 1868127419735217384L;

    private static final int LENGTH = 12;

    private final byte[] bytes;

    private ElectionId(byte[] bytes) {
        if (bytes.length != LENGTH) {
            throw new IllegalArgumentException("Election id must be " + LENGTH + " bytes long, was " + bytes.length);
        }
        this.bytes = bytes;
    }

    public static ElectionId fromBytes(byte[] bytes) {
        return new ElectionId(Objects.requireNonNull(bytes).clone());
    }

    public static ElectionId fromHexString(String hex) {
        try {
            return new ElectionId(HexFormat.of().parseHex(Objects.requireNonNull(hex)));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid election id `" + hex + "`", e);
        }
    }

    public byte[] toByteArray() {
        return bytes.clone();
    }

    @Override
    public int compareTo(ElectionId other) {
        return Arrays.compareUnsigned(bytes, other.bytes);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return Arrays.equals(bytes, ((ElectionId) o).bytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return HexFormat.of().formatHex(bytes);
    }
}
