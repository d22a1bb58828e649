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

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

class RoundRobinArrayIndexTest {
    @Test
    void shouldHandleZeroLength() {
        assertEquals(-1, new RoundRobinArrayIndex().next(0));
    }

    @Test
    void shouldReturnIndexesInRoundRobinOrder() {
        var index = new RoundRobinArrayIndex();

        for (var i = 0; i < 6; i++) {
            assertEquals(i % 3, index.next(3));
        }
    }

    @Test
    void shouldWrapAroundOnOverflow() {
        var index = new RoundRobinArrayIndex(Integer.MAX_VALUE - 1);

        assertEquals((Integer.MAX_VALUE - 1) % 4, index.next(4));
        assertEquals(Integer.MAX_VALUE % 4, index.next(4));
        assertEquals(0, index.next(4));
        assertEquals(1, index.next(4));
    }
}
