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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

import java.time.Duration;
import org.junit.jupiter.api.Test;

class RoundTripTimeAverageTest {
    @Test
    void shouldUseFirstSampleAsIs() {
        var average = new RoundTripTimeAverage();

        assertEquals(Duration.ofMillis(10), average.add(Duration.ofMillis(10)));
    }

    @Test
    void shouldWeightNewSamplesByOneFifth() {
        var average = new RoundTripTimeAverage();
        average.add(Duration.ofMillis(10));

        var updated = average.add(Duration.ofMillis(20));

        assertEquals(Duration.ofMillis(12), updated);
        assertEquals(updated, average.average());
    }

    @Test
    void shouldStartOverAfterReset() {
        var average = new RoundTripTimeAverage();
        average.add(Duration.ofMillis(100));

        average.reset();

        assertNull(average.average());
        assertEquals(Duration.ofMillis(7), average.add(Duration.ofMillis(7)));
    }
}
