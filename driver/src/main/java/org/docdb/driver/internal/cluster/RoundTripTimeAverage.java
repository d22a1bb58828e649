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

import java.time.Duration;

/**
 * Exponentially weighted moving average of heartbeat round-trip times. Only used from the monitor thread.
 */
public class RoundTripTimeAverage {
    static final double ALPHA = 0.2;

    private Duration average;

    /**
     * Fold a sample into the average. The first sample after construction or {@link #reset()} seeds it.
     *
     * @param sample measured round-trip time
     * @return the new average
     */
    public Duration add(Duration sample) {
        if (average == null) {
            average = sample;
        } else {
            var nanos = ALPHA * sample.toNanos() + (1 - ALPHA) * average.toNanos();
            average = Duration.ofNanos(Math.round(nanos));
        }
        return average;
    }

    public Duration average() {
        return average;
    }

    public void reset() {
        average = null;
    }
}
