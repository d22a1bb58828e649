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
package org.docdb.driver.internal.util;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.concurrent.atomic.AtomicLong;

public class FakeClock extends Clock {
    private final AtomicLong timestamp;

    public FakeClock() {
        this(0);
    }

    public FakeClock(long initialMillis) {
        this.timestamp = new AtomicLong(initialMillis);
    }

    @Override
    public ZoneId getZone() {
        throw new UnsupportedOperationException();
    }

    @Override
    public Clock withZone(ZoneId zone) {
        throw new UnsupportedOperationException();
    }

    @Override
    public Instant instant() {
        return Instant.ofEpochMilli(timestamp.get());
    }

    @Override
    public long millis() {
        return timestamp.get();
    }

    public void progress(long millis) {
        if (millis < 0) {
            throw new IllegalArgumentException("time can only progress forwards");
        }
        timestamp.addAndGet(millis);
    }
}
