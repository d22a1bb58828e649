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
package org.docdb.driver.internal.pool;

import org.docdb.driver.Config;

public record PoolSettings(
        int maxSize, int minSize, long maxIdleTimeMillis, int connectTimeoutMillis, int socketTimeoutMillis) {
    public PoolSettings {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("Max pool size must be positive, was " + maxSize);
        }
        if (minSize < 0 || minSize > maxSize) {
            throw new IllegalArgumentException("Min pool size must be in [0, " + maxSize + "], was " + minSize);
        }
    }

    public static PoolSettings from(Config config) {
        return new PoolSettings(
                config.maxConnectionPoolSize(),
                config.minConnectionPoolSize(),
                config.maxConnectionIdleTimeMillis(),
                config.connectTimeoutMillis(),
                config.socketTimeoutMillis());
    }

    public boolean idleTimeoutEnabled() {
        return maxIdleTimeMillis > 0;
    }
}
