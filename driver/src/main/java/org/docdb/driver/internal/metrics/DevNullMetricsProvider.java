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
package org.docdb.driver.internal.metrics;

import org.docdb.driver.Metrics;
import org.docdb.driver.exceptions.ClientException;

public enum DevNullMetricsProvider implements MetricsProvider {
    INSTANCE;

    @Override
    public Metrics metrics() {
        throw new ClientException("Connection pool metrics are not enabled, configure "
                + "Config.builder().withMetricsAdapter(MetricsAdapter.MICROMETER) to collect them");
    }

    @Override
    public MetricsListener metricsListener() {
        // Internally we can still register callbacks to this empty metrics listener.
        return DevNullMetricsListener.INSTANCE;
    }
}
