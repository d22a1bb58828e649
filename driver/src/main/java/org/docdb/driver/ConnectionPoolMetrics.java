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

/**
 * Counters and timings of the connection pool of one server. Counts are totals since the pool was created, times
 * are in milliseconds.
 *
 * @since 1.0
 */
public interface ConnectionPoolMetrics {
    /**
     * @return id of the pool, unique within the cluster
     */
    String id();

    /**
     * @return connections currently checked out
     */
    int inUse();

    /**
     * @return connections waiting in the pool to be checked out
     */
    int idle();

    /**
     * @return connections currently being opened or authenticated
     */
    int creating();

    long created();

    /**
     * @return connections that could not be opened or failed authentication
     */
    long failedToCreate();

    /**
     * @return connections closed by the pool, because they were stale, idle for too long or the pool was closed
     */
    long closed();

    /**
     * @return checkouts in progress
     */
    int acquiring();

    long acquired();

    /**
     * @return checkouts that gave up because the pool stayed exhausted until their deadline
     */
    long timedOutToAcquire();

    long totalAcquisitionTime();

    long totalConnectionTime();

    /**
     * @return summed time connections spent checked out, see {@link #totalInUseCount()} for the number of checkouts
     */
    long totalInUseTime();

    long totalInUseCount();
}
