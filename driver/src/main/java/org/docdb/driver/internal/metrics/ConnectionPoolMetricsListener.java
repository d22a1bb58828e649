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

/**
 * Events of a single pool, see {@link MetricsListener} for the cluster-wide counterpart keyed by pool id.
 */
interface ConnectionPoolMetricsListener {
    void beforeOpening(ListenerEvent<?> openEvent);

    void afterOpened(ListenerEvent<?> openEvent);

    /**
     * The connect or the authentication of a new connection failed.
     */
    void afterFailedToOpen();

    void afterDestroyed();

    void beforeCheckout(ListenerEvent<?> checkoutEvent);

    /**
     * A checkout ended, with or without a connection.
     */
    void afterCheckout();

    void afterCheckedOut(ListenerEvent<?> checkoutEvent);

    void afterCheckoutTimedOut();

    void connectionCheckedOut(ListenerEvent<?> inUseEvent);

    void connectionCheckedIn(ListenerEvent<?> inUseEvent);
}
