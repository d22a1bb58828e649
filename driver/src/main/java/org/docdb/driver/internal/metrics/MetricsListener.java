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

import java.util.function.IntSupplier;
import org.docdb.driver.ServerAddress;

/**
 * Receives connection pool events of all pools of a cluster, each pool identified by its id.
 */
public interface MetricsListener {
    /**
     * Before opening a new connection.
     *
     * @param poolId the id of the pool the connection will live in.
     * @param openEvent event timing the connect and the authentication.
     */
    void beforeOpening(String poolId, ListenerEvent<?> openEvent);

    /**
     * After a connection is opened and authenticated successfully.
     *
     * @param poolId the id of the pool the connection lives in.
     * @param openEvent the event given to {@link #beforeOpening(String, ListenerEvent)}.
     */
    void afterOpened(String poolId, ListenerEvent<?> openEvent);

    /**
     * After a connection failed to open or to authenticate.
     *
     * @param poolId the id of the pool.
     */
    void afterFailedToOpen(String poolId);

    /**
     * After a pooled connection was closed by its pool.
     *
     * @param poolId the id of the pool the connection lived in.
     */
    void afterDestroyed(String poolId);

    /**
     * When a checkout starts, before an idle connection is taken or a new one is opened.
     *
     * @param poolId the id of the pool.
     * @param checkoutEvent event timing the checkout.
     */
    void beforeCheckout(String poolId, ListenerEvent<?> checkoutEvent);

    /**
     * When a checkout ends, whether it returned a connection or failed.
     *
     * @param poolId the id of the pool.
     */
    void afterCheckout(String poolId);

    /**
     * After a checkout returned a connection.
     *
     * @param poolId the id of the pool.
     * @param checkoutEvent the event given to {@link #beforeCheckout(String, ListenerEvent)}.
     */
    void afterCheckedOut(String poolId, ListenerEvent<?> checkoutEvent);

    /**
     * After the deadline of a checkout passed while the pool was exhausted.
     *
     * @param poolId the id of the pool.
     */
    void afterCheckoutTimedOut(String poolId);

    /**
     * After a connection was handed out of the pool.
     *
     * @param poolId the id of the pool.
     * @param inUseEvent a listener event registered with the connection when handed out.
     */
    void connectionCheckedOut(String poolId, ListenerEvent<?> inUseEvent);

    /**
     * After a connection was returned to the pool.
     *
     * @param poolId the id of the pool.
     * @param inUseEvent the event registered with the connection when handed out.
     */
    void connectionCheckedIn(String poolId, ListenerEvent<?> inUseEvent);

    ListenerEvent<?> createListenerEvent();

    void registerPoolMetrics(
            String poolId, ServerAddress serverAddress, IntSupplier inUseSupplier, IntSupplier idleSupplier);

    void removePoolMetrics(String poolId);
}
