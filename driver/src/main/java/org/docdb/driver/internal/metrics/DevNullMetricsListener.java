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
 * Ignores all pool events. Used unless {@link org.docdb.driver.MetricsAdapter#MICROMETER} is configured.
 */
public enum DevNullMetricsListener implements MetricsListener {
    INSTANCE;

    @Override
    public void registerPoolMetrics(
            String poolId, ServerAddress address, IntSupplier inUseSupplier, IntSupplier idleSupplier) {}

    @Override
    public void removePoolMetrics(String poolId) {}

    @Override
    public ListenerEvent<?> createListenerEvent() {
        return DevNullListenerEvent.INSTANCE;
    }

    @Override
    public void beforeOpening(String poolId, ListenerEvent<?> openEvent) {}

    @Override
    public void afterOpened(String poolId, ListenerEvent<?> openEvent) {}

    @Override
    public void afterFailedToOpen(String poolId) {}

    @Override
    public void afterDestroyed(String poolId) {}

    @Override
    public void beforeCheckout(String poolId, ListenerEvent<?> checkoutEvent) {}

    @Override
    public void afterCheckout(String poolId) {}

    @Override
    public void afterCheckedOut(String poolId, ListenerEvent<?> checkoutEvent) {}

    @Override
    public void afterCheckoutTimedOut(String poolId) {}

    @Override
    public void connectionCheckedOut(String poolId, ListenerEvent<?> inUseEvent) {}

    @Override
    public void connectionCheckedIn(String poolId, ListenerEvent<?> inUseEvent) {}
}
